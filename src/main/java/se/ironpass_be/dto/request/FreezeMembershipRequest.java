package se.ironpass_be.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class FreezeMembershipRequest {

    @NotNull(message = "Days cannot be null")
    @Positive(message = "Days must be positive")
    @Max(value = 365, message = "A membership cannot be frozen for more than a year")
    private Integer days;
}
