package se.ironpass_be.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ManualAccessRequest {

    @NotNull(message = "Member ID cannot be null")
    private Long memberId;
}
