package se.ironpass_be.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CancelPaymentRequest {

    @NotBlank(message = "A cancellation reason is required")
    private String reason;
}
