package se.ironpass_be.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.ToString;

@Data
public class QrValidationRequest {

    @NotBlank(message = "QR code cannot be blank")
    @Size(max = 256, message = "QR code is too long")
    @ToString.Exclude
    private String token;
}
