package se.ironpass_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QrTokenResponse {
    // Plaintext, returned once for QR rendering and never stored
    @ToString.Exclude
    private String token;
    // PNG data URL of the same code
    @ToString.Exclude
    private String qrImage;
    private Instant expiresAt;
    private int durationSeconds;
}
