package se.ironpass_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.ironpass_be.dto.request.QrValidationRequest;
import se.ironpass_be.dto.response.ApiResponse;
import se.ironpass_be.dto.response.QrTokenResponse;
import se.ironpass_be.dto.response.QrTokenStatusResponse;
import se.ironpass_be.service.QrTokenService;

@RestController
@RequestMapping("/api/v1/qr-tokens")
@Tag(name = "QR Tokens", description = "Issuing short-lived single-use entry codes")
@RequiredArgsConstructor
public class QrTokenController {

    private final QrTokenService qrTokenService;

    @Operation(summary = "Issue a QR code for a member", description = "The plaintext code is only returned by this call.")
    @PostMapping("/members/{memberId}")
    public ResponseEntity<ApiResponse<QrTokenResponse>> issueToken(@PathVariable Long memberId) {
        QrTokenResponse token = qrTokenService.issueToken(memberId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("QR code issued", token));
    }

    @Operation(summary = "Check a scanned code without consuming it")
    @PostMapping("/status")
    public ResponseEntity<ApiResponse<QrTokenStatusResponse>> getTokenStatus(@Valid @RequestBody QrValidationRequest request) {
        return ResponseEntity.ok(ApiResponse.success(qrTokenService.getTokenStatus(request.getToken())));
    }
}
