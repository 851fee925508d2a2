package se.ironpass_be.controller;

import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;
import se.ironpass_be.dto.request.CancelPaymentRequest;
import se.ironpass_be.dto.request.PaymentRequest;
import se.ironpass_be.dto.response.ApiResponse;
import se.ironpass_be.dto.response.PaymentResponse;
import se.ironpass_be.service.PaymentService;
import se.ironpass_be.service.StaffService;

@RestController
@RequestMapping("/api/v1/payments")
@Tag(name = "Payments", description = "Recording and voiding member payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;
    private final StaffService staffService;

    @PostMapping
    public ResponseEntity<ApiResponse<PaymentResponse>> recordPayment(
            @Valid @RequestBody PaymentRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails currentUser) {
        PaymentResponse payment = paymentService.recordPayment(request, staffService.getCurrentStaff(currentUser));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Payment recorded successfully", payment));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse<PaymentResponse>> cancelPayment(
            @PathVariable Long id,
            @Valid @RequestBody CancelPaymentRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails currentUser) {
        PaymentResponse payment = paymentService.cancelPayment(id, request.getReason(), staffService.getCurrentStaff(currentUser));
        return ResponseEntity.ok(ApiResponse.success("Payment cancelled", payment));
    }
}
