package se.ironpass_be.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import se.ironpass_be.pojo.enums.PaymentMethod;

import java.math.BigDecimal;

@Data
public class PaymentRequest {

    @NotNull(message = "Member ID cannot be null")
    private Long memberId;

    // When empty the payment is attached to the member's membership awaiting payment, if any
    private Long membershipId;

    @NotNull(message = "Amount cannot be null")
    @Positive(message = "Amount must be positive")
    private BigDecimal amount;

    @NotNull(message = "Payment method cannot be null")
    private PaymentMethod method;

    private String reference;

    private String notes;
}
