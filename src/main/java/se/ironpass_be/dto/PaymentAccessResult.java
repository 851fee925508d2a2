package se.ironpass_be.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.ironpass_be.dto.response.PaymentInfo;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentAccessResult {
    private boolean canAccess;
    private String reason;
    private PaymentInfo paymentInfo;

    public static PaymentAccessResult pass(PaymentInfo paymentInfo) {
        return new PaymentAccessResult(true, null, paymentInfo);
    }

    public static PaymentAccessResult deny(String reason, PaymentInfo paymentInfo) {
        return new PaymentAccessResult(false, reason, paymentInfo);
    }
}
