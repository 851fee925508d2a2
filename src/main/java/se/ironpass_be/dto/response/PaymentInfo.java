package se.ironpass_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.ironpass_be.pojo.enums.PaymentStatus;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Derived payment position of one membership. Recomputed on every request from the
 * membership snapshot, the non-cancelled payments and the partial payment settings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentInfo {
    private BigDecimal totalAmount;
    private BigDecimal paidAmount;
    private BigDecimal pendingAmount;
    private PaymentStatus paymentStatus;
    private Instant paymentDeadline;
    private long daysUntilDeadline;
    private boolean overduePayment;
}
