package se.ironpass_be.service;

import org.springframework.stereotype.Component;
import se.ironpass_be.dto.PartialPaymentsConfig;
import se.ironpass_be.dto.response.PaymentInfo;
import se.ironpass_be.pojo.enums.PaymentStatus;
import se.ironpass_be.util.DayMath;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Single home of the partial payment decision table. Every caller that needs to know whether
 * a membership is paid goes through here.
 */
@Component
public class PaymentStatusCalculator {

    /**
     * @param totalAmount price snapshot of the membership
     * @param paidAmount  sum of the non-cancelled payments
     * @param startsAt    start of the membership, the deadline counts from here
     */
    public PaymentInfo calculate(BigDecimal totalAmount,
                                 BigDecimal paidAmount,
                                 Instant startsAt,
                                 PartialPaymentsConfig config,
                                 Instant now) {
        BigDecimal total = totalAmount == null ? BigDecimal.ZERO : totalAmount;
        BigDecimal paid = paidAmount == null ? BigDecimal.ZERO : paidAmount;
        BigDecimal pending = total.subtract(paid).max(BigDecimal.ZERO);

        Instant deadline = startsAt.plus(Duration.ofDays(config.getDeadlineDays()));
        long daysUntilDeadline = DayMath.ceilDaysBetween(now, deadline);
        boolean pastGrace = daysUntilDeadline < -config.getGracePeriodDays();

        PaymentStatus status;
        if (pending.signum() <= 0) {
            status = PaymentStatus.PAID;
        } else if (paid.signum() > 0) {
            status = pastGrace ? PaymentStatus.OVERDUE : PaymentStatus.PARTIAL;
        } else {
            status = pastGrace ? PaymentStatus.OVERDUE : PaymentStatus.PENDING;
        }

        return PaymentInfo.builder()
                .totalAmount(total)
                .paidAmount(paid)
                .pendingAmount(pending)
                .paymentStatus(status)
                .paymentDeadline(deadline)
                .daysUntilDeadline(daysUntilDeadline)
                .overduePayment(status == PaymentStatus.OVERDUE)
                .build();
    }
}
