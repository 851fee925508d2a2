package se.ironpass_be.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import se.ironpass_be.dto.PartialPaymentsConfig;
import se.ironpass_be.dto.response.PaymentInfo;
import se.ironpass_be.pojo.enums.PaymentStatus;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PaymentStatusCalculator")
class PaymentStatusCalculatorTest {

    private static final Instant STARTS_AT = Instant.parse("2026-01-01T10:00:00Z");
    private static final BigDecimal TOTAL = new BigDecimal("100000");

    private final PaymentStatusCalculator calculator = new PaymentStatusCalculator();

    private final PartialPaymentsConfig config = PartialPaymentsConfig.builder()
            .enabled(true)
            .deadlineDays(15)
            .gracePeriodDays(5)
            .allowAccessWithPartial(true)
            .build();

    private PaymentInfo calculate(String paid, int daysAfterStart) {
        return calculator.calculate(TOTAL, new BigDecimal(paid), STARTS_AT, config,
                STARTS_AT.plus(Duration.ofDays(daysAfterStart)));
    }

    @Test
    @DisplayName("nothing paid 22 days in is overdue at -7 days")
    void neverPaidPastGrace() {
        PaymentInfo info = calculate("0", 22);

        assertThat(info.getDaysUntilDeadline()).isEqualTo(-7);
        assertThat(info.getPaymentStatus()).isEqualTo(PaymentStatus.OVERDUE);
        assertThat(info.isOverduePayment()).isTrue();
        assertThat(info.getPendingAmount()).isEqualByComparingTo("100000");
        assertThat(info.getPaymentDeadline()).isEqualTo(STARTS_AT.plus(Duration.ofDays(15)));
    }

    @Test
    @DisplayName("part paid 10 days in is partial with 5 days left")
    void partialBeforeDeadline() {
        PaymentInfo info = calculate("40000", 10);

        assertThat(info.getPaymentStatus()).isEqualTo(PaymentStatus.PARTIAL);
        assertThat(info.getDaysUntilDeadline()).isEqualTo(5);
        assertThat(info.getPendingAmount()).isEqualByComparingTo("60000");
        assertThat(info.isOverduePayment()).isFalse();
    }

    @Test
    @DisplayName("part paid past the grace window is overdue")
    void partialPastGrace() {
        PaymentInfo info = calculate("40000", 21);

        assertThat(info.getDaysUntilDeadline()).isEqualTo(-6);
        assertThat(info.getPaymentStatus()).isEqualTo(PaymentStatus.OVERDUE);
    }

    @Test
    @DisplayName("the last day of grace is still pending")
    void lastGraceDay() {
        PaymentInfo info = calculate("0", 20);

        assertThat(info.getDaysUntilDeadline()).isEqualTo(-5);
        assertThat(info.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(info.isOverduePayment()).isFalse();
    }

    @ParameterizedTest(name = "paid {0} of 100000 -> {1}")
    @CsvSource({
            "100000, PAID",
            "150000, PAID",
            "99999.99, PARTIAL",
            "0, PENDING"
    })
    @DisplayName("paid exactly when nothing is pending, overpayment included")
    void paidIffNothingPending(String paid, PaymentStatus expected) {
        PaymentInfo info = calculate(paid, 3);

        assertThat(info.getPaymentStatus()).isEqualTo(expected);
        assertThat(info.getPendingAmount().signum() <= 0).isEqualTo(expected == PaymentStatus.PAID);
        assertThat(info.getPendingAmount().signum()).isGreaterThanOrEqualTo(0);
    }

    @Test
    @DisplayName("fully paid stays paid long after the deadline")
    void paidNeverOverdue() {
        PaymentInfo info = calculate("100000", 400);

        assertThat(info.getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(info.isOverduePayment()).isFalse();
    }
}
