package se.ironpass_be.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import se.ironpass_be.dto.PartialPaymentsConfig;
import se.ironpass_be.dto.PaymentAccessResult;
import se.ironpass_be.pojo.Membership;
import se.ironpass_be.pojo.MembershipPlan;
import se.ironpass_be.pojo.enums.MembershipStatus;
import se.ironpass_be.pojo.enums.PaymentStatus;
import se.ironpass_be.repository.MembershipRepository;
import se.ironpass_be.repository.PaymentRepository;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PaymentLedgerService")
class PaymentLedgerServiceTest {

    private static final Instant NOW = Instant.parse("2026-04-20T09:00:00Z");
    private static final Long MEMBER_ID = 7L;

    @Mock
    private PaymentRepository paymentRepository;

    @Mock
    private MembershipRepository membershipRepository;

    @Mock
    private SettingsService settingsService;

    private PaymentLedgerService ledger;

    @BeforeEach
    void setUp() {
        ledger = new PaymentLedgerService(paymentRepository, membershipRepository, settingsService,
                new PaymentStatusCalculator(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static PartialPaymentsConfig config(boolean enabled, boolean allowPartial) {
        return PartialPaymentsConfig.builder()
                .enabled(enabled)
                .deadlineDays(15)
                .gracePeriodDays(5)
                .allowAccessWithPartial(allowPartial)
                .build();
    }

    private void givenMembership(int daysSinceStart, String paid) {
        Membership membership = Membership.builder()
                .membershipId(11L)
                .status(MembershipStatus.ACTIVE)
                .startsAt(NOW.minus(Duration.ofDays(daysSinceStart)))
                .endsAt(NOW.plus(Duration.ofDays(20)))
                .totalAmount(new BigDecimal("100000"))
                .build();
        when(membershipRepository.findLatestByMemberAndStatuses(eq(MEMBER_ID), any()))
                .thenReturn(Optional.of(membership));
        when(paymentRepository.sumActiveAmountByMembership(11L)).thenReturn(new BigDecimal(paid));
    }

    @Test
    @DisplayName("passes without touching the ledger while partial payments are off")
    void disabledFeature() {
        when(settingsService.getPartialPaymentsConfig()).thenReturn(config(false, false));

        PaymentAccessResult result = ledger.checkMemberPaymentAccess(MEMBER_ID);

        assertThat(result.isCanAccess()).isTrue();
        verifyNoInteractions(paymentRepository, membershipRepository);
    }

    @Test
    @DisplayName("denies when no active or frozen membership exists")
    void noMembership() {
        when(settingsService.getPartialPaymentsConfig()).thenReturn(config(true, true));
        when(membershipRepository.findLatestByMemberAndStatuses(eq(MEMBER_ID), any())).thenReturn(Optional.empty());

        PaymentAccessResult result = ledger.checkMemberPaymentAccess(MEMBER_ID);

        assertThat(result.isCanAccess()).isFalse();
        assertThat(result.getReason()).isEqualTo("No active membership");
    }

    @Test
    @DisplayName("overdue balance denies with the pending amount")
    void overdue() {
        when(settingsService.getPartialPaymentsConfig()).thenReturn(config(true, true));
        givenMembership(22, "0");

        PaymentAccessResult result = ledger.checkMemberPaymentAccess(MEMBER_ID);

        assertThat(result.isCanAccess()).isFalse();
        assertThat(result.getReason()).isEqualTo("Payment overdue. Pending balance: $100,000");
        assertThat(result.getPaymentInfo().getPaymentStatus()).isEqualTo(PaymentStatus.OVERDUE);
    }

    @Test
    @DisplayName("partial balance passes when the policy allows it")
    void partialAllowed() {
        when(settingsService.getPartialPaymentsConfig()).thenReturn(config(true, true));
        givenMembership(10, "40000");

        PaymentAccessResult result = ledger.checkMemberPaymentAccess(MEMBER_ID);

        assertThat(result.isCanAccess()).isTrue();
        assertThat(result.getPaymentInfo().getPendingAmount()).isEqualByComparingTo("60000");
    }

    @Test
    @DisplayName("a never paid membership names the full amount when partial access is off")
    void neverPaidDenied() {
        when(settingsService.getPartialPaymentsConfig()).thenReturn(config(true, false));
        givenMembership(2, "0");

        PaymentAccessResult result = ledger.checkMemberPaymentAccess(MEMBER_ID);

        assertThat(result.isCanAccess()).isFalse();
        assertThat(result.getReason()).isEqualTo("Payment pending. $100,000 required for access");
    }

    @Test
    @DisplayName("a part paid membership names the balance when partial access is off")
    void incompleteDenied() {
        when(settingsService.getPartialPaymentsConfig()).thenReturn(config(true, false));
        givenMembership(2, "40000");

        PaymentAccessResult result = ledger.checkMemberPaymentAccess(MEMBER_ID);

        assertThat(result.isCanAccess()).isFalse();
        assertThat(result.getReason()).isEqualTo("Incomplete payment. Pending balance: $60,000");
    }

    @Test
    @DisplayName("the paid amount is zero when the ledger is empty")
    void emptyLedger() {
        when(paymentRepository.sumActiveAmountByMembership(anyLong())).thenReturn(null);

        assertThat(ledger.getPaidAmount(3L)).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    @DisplayName("falls back to the plan price when no amount was captured")
    void planPriceFallback() {
        Membership legacy = Membership.builder()
                .plan(MembershipPlan.builder().price(new BigDecimal("80000")).build())
                .build();

        assertThat(PaymentLedgerService.totalAmountOf(legacy)).isEqualByComparingTo("80000");
    }
}
