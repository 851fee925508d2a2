package se.ironpass_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.ironpass_be.dto.PartialPaymentsConfig;
import se.ironpass_be.dto.PaymentAccessResult;
import se.ironpass_be.dto.response.PaymentInfo;
import se.ironpass_be.pojo.Membership;
import se.ironpass_be.pojo.Payment;
import se.ironpass_be.pojo.enums.MembershipStatus;
import se.ironpass_be.pojo.enums.PaymentStatus;
import se.ironpass_be.repository.MembershipRepository;
import se.ironpass_be.repository.PaymentRepository;
import se.ironpass_be.util.AmountFormatter;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read side of the payment ledger: what has been paid on a membership, and what that means
 * for access under the partial payment policy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentLedgerService {

    static final Set<MembershipStatus> PAYABLE_STATUSES = EnumSet.of(MembershipStatus.ACTIVE, MembershipStatus.FROZEN);

    public static final String REASON_NO_ACTIVE_MEMBERSHIP = "No active membership";

    private final PaymentRepository paymentRepository;
    private final MembershipRepository membershipRepository;
    private final SettingsService settingsService;
    private final PaymentStatusCalculator paymentStatusCalculator;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<Payment> getActivePayments(Long membershipId) {
        return paymentRepository.findByMembershipMembershipIdAndCancelledAtIsNull(membershipId);
    }

    @Transactional(readOnly = true)
    public BigDecimal getPaidAmount(Long membershipId) {
        BigDecimal paid = paymentRepository.sumActiveAmountByMembership(membershipId);
        return paid == null ? BigDecimal.ZERO : paid;
    }

    @Transactional(readOnly = true)
    public PaymentInfo calculatePaymentInfo(Membership membership) {
        return calculatePaymentInfo(membership, settingsService.getPartialPaymentsConfig(), clock.instant());
    }

    @Transactional(readOnly = true)
    public PaymentInfo calculatePaymentInfo(Membership membership, PartialPaymentsConfig config, Instant now) {
        return paymentStatusCalculator.calculate(
                totalAmountOf(membership),
                getPaidAmount(membership.getMembershipId()),
                membership.getStartsAt(),
                config,
                now);
    }

    /**
     * Payment gate of the access check. Always passes while the partial payment feature is off.
     */
    @Transactional(readOnly = true)
    public PaymentAccessResult checkMemberPaymentAccess(Long memberId) {
        PartialPaymentsConfig config = settingsService.getPartialPaymentsConfig();
        if (!config.isEnabled()) {
            return PaymentAccessResult.pass(null);
        }

        Optional<Membership> membership = membershipRepository.findLatestByMemberAndStatuses(memberId, PAYABLE_STATUSES);
        if (membership.isEmpty()) {
            return PaymentAccessResult.deny(REASON_NO_ACTIVE_MEMBERSHIP, null);
        }

        PaymentInfo paymentInfo = calculatePaymentInfo(membership.get(), config, clock.instant());

        if (paymentInfo.getPaymentStatus() == PaymentStatus.PAID) {
            return PaymentAccessResult.pass(paymentInfo);
        }

        if (paymentInfo.getPaymentStatus() == PaymentStatus.OVERDUE) {
            return PaymentAccessResult.deny(
                    "Payment overdue. Pending balance: " + AmountFormatter.format(paymentInfo.getPendingAmount()),
                    paymentInfo);
        }

        // PARTIAL or PENDING
        if (config.isAllowAccessWithPartial()) {
            return PaymentAccessResult.pass(paymentInfo);
        }
        if (paymentInfo.getPaidAmount().signum() == 0) {
            return PaymentAccessResult.deny(
                    "Payment pending. " + AmountFormatter.format(paymentInfo.getTotalAmount()) + " required for access",
                    paymentInfo);
        }
        return PaymentAccessResult.deny(
                "Incomplete payment. Pending balance: " + AmountFormatter.format(paymentInfo.getPendingAmount()),
                paymentInfo);
    }

    // Snapshot taken at creation, plan price only for rows created before snapshots existed
    static BigDecimal totalAmountOf(Membership membership) {
        if (membership.getTotalAmount() != null) {
            return membership.getTotalAmount();
        }
        return membership.getPlan() != null ? membership.getPlan().getPrice() : BigDecimal.ZERO;
    }
}
