package se.ironpass_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.ironpass_be.dto.MembershipStatusSnapshot;
import se.ironpass_be.dto.OverdueStatus;
import se.ironpass_be.dto.PaymentAccessResult;
import se.ironpass_be.dto.response.AccessVerdict;
import se.ironpass_be.dto.response.PaymentInfo;
import se.ironpass_be.mapper.ModelMapper;
import se.ironpass_be.pojo.Member;
import se.ironpass_be.pojo.Membership;
import se.ironpass_be.pojo.enums.MembershipStatus;
import se.ironpass_be.repository.MemberRepository;
import se.ironpass_be.util.AmountFormatter;

import java.time.Clock;
import java.util.Optional;

/**
 * Decides whether a member may enter right now. The checks run in a fixed order and the first
 * one that fails produces the verdict. Nothing is written here: callers log the verdict.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessDecisionService {

    public static final String REASON_MEMBER_NOT_FOUND = "Member not found";
    public static final String REASON_MEMBER_INACTIVE = "Member account inactive";
    public static final String REASON_NO_ACTIVE_MEMBERSHIP = PaymentLedgerService.REASON_NO_ACTIVE_MEMBERSHIP;
    public static final String REASON_MEMBERSHIP_EXPIRED = "Membership expired";
    public static final String REASON_MEMBERSHIP_FROZEN = "Membership frozen";
    public static final String REASON_MEMBERSHIP_CANCELLED = "Membership cancelled";
    public static final String REASON_AWAITING_FIRST_PAYMENT =
            "Membership awaiting first payment - record a payment to activate";
    public static final String REASON_ACCESS_GRANTED = "Access granted";

    static final int DEADLINE_WARNING_DAYS = 5;

    private final MemberRepository memberRepository;
    private final MembershipService membershipService;
    private final MembershipStatusCalculator membershipStatusCalculator;
    private final PaymentLedgerService paymentLedgerService;
    private final ModelMapper modelMapper;
    private final Clock clock;

    @Transactional(readOnly = true)
    public AccessVerdict evaluate(Long memberId) {
        Optional<Member> memberOpt = memberRepository.findById(memberId);
        if (memberOpt.isEmpty()) {
            return AccessVerdict.deny(REASON_MEMBER_NOT_FOUND);
        }

        Member member = memberOpt.get();
        AccessVerdict.MemberSummary memberSummary = modelMapper.toMemberSummary(member);
        if (!member.isActive()) {
            return AccessVerdict.deny(REASON_MEMBER_INACTIVE, memberSummary);
        }

        Optional<Membership> membershipOpt = membershipService.getCurrentMembership(memberId);
        if (membershipOpt.isEmpty()) {
            return AccessVerdict.deny(REASON_NO_ACTIVE_MEMBERSHIP, memberSummary);
        }

        Membership membership = membershipOpt.get();
        MembershipStatusSnapshot snapshot = membershipStatusCalculator.calculate(membership, clock.instant());
        AccessVerdict.MembershipSummary membershipSummary = modelMapper.toMembershipSummary(membership, snapshot);

        switch (snapshot.getCalculatedStatus()) {
            case EXPIRED:
                return deny(REASON_MEMBERSHIP_EXPIRED, memberSummary, membershipSummary, null);
            case FROZEN:
                return deny(REASON_MEMBERSHIP_FROZEN, memberSummary, membershipSummary, null);
            case CANCELLED:
                return deny(REASON_MEMBERSHIP_CANCELLED, memberSummary, membershipSummary, null);
            default:
                break;
        }

        if (membership.getStatus() == MembershipStatus.PENDING_PAYMENT) {
            return deny(REASON_AWAITING_FIRST_PAYMENT, memberSummary, membershipSummary, null);
        }

        OverdueStatus overdue = membershipService.checkMemberOverdue(memberId);
        if (overdue.isOverdue()) {
            return deny("Overdue (" + overdue.getDaysPastDue() + " days past due)",
                    memberSummary, membershipSummary, null);
        }

        PaymentAccessResult paymentAccess = paymentLedgerService.checkMemberPaymentAccess(memberId);
        if (!paymentAccess.isCanAccess()) {
            return deny(paymentAccess.getReason(), memberSummary, membershipSummary, paymentAccess.getPaymentInfo());
        }

        PaymentInfo paymentInfo = paymentAccess.getPaymentInfo();
        return AccessVerdict.builder()
                .allowed(true)
                .reason(REASON_ACCESS_GRANTED)
                .member(memberSummary)
                .membership(membershipSummary)
                .paymentInfo(paymentInfo)
                .paymentWarning(paymentWarning(paymentInfo))
                .build();
    }

    static String paymentWarning(PaymentInfo paymentInfo) {
        if (paymentInfo == null || paymentInfo.getPendingAmount() == null
                || paymentInfo.getPendingAmount().signum() <= 0) {
            return null;
        }

        StringBuilder warning = new StringBuilder("Pending balance: ")
                .append(AmountFormatter.format(paymentInfo.getPendingAmount()));

        long days = paymentInfo.getDaysUntilDeadline();
        if (days > 0 && days <= DEADLINE_WARNING_DAYS) {
            warning.append(". Deadline in ").append(days).append(days == 1 ? " day" : " days");
        } else if (days <= 0) {
            warning.append(". Payment deadline passed");
        }
        return warning.toString();
    }

    private AccessVerdict deny(String reason,
                               AccessVerdict.MemberSummary member,
                               AccessVerdict.MembershipSummary membership,
                               PaymentInfo paymentInfo) {
        return AccessVerdict.builder()
                .allowed(false)
                .reason(reason)
                .member(member)
                .membership(membership)
                .paymentInfo(paymentInfo)
                .build();
    }
}
