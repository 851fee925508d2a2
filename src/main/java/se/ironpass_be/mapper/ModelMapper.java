package se.ironpass_be.mapper;

import org.springframework.stereotype.Component;
import se.ironpass_be.dto.MembershipStatusSnapshot;
import se.ironpass_be.dto.response.AccessLogResponse;
import se.ironpass_be.dto.response.AccessVerdict;
import se.ironpass_be.dto.response.MemberResponse;
import se.ironpass_be.dto.response.MembershipPlanResponse;
import se.ironpass_be.dto.response.MembershipResponse;
import se.ironpass_be.dto.response.PaymentInfo;
import se.ironpass_be.dto.response.PaymentResponse;
import se.ironpass_be.pojo.AccessLog;
import se.ironpass_be.pojo.Member;
import se.ironpass_be.pojo.Membership;
import se.ironpass_be.pojo.MembershipPlan;
import se.ironpass_be.pojo.Payment;
import se.ironpass_be.pojo.StaffUser;

@Component
public class ModelMapper {

    public AccessVerdict.MemberSummary toMemberSummary(Member member) {
        if (member == null) return null;
        return AccessVerdict.MemberSummary.builder()
                .id(member.getMemberId())
                .firstName(member.getFirstName())
                .lastName(member.getLastName())
                .email(member.getEmail())
                .build();
    }

    public AccessVerdict.MembershipSummary toMembershipSummary(Membership membership, MembershipStatusSnapshot snapshot) {
        if (membership == null) return null;
        return AccessVerdict.MembershipSummary.builder()
                .planName(membership.getPlan() != null ? membership.getPlan().getName() : null)
                .daysRemaining(snapshot.getDaysRemaining())
                .endsAt(membership.getEndsAt())
                .build();
    }

    public MemberResponse toMemberResponse(Member member) {
        if (member == null) return null;
        return MemberResponse.builder()
                .id(member.getMemberId())
                .firstName(member.getFirstName())
                .lastName(member.getLastName())
                .email(member.getEmail())
                .phone(member.getPhone())
                .notes(member.getNotes())
                .active(member.isActive())
                .createdAt(member.getCreatedAt())
                .build();
    }

    public MembershipPlanResponse toMembershipPlanResponse(MembershipPlan plan) {
        if (plan == null) return null;
        return MembershipPlanResponse.builder()
                .id(plan.getPlanId())
                .name(plan.getName())
                .description(plan.getDescription())
                .price(plan.getPrice())
                .durationDays(plan.getDurationDays())
                .active(plan.isActive())
                .build();
    }

    public MembershipResponse toMembershipResponse(Membership membership,
                                                   MembershipStatusSnapshot snapshot,
                                                   PaymentInfo paymentInfo) {
        if (membership == null) return null;
        MembershipResponse.MembershipResponseBuilder builder = MembershipResponse.builder()
                .id(membership.getMembershipId())
                .status(membership.getStatus())
                .calculatedStatus(snapshot.getCalculatedStatus())
                .daysRemaining(snapshot.getDaysRemaining())
                .startsAt(membership.getStartsAt())
                .endsAt(membership.getEndsAt())
                .totalAmount(membership.getTotalAmount())
                .frozenDays(membership.getFrozenDays())
                .frozenAt(membership.getFrozenAt())
                .cancelledAt(membership.getCancelledAt())
                .paymentInfo(paymentInfo);

        Member member = membership.getMember();
        if (member != null) {
            builder.memberId(member.getMemberId()).memberName(member.getFullName());
        }
        if (membership.getPlan() != null) {
            builder.planId(membership.getPlan().getPlanId()).planName(membership.getPlan().getName());
        }
        return builder.build();
    }

    public PaymentResponse toPaymentResponse(Payment payment) {
        if (payment == null) return null;
        return PaymentResponse.builder()
                .id(payment.getPaymentId())
                .memberId(payment.getMember() != null ? payment.getMember().getMemberId() : null)
                .membershipId(payment.getMembership() != null ? payment.getMembership().getMembershipId() : null)
                .amount(payment.getAmount())
                .method(payment.getMethod())
                .reference(payment.getReference())
                .notes(payment.getNotes())
                .receivedByName(staffName(payment.getReceivedBy()))
                .paidAt(payment.getPaidAt())
                .cancelled(payment.isCancelled())
                .cancelledAt(payment.getCancelledAt())
                .cancelledByName(staffName(payment.getCancelledBy()))
                .cancellationReason(payment.getCancellationReason())
                .build();
    }

    public AccessLogResponse toAccessLogResponse(AccessLog accessLog) {
        if (accessLog == null) return null;
        AccessLogResponse.AccessLogResponseBuilder builder = AccessLogResponse.builder()
                .id(accessLog.getId())
                .method(accessLog.getMethod())
                .allowed(accessLog.isAllowed())
                .reason(accessLog.getReason())
                .qrTokenId(accessLog.getQrToken() != null ? accessLog.getQrToken().getId() : null)
                .accessedAt(accessLog.getAccessedAt());

        if (accessLog.getMember() != null) {
            builder.memberId(accessLog.getMember().getMemberId())
                    .memberName(accessLog.getMember().getFullName());
        }
        if (accessLog.getVerifiedBy() != null) {
            builder.verifiedById(accessLog.getVerifiedBy().getStaffId())
                    .verifiedByName(accessLog.getVerifiedBy().getName());
        }
        return builder.build();
    }

    private String staffName(StaffUser staff) {
        return staff != null ? staff.getName() : null;
    }
}
