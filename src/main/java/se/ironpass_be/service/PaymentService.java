package se.ironpass_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.ironpass_be.dto.request.PaymentRequest;
import se.ironpass_be.dto.response.PaymentResponse;
import se.ironpass_be.exception.BusinessLogicException;
import se.ironpass_be.exception.ResourceNotFoundException;
import se.ironpass_be.mapper.ModelMapper;
import se.ironpass_be.pojo.Member;
import se.ironpass_be.pojo.Membership;
import se.ironpass_be.pojo.Payment;
import se.ironpass_be.pojo.StaffUser;
import se.ironpass_be.pojo.enums.MembershipStatus;
import se.ironpass_be.repository.MemberRepository;
import se.ironpass_be.repository.MembershipRepository;
import se.ironpass_be.repository.PaymentRepository;

import java.time.Clock;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private final PaymentRepository paymentRepository;
    private final MemberRepository memberRepository;
    private final MembershipRepository membershipRepository;
    private final MembershipService membershipService;
    private final ModelMapper modelMapper;
    private final Clock clock;

    /**
     * Records a payment. Without an explicit membership the payment goes to the member's
     * newest membership awaiting payment, and that membership is activated.
     */
    @Transactional
    public PaymentResponse recordPayment(PaymentRequest request, StaffUser receivedBy) {
        Member member = memberRepository.findById(request.getMemberId())
                .orElseThrow(() -> new ResourceNotFoundException("Member not found with id: " + request.getMemberId()));

        if (request.getAmount() == null || request.getAmount().signum() <= 0) {
            throw new BusinessLogicException("Payment amount must be positive");
        }

        Membership membership = null;
        if (request.getMembershipId() != null) {
            membership = membershipRepository.findById(request.getMembershipId())
                    .orElseThrow(() -> new ResourceNotFoundException("Membership not found with id: " + request.getMembershipId()));
            if (!membership.getMember().getMemberId().equals(member.getMemberId())) {
                throw new BusinessLogicException("Membership does not belong to this member");
            }
        } else {
            membership = membershipRepository
                    .findFirstByMemberMemberIdAndStatusOrderByCreatedAtDesc(member.getMemberId(), MembershipStatus.PENDING_PAYMENT)
                    .orElse(null);
        }

        Payment payment = paymentRepository.save(Payment.builder()
                .member(member)
                .membership(membership)
                .amount(request.getAmount())
                .method(request.getMethod())
                .reference(request.getReference())
                .notes(request.getNotes())
                .receivedBy(receivedBy)
                .paidAt(clock.instant())
                .build());

        log.info("Recorded payment {} of {} for member {} (membership {})",
                payment.getPaymentId(), payment.getAmount(), member.getMemberId(),
                membership != null ? membership.getMembershipId() : "none");

        if (membership != null) {
            membershipService.activateMembership(membership.getMembershipId());
        }
        return modelMapper.toPaymentResponse(payment);
    }

    // Soft void: the row stays and drops out of every paid amount
    @Transactional
    public PaymentResponse cancelPayment(Long paymentId, String reason, StaffUser cancelledBy) {
        Payment payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment not found with id: " + paymentId));
        if (payment.isCancelled()) {
            throw new BusinessLogicException("Payment is already cancelled");
        }

        payment.setCancelledAt(clock.instant());
        payment.setCancelledBy(cancelledBy);
        payment.setCancellationReason(reason);
        paymentRepository.save(payment);

        log.info("Cancelled payment {} by staff {}", paymentId, cancelledBy != null ? cancelledBy.getStaffId() : null);
        return modelMapper.toPaymentResponse(payment);
    }

    @Transactional(readOnly = true)
    public List<PaymentResponse> getPaymentsForMember(Long memberId) {
        if (!memberRepository.existsById(memberId)) {
            throw new ResourceNotFoundException("Member not found with id: " + memberId);
        }
        return paymentRepository.findByMemberMemberIdOrderByPaidAtDesc(memberId).stream()
                .map(modelMapper::toPaymentResponse)
                .toList();
    }
}
