package se.ironpass_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.ironpass_be.dto.MembershipStatusSnapshot;
import se.ironpass_be.dto.OverdueStatus;
import se.ironpass_be.dto.PartialPaymentsConfig;
import se.ironpass_be.dto.request.CreateMembershipRequest;
import se.ironpass_be.dto.response.MembershipResponse;
import se.ironpass_be.dto.response.OverdueMembershipResponse;
import se.ironpass_be.dto.response.PaymentInfo;
import se.ironpass_be.dto.response.PendingPaymentResponse;
import se.ironpass_be.exception.BusinessLogicException;
import se.ironpass_be.exception.ResourceNotFoundException;
import se.ironpass_be.mapper.ModelMapper;
import se.ironpass_be.pojo.Member;
import se.ironpass_be.pojo.Membership;
import se.ironpass_be.pojo.MembershipPlan;
import se.ironpass_be.pojo.enums.MembershipStatus;
import se.ironpass_be.repository.MemberRepository;
import se.ironpass_be.repository.MembershipPlanRepository;
import se.ironpass_be.repository.MembershipRepository;
import se.ironpass_be.util.DayMath;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class MembershipService {

    // At most one membership per member sits in one of these at a time
    public static final Set<MembershipStatus> CURRENT_STATUSES = EnumSet.of(
            MembershipStatus.ACTIVE, MembershipStatus.FROZEN, MembershipStatus.PENDING_PAYMENT);

    static final Set<MembershipStatus> MOROSITY_STATUSES = EnumSet.of(MembershipStatus.ACTIVE, MembershipStatus.EXPIRED);

    private final MembershipRepository membershipRepository;
    private final MembershipPlanRepository membershipPlanRepository;
    private final MemberRepository memberRepository;
    private final MembershipStatusCalculator membershipStatusCalculator;
    private final PaymentLedgerService paymentLedgerService;
    private final SettingsService settingsService;
    private final ModelMapper modelMapper;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<Membership> getCurrentMembership(Long memberId) {
        return membershipRepository.findLatestByMemberAndStatuses(memberId, CURRENT_STATUSES);
    }

    /**
     * Morosity rule: the latest active or expired membership ended more than the tolerance
     * window ago.
     */
    @Transactional(readOnly = true)
    public OverdueStatus checkMemberOverdue(Long memberId) {
        int toleranceDays = settingsService.getMorosityToleranceDays();

        Optional<Membership> membership = membershipRepository.findLatestByMemberAndStatuses(memberId, MOROSITY_STATUSES);
        if (membership.isEmpty()) {
            return OverdueStatus.notOverdue();
        }

        long daysPastDue = DayMath.floorDaysBetween(membership.get().getEndsAt(), clock.instant());
        if (daysPastDue > toleranceDays) {
            return new OverdueStatus(true, daysPastDue, membership.get().getPlan().getPrice());
        }
        return OverdueStatus.notOverdue();
    }

    @Transactional(readOnly = true)
    public MembershipResponse getMembership(Long membershipId) {
        Membership membership = membershipRepository.findById(membershipId)
                .orElseThrow(() -> new ResourceNotFoundException("Membership not found with id: " + membershipId));
        return toResponse(membership);
    }

    @Transactional(readOnly = true)
    public List<MembershipResponse> getMembershipsForMember(Long memberId) {
        if (!memberRepository.existsById(memberId)) {
            throw new ResourceNotFoundException("Member not found with id: " + memberId);
        }
        return membershipRepository.findByMemberMemberIdOrderByCreatedAtDesc(memberId).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional
    public MembershipResponse createMembership(CreateMembershipRequest request) {
        Member member = memberRepository.findById(request.getMemberId())
                .orElseThrow(() -> new ResourceNotFoundException("Member not found with id: " + request.getMemberId()));
        MembershipPlan plan = membershipPlanRepository.findById(request.getPlanId())
                .orElseThrow(() -> new ResourceNotFoundException("Membership plan not found with id: " + request.getPlanId()));

        Instant now = clock.instant();
        Optional<Membership> current = getCurrentMembership(member.getMemberId());
        if (current.isPresent()
                && membershipStatusCalculator.calculate(current.get(), now).getCalculatedStatus() == MembershipStatus.ACTIVE) {
            throw new BusinessLogicException("Member already has an active membership");
        }

        Instant startsAt = request.getStartsAt() != null ? request.getStartsAt() : now;
        Membership membership = newMembership(member, plan, startsAt);
        membershipRepository.save(membership);

        log.info("Created {} membership {} for member {} on plan '{}'",
                membership.getStatus(), membership.getMembershipId(), member.getMemberId(), plan.getName());
        return toResponse(membership);
    }

    /**
     * Renewal continues from the current end date when it is still ahead, otherwise from now.
     * The previous current membership is closed as expired.
     */
    @Transactional
    public MembershipResponse renewMembership(Long memberId, Long planId) {
        Member member = memberRepository.findById(memberId)
                .orElseThrow(() -> new ResourceNotFoundException("Member not found with id: " + memberId));
        MembershipPlan plan = membershipPlanRepository.findById(planId)
                .orElseThrow(() -> new ResourceNotFoundException("Membership plan not found with id: " + planId));

        Instant now = clock.instant();
        Optional<Membership> current = getCurrentMembership(memberId);

        Instant startsAt = current
                .map(Membership::getEndsAt)
                .filter(endsAt -> endsAt.isAfter(now))
                .orElse(now);

        current.ifPresent(previous -> {
            previous.setStatus(MembershipStatus.EXPIRED);
            membershipRepository.save(previous);
            log.info("Closed membership {} of member {} for renewal", previous.getMembershipId(), memberId);
        });

        Membership membership = newMembership(member, plan, startsAt);
        membershipRepository.save(membership);

        log.info("Renewed member {} on plan '{}' from {} to {}", memberId, plan.getName(), startsAt, membership.getEndsAt());
        return toResponse(membership);
    }

    /**
     * First payment on a pending-payment membership turns it active. Any other status is left as is.
     *
     * @return true when the membership was activated by this call
     */
    @Transactional
    public boolean activateMembership(Long membershipId) {
        Optional<Membership> membershipOpt = membershipRepository.findById(membershipId);
        if (membershipOpt.isEmpty() || membershipOpt.get().getStatus() != MembershipStatus.PENDING_PAYMENT) {
            return false;
        }
        Membership membership = membershipOpt.get();
        membership.setStatus(MembershipStatus.ACTIVE);
        membershipRepository.save(membership);
        log.info("Activated membership {} after first payment", membershipId);
        return true;
    }

    @Transactional
    public MembershipResponse freezeMembership(Long membershipId, int days) {
        Membership membership = findMembership(membershipId);
        if (membership.getStatus() != MembershipStatus.ACTIVE) {
            throw new BusinessLogicException("Only active memberships can be frozen");
        }

        // The frozen days are given back at the end of the period
        membership.setEndsAt(membership.getEndsAt().plus(Duration.ofDays(days)));
        membership.setFrozenDays((membership.getFrozenDays() == null ? 0 : membership.getFrozenDays()) + days);
        membership.setFrozenAt(clock.instant());
        membership.setStatus(MembershipStatus.FROZEN);
        membershipRepository.save(membership);

        log.info("Froze membership {} for {} days, new end {}", membershipId, days, membership.getEndsAt());
        return toResponse(membership);
    }

    @Transactional
    public MembershipResponse unfreezeMembership(Long membershipId) {
        Membership membership = findMembership(membershipId);
        if (membership.getStatus() != MembershipStatus.FROZEN) {
            throw new BusinessLogicException("Membership is not frozen");
        }
        membership.setStatus(MembershipStatus.ACTIVE);
        membership.setFrozenAt(null);
        membershipRepository.save(membership);

        log.info("Unfroze membership {}", membershipId);
        return toResponse(membership);
    }

    @Transactional
    public MembershipResponse cancelMembership(Long membershipId) {
        Membership membership = findMembership(membershipId);
        if (membership.getStatus() == MembershipStatus.CANCELLED) {
            throw new BusinessLogicException("Membership is already cancelled");
        }
        membership.setStatus(MembershipStatus.CANCELLED);
        membership.setCancelledAt(clock.instant());
        membershipRepository.save(membership);

        log.info("Cancelled membership {}", membershipId);
        return toResponse(membership);
    }

    /**
     * Active memberships with a balance left, most urgent deadline first. Empty while the
     * partial payment feature is off.
     */
    @Transactional(readOnly = true)
    public List<PendingPaymentResponse> getMembersWithPendingPayments() {
        PartialPaymentsConfig config = settingsService.getPartialPaymentsConfig();
        if (!config.isEnabled()) {
            return List.of();
        }

        Instant now = clock.instant();
        List<PendingPaymentResponse> result = new ArrayList<>();
        for (Membership membership : membershipRepository.findByStatusWithDetails(MembershipStatus.ACTIVE)) {
            PaymentInfo paymentInfo = paymentLedgerService.calculatePaymentInfo(membership, config, now);
            if (paymentInfo.getPendingAmount().signum() > 0) {
                result.add(PendingPaymentResponse.builder()
                        .membershipId(membership.getMembershipId())
                        .member(modelMapper.toMemberSummary(membership.getMember()))
                        .planName(membership.getPlan().getName())
                        .paymentInfo(paymentInfo)
                        .build());
            }
        }
        result.sort(Comparator.comparingLong(r -> r.getPaymentInfo().getDaysUntilDeadline()));
        return result;
    }

    // Expired memberships beyond the tolerance window, oldest first
    @Transactional(readOnly = true)
    public List<OverdueMembershipResponse> getOverdueMemberships() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofDays(settingsService.getMorosityToleranceDays()));

        return membershipRepository.findByStatusEndedBefore(MembershipStatus.EXPIRED, cutoff).stream()
                .map(membership -> OverdueMembershipResponse.builder()
                        .membershipId(membership.getMembershipId())
                        .member(modelMapper.toMemberSummary(membership.getMember()))
                        .planName(membership.getPlan().getName())
                        .planPrice(membership.getPlan().getPrice())
                        .endsAt(membership.getEndsAt())
                        .daysPastDue(DayMath.floorDaysBetween(membership.getEndsAt(), now))
                        .build())
                .toList();
    }

    /**
     * Persists ACTIVE -> EXPIRED for memberships whose end date has passed. Status reads never
     * depend on this having run.
     */
    @Transactional
    public int expireLapsedMemberships() {
        return membershipRepository.transitionLapsed(MembershipStatus.ACTIVE, MembershipStatus.EXPIRED, clock.instant());
    }

    private Membership newMembership(Member member, MembershipPlan plan, Instant startsAt) {
        MembershipStatus initialStatus = settingsService.getPartialPaymentsConfig().isRequirePaymentToActivate()
                ? MembershipStatus.PENDING_PAYMENT
                : MembershipStatus.ACTIVE;

        return Membership.builder()
                .member(member)
                .plan(plan)
                .status(initialStatus)
                .startsAt(startsAt)
                .endsAt(startsAt.plus(Duration.ofDays(plan.getDurationDays())))
                .totalAmount(plan.getPrice())
                .build();
    }

    private Membership findMembership(Long membershipId) {
        return membershipRepository.findById(membershipId)
                .orElseThrow(() -> new ResourceNotFoundException("Membership not found with id: " + membershipId));
    }

    private MembershipResponse toResponse(Membership membership) {
        MembershipStatusSnapshot snapshot = membershipStatusCalculator.calculate(membership, clock.instant());
        PaymentInfo paymentInfo = membership.getMembershipId() != null
                ? paymentLedgerService.calculatePaymentInfo(membership)
                : null;
        return modelMapper.toMembershipResponse(membership, snapshot, paymentInfo);
    }
}
