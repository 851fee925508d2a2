package se.ironpass_be.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import se.ironpass_be.dto.OverdueStatus;
import se.ironpass_be.dto.PartialPaymentsConfig;
import se.ironpass_be.dto.request.CreateMembershipRequest;
import se.ironpass_be.dto.response.MembershipResponse;
import se.ironpass_be.dto.response.PaymentInfo;
import se.ironpass_be.dto.response.PendingPaymentResponse;
import se.ironpass_be.exception.BusinessLogicException;
import se.ironpass_be.mapper.ModelMapper;
import se.ironpass_be.pojo.Member;
import se.ironpass_be.pojo.Membership;
import se.ironpass_be.pojo.MembershipPlan;
import se.ironpass_be.pojo.enums.MembershipStatus;
import se.ironpass_be.pojo.enums.PaymentStatus;
import se.ironpass_be.repository.MemberRepository;
import se.ironpass_be.repository.MembershipPlanRepository;
import se.ironpass_be.repository.MembershipRepository;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MembershipService")
class MembershipServiceTest {

    private static final Instant NOW = Instant.parse("2026-08-03T13:00:00Z");

    @Mock
    private MembershipRepository membershipRepository;

    @Mock
    private MembershipPlanRepository membershipPlanRepository;

    @Mock
    private MemberRepository memberRepository;

    @Mock
    private PaymentLedgerService paymentLedgerService;

    @Mock
    private SettingsService settingsService;

    private MembershipService membershipService;

    private Member member;
    private MembershipPlan plan;

    @BeforeEach
    void setUp() {
        membershipService = new MembershipService(membershipRepository, membershipPlanRepository, memberRepository,
                new MembershipStatusCalculator(), paymentLedgerService, settingsService, new ModelMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC));
        member = Member.builder().memberId(1L).firstName("Eva").lastName("Mora").email("eva@example.com").build();
        plan = MembershipPlan.builder().planId(2L).name("Monthly").price(new BigDecimal("100000")).durationDays(30).build();
    }

    private Membership membership(Long id, MembershipStatus status, Instant endsAt) {
        return Membership.builder()
                .membershipId(id)
                .member(member)
                .plan(plan)
                .status(status)
                .startsAt(endsAt.minus(Duration.ofDays(30)))
                .endsAt(endsAt)
                .totalAmount(plan.getPrice())
                .build();
    }

    private void givenPaymentRequired(boolean required) {
        when(settingsService.getPartialPaymentsConfig())
                .thenReturn(PartialPaymentsConfig.builder().requirePaymentToActivate(required).build());
    }

    @Nested
    @DisplayName("checkMemberOverdue")
    class Overdue {

        @Test
        @DisplayName("is overdue once past the tolerance window")
        void pastTolerance() {
            when(settingsService.getMorosityToleranceDays()).thenReturn(5);
            when(membershipRepository.findLatestByMemberAndStatuses(eq(1L), any()))
                    .thenReturn(Optional.of(membership(5L, MembershipStatus.EXPIRED, NOW.minus(Duration.ofDays(9)))));

            OverdueStatus status = membershipService.checkMemberOverdue(1L);

            assertThat(status.isOverdue()).isTrue();
            assertThat(status.getDaysPastDue()).isEqualTo(9);
            assertThat(status.getOverdueAmount()).isEqualByComparingTo("100000");
        }

        @Test
        @DisplayName("is not overdue on the last tolerated day")
        void withinTolerance() {
            when(settingsService.getMorosityToleranceDays()).thenReturn(5);
            when(membershipRepository.findLatestByMemberAndStatuses(eq(1L), any()))
                    .thenReturn(Optional.of(membership(5L, MembershipStatus.EXPIRED,
                            NOW.minus(Duration.ofDays(5)).minus(Duration.ofHours(23)))));

            assertThat(membershipService.checkMemberOverdue(1L).isOverdue()).isFalse();
        }

        @Test
        void noMembership() {
            when(settingsService.getMorosityToleranceDays()).thenReturn(5);
            when(membershipRepository.findLatestByMemberAndStatuses(eq(1L), any())).thenReturn(Optional.empty());

            assertThat(membershipService.checkMemberOverdue(1L)).isEqualTo(OverdueStatus.notOverdue());
        }
    }

    @Nested
    @DisplayName("createMembership")
    class Create {

        private CreateMembershipRequest request() {
            CreateMembershipRequest request = new CreateMembershipRequest();
            request.setMemberId(1L);
            request.setPlanId(2L);
            return request;
        }

        @BeforeEach
        void lookups() {
            when(memberRepository.findById(1L)).thenReturn(Optional.of(member));
            when(membershipPlanRepository.findById(2L)).thenReturn(Optional.of(plan));
        }

        @Test
        @DisplayName("rejects a second membership while one is still running")
        void alreadyActive() {
            when(membershipRepository.findLatestByMemberAndStatuses(eq(1L), any()))
                    .thenReturn(Optional.of(membership(5L, MembershipStatus.ACTIVE, NOW.plus(Duration.ofDays(3)))));

            assertThatThrownBy(() -> membershipService.createMembership(request()))
                    .isInstanceOf(BusinessLogicException.class);
            verify(membershipRepository, never()).save(any());
        }

        @Test
        @DisplayName("a lapsed active row does not block a new membership")
        void lapsedDoesNotBlock() {
            when(membershipRepository.findLatestByMemberAndStatuses(eq(1L), any()))
                    .thenReturn(Optional.of(membership(5L, MembershipStatus.ACTIVE, NOW.minus(Duration.ofDays(1)))));
            givenPaymentRequired(false);

            MembershipResponse response = membershipService.createMembership(request());

            assertThat(response.getStatus()).isEqualTo(MembershipStatus.ACTIVE);
        }

        @Test
        @DisplayName("starts awaiting payment when payment is required, with the price captured")
        void pendingPayment() {
            when(membershipRepository.findLatestByMemberAndStatuses(eq(1L), any())).thenReturn(Optional.empty());
            givenPaymentRequired(true);

            membershipService.createMembership(request());

            ArgumentCaptor<Membership> saved = ArgumentCaptor.forClass(Membership.class);
            verify(membershipRepository).save(saved.capture());
            assertThat(saved.getValue().getStatus()).isEqualTo(MembershipStatus.PENDING_PAYMENT);
            assertThat(saved.getValue().getTotalAmount()).isEqualByComparingTo("100000");
            assertThat(saved.getValue().getStartsAt()).isEqualTo(NOW);
            assertThat(saved.getValue().getEndsAt()).isEqualTo(NOW.plus(Duration.ofDays(30)));
        }
    }

    @Test
    @DisplayName("renewal continues from a future end date and closes the previous membership")
    void renew() {
        Membership current = membership(5L, MembershipStatus.ACTIVE, NOW.plus(Duration.ofDays(4)));
        when(memberRepository.findById(1L)).thenReturn(Optional.of(member));
        when(membershipPlanRepository.findById(2L)).thenReturn(Optional.of(plan));
        when(membershipRepository.findLatestByMemberAndStatuses(eq(1L), any())).thenReturn(Optional.of(current));
        givenPaymentRequired(false);

        MembershipResponse response = membershipService.renewMembership(1L, 2L);

        assertThat(current.getStatus()).isEqualTo(MembershipStatus.EXPIRED);
        assertThat(response.getStartsAt()).isEqualTo(NOW.plus(Duration.ofDays(4)));
        assertThat(response.getEndsAt()).isEqualTo(NOW.plus(Duration.ofDays(34)));
        verify(membershipRepository, times(2)).save(any(Membership.class));
    }

    @Nested
    @DisplayName("freeze and unfreeze")
    class Freeze {

        @Test
        @DisplayName("freezing pushes the end date and counts the days")
        void freeze() {
            Membership active = membership(5L, MembershipStatus.ACTIVE, NOW.plus(Duration.ofDays(10)));
            active.setFrozenDays(3);
            when(membershipRepository.findById(5L)).thenReturn(Optional.of(active));

            MembershipResponse response = membershipService.freezeMembership(5L, 7);

            assertThat(active.getStatus()).isEqualTo(MembershipStatus.FROZEN);
            assertThat(active.getEndsAt()).isEqualTo(NOW.plus(Duration.ofDays(17)));
            assertThat(active.getFrozenDays()).isEqualTo(10);
            assertThat(active.getFrozenAt()).isEqualTo(NOW);
            assertThat(response.getCalculatedStatus()).isEqualTo(MembershipStatus.FROZEN);
        }

        @Test
        void onlyActiveCanFreeze() {
            when(membershipRepository.findById(5L))
                    .thenReturn(Optional.of(membership(5L, MembershipStatus.CANCELLED, NOW.plus(Duration.ofDays(10)))));

            assertThatThrownBy(() -> membershipService.freezeMembership(5L, 7))
                    .isInstanceOf(BusinessLogicException.class);
        }

        @Test
        void unfreeze() {
            Membership frozen = membership(5L, MembershipStatus.FROZEN, NOW.plus(Duration.ofDays(10)));
            frozen.setFrozenAt(NOW.minus(Duration.ofDays(2)));
            when(membershipRepository.findById(5L)).thenReturn(Optional.of(frozen));

            membershipService.unfreezeMembership(5L);

            assertThat(frozen.getStatus()).isEqualTo(MembershipStatus.ACTIVE);
            assertThat(frozen.getFrozenAt()).isNull();
        }
    }

    @Test
    @DisplayName("only a membership awaiting payment is activated")
    void activate() {
        Membership pending = membership(5L, MembershipStatus.PENDING_PAYMENT, NOW.plus(Duration.ofDays(30)));
        Membership cancelled = membership(6L, MembershipStatus.CANCELLED, NOW.plus(Duration.ofDays(30)));
        when(membershipRepository.findById(5L)).thenReturn(Optional.of(pending));
        when(membershipRepository.findById(6L)).thenReturn(Optional.of(cancelled));

        assertThat(membershipService.activateMembership(5L)).isTrue();
        assertThat(pending.getStatus()).isEqualTo(MembershipStatus.ACTIVE);
        assertThat(membershipService.activateMembership(6L)).isFalse();
        assertThat(cancelled.getStatus()).isEqualTo(MembershipStatus.CANCELLED);
    }

    @Test
    @DisplayName("pending balances are listed most urgent first, fully paid ones left out")
    void pendingBalances() {
        PartialPaymentsConfig config = PartialPaymentsConfig.builder().enabled(true).deadlineDays(15).gracePeriodDays(5).build();
        when(settingsService.getPartialPaymentsConfig()).thenReturn(config);
        Membership later = membership(5L, MembershipStatus.ACTIVE, NOW.plus(Duration.ofDays(20)));
        Membership sooner = membership(6L, MembershipStatus.ACTIVE, NOW.plus(Duration.ofDays(20)));
        Membership paid = membership(7L, MembershipStatus.ACTIVE, NOW.plus(Duration.ofDays(20)));
        when(membershipRepository.findByStatusWithDetails(MembershipStatus.ACTIVE)).thenReturn(List.of(later, sooner, paid));
        when(paymentLedgerService.calculatePaymentInfo(later, config, NOW)).thenReturn(info("50000", 9));
        when(paymentLedgerService.calculatePaymentInfo(sooner, config, NOW)).thenReturn(info("20000", 2));
        when(paymentLedgerService.calculatePaymentInfo(paid, config, NOW)).thenReturn(info("0", 2));

        List<PendingPaymentResponse> result = membershipService.getMembersWithPendingPayments();

        assertThat(result).extracting(PendingPaymentResponse::getMembershipId).containsExactly(6L, 5L);
    }

    @Test
    void pendingBalancesEmptyWhenFeatureOff() {
        when(settingsService.getPartialPaymentsConfig()).thenReturn(PartialPaymentsConfig.builder().enabled(false).build());

        assertThat(membershipService.getMembersWithPendingPayments()).isEmpty();
        verify(membershipRepository, never()).findByStatusWithDetails(any());
    }

    private static PaymentInfo info(String pending, long daysUntilDeadline) {
        return PaymentInfo.builder()
                .pendingAmount(new BigDecimal(pending))
                .paymentStatus(new BigDecimal(pending).signum() > 0 ? PaymentStatus.PARTIAL : PaymentStatus.PAID)
                .daysUntilDeadline(daysUntilDeadline)
                .build();
    }
}
