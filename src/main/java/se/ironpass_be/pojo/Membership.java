package se.ironpass_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.ironpass_be.pojo.enums.MembershipStatus;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "memberships", indexes = {
        @Index(name = "memberships_member_id_idx", columnList = "member_id"),
        @Index(name = "memberships_status_idx", columnList = "status"),
        @Index(name = "memberships_ends_at_idx", columnList = "ends_at")
})
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Membership extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long membershipId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "member_id", nullable = false)
    @ToString.Exclude
    private Member member;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "plan_id", nullable = false)
    @ToString.Exclude
    private MembershipPlan plan;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private MembershipStatus status = MembershipStatus.ACTIVE;

    @Column(name = "starts_at", nullable = false)
    private Instant startsAt;

    @Column(name = "ends_at", nullable = false)
    private Instant endsAt;

    // Plan price at creation time, later plan price changes do not apply
    @Column(name = "total_amount", precision = 10, scale = 2, updatable = false)
    private BigDecimal totalAmount;

    @Column(name = "frozen_at")
    private Instant frozenAt;

    @Column(name = "frozen_days")
    @Builder.Default
    private Integer frozenDays = 0;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;
}
