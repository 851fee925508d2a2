package se.ironpass_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import se.ironpass_be.pojo.enums.PaymentMethod;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "payments", indexes = {
        @Index(name = "payments_member_id_idx", columnList = "member_id"),
        @Index(name = "payments_paid_at_idx", columnList = "paid_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Payment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long paymentId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "member_id", nullable = false)
    @ToString.Exclude
    private Member member;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "membership_id")
    @ToString.Exclude
    private Membership membership;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentMethod method;

    @Column(length = 255)
    private String reference;

    @Column(columnDefinition = "text")
    private String notes;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "received_by")
    @ToString.Exclude
    private StaffUser receivedBy;

    @Column(name = "paid_at", nullable = false)
    private Instant paidAt;

    // Soft void, the row stays for the audit trail
    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "cancelled_by")
    @ToString.Exclude
    private StaffUser cancelledBy;

    @Column(name = "cancellation_reason", columnDefinition = "text")
    private String cancellationReason;

    @CreationTimestamp
    private Instant createdAt;

    public boolean isCancelled() {
        return cancelledAt != null;
    }
}
