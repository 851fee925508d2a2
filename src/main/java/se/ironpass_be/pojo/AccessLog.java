package se.ironpass_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import se.ironpass_be.pojo.enums.AccessMethod;

import java.time.Instant;

@Entity
@Table(name = "access_logs", indexes = {
        @Index(name = "access_logs_member_id_idx", columnList = "member_id"),
        @Index(name = "access_logs_accessed_at_idx", columnList = "accessed_at"),
        @Index(name = "access_logs_allowed_idx", columnList = "allowed")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccessLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "member_id", nullable = false, updatable = false)
    @ToString.Exclude
    private Member member;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10, updatable = false)
    private AccessMethod method;

    @Column(nullable = false, updatable = false)
    private boolean allowed;

    @Column(length = 255, updatable = false)
    private String reason;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "qr_token_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    @ToString.Exclude
    private QrToken qrToken;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "verified_by", updatable = false)
    @ToString.Exclude
    private StaffUser verifiedBy;

    @Column(name = "accessed_at", nullable = false, updatable = false)
    private Instant accessedAt;
}
