package se.ironpass_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.ironpass_be.pojo.enums.PaymentMethod;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentResponse {
    private Long id;
    private Long memberId;
    private Long membershipId;
    private BigDecimal amount;
    private PaymentMethod method;
    private String reference;
    private String notes;
    private String receivedByName;
    private Instant paidAt;
    private boolean cancelled;
    private Instant cancelledAt;
    private String cancelledByName;
    private String cancellationReason;
}
