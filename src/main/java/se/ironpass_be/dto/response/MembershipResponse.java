package se.ironpass_be.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.ironpass_be.pojo.enums.MembershipStatus;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MembershipResponse {
    private Long id;
    private Long memberId;
    private String memberName;
    private Long planId;
    private String planName;
    private MembershipStatus status;
    private MembershipStatus calculatedStatus;
    private long daysRemaining;
    private Instant startsAt;
    private Instant endsAt;
    private BigDecimal totalAmount;
    private Integer frozenDays;
    private Instant frozenAt;
    private Instant cancelledAt;
    private PaymentInfo paymentInfo;
}
