package se.ironpass_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingPaymentResponse {
    private Long membershipId;
    private AccessVerdict.MemberSummary member;
    private String planName;
    private PaymentInfo paymentInfo;
}
