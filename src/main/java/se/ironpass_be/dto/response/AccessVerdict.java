package se.ironpass_be.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AccessVerdict {
    private boolean allowed;
    private String reason;
    private MemberSummary member;
    private MembershipSummary membership;
    private PaymentInfo paymentInfo;
    // Only set when access is allowed with a balance left
    private String paymentWarning;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemberSummary {
        private Long id;
        private String firstName;
        private String lastName;
        private String email;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MembershipSummary {
        private String planName;
        private long daysRemaining;
        private Instant endsAt;
    }

    public static AccessVerdict deny(String reason) {
        return AccessVerdict.builder()
                .allowed(false)
                .reason(reason)
                .build();
    }

    public static AccessVerdict deny(String reason, MemberSummary member) {
        return AccessVerdict.builder()
                .allowed(false)
                .reason(reason)
                .member(member)
                .build();
    }
}
