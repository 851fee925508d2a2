package se.ironpass_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverdueMembershipResponse {
    private Long membershipId;
    private AccessVerdict.MemberSummary member;
    private String planName;
    private BigDecimal planPrice;
    private Instant endsAt;
    private long daysPastDue;
}
