package se.ironpass_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.ironpass_be.pojo.enums.AccessMethod;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccessLogResponse {
    private Long id;
    private Long memberId;
    private String memberName;
    private AccessMethod method;
    private boolean allowed;
    private String reason;
    private Long qrTokenId;
    private Long verifiedById;
    private String verifiedByName;
    private Instant accessedAt;
}
