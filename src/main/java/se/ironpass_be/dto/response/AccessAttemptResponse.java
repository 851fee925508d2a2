package se.ironpass_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccessAttemptResponse {
    private AccessLogResponse accessLog;
    private AccessVerdict verdict;
}
