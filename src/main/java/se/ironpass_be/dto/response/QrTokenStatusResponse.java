package se.ironpass_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QrTokenStatusResponse {

    public enum TokenState {
        VALID,
        NOT_FOUND,
        EXPIRED,
        ALREADY_USED
    }

    private TokenState state;
    private AccessVerdict.MemberSummary member;

    public boolean isValid() {
        return state == TokenState.VALID;
    }
}
