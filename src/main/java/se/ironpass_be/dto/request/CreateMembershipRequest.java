package se.ironpass_be.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Instant;

@Data
public class CreateMembershipRequest {

    @NotNull(message = "Member ID cannot be null")
    private Long memberId;

    @NotNull(message = "Plan ID cannot be null")
    private Long planId;

    // Defaults to now
    private Instant startsAt;
}
