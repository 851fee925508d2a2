package se.ironpass_be.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.ironpass_be.pojo.enums.MembershipStatus;

/**
 * Status of a membership as seen at a given instant, regardless of what the expiration job
 * has persisted so far.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MembershipStatusSnapshot {
    private MembershipStatus calculatedStatus;
    private long daysRemaining;
}
