package se.ironpass_be.service;

import org.springframework.stereotype.Component;
import se.ironpass_be.dto.MembershipStatusSnapshot;
import se.ironpass_be.pojo.Membership;
import se.ironpass_be.pojo.enums.MembershipStatus;
import se.ironpass_be.util.DayMath;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Effective status of a membership at a given instant.
 * <p>
 * Frozen, cancelled and pending-payment memberships keep their stored status: time alone
 * cannot resolve them. An active membership whose end date has passed is reported as expired
 * even when the nightly expiration job has not persisted the transition yet.
 */
@Component
public class MembershipStatusCalculator {

    static final Set<MembershipStatus> STICKY_STATUSES = EnumSet.of(
            MembershipStatus.FROZEN,
            MembershipStatus.CANCELLED,
            MembershipStatus.PENDING_PAYMENT,
            MembershipStatus.EXPIRED);

    public MembershipStatusSnapshot calculate(Membership membership, Instant now) {
        return calculate(membership.getStatus(), membership.getEndsAt(), now);
    }

    public MembershipStatusSnapshot calculate(MembershipStatus storedStatus, Instant endsAt, Instant now) {
        long daysRemaining = DayMath.ceilDaysBetween(now, endsAt);

        if (STICKY_STATUSES.contains(storedStatus)) {
            long remaining = storedStatus == MembershipStatus.EXPIRED ? 0 : Math.max(0, daysRemaining);
            return new MembershipStatusSnapshot(storedStatus, remaining);
        }

        if (daysRemaining <= 0) {
            return new MembershipStatusSnapshot(MembershipStatus.EXPIRED, 0);
        }
        return new MembershipStatusSnapshot(MembershipStatus.ACTIVE, daysRemaining);
    }
}
