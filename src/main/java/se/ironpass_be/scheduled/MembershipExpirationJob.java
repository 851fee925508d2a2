package se.ironpass_be.scheduled;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import se.ironpass_be.service.MembershipService;

@Component
@RequiredArgsConstructor
@Slf4j
public class MembershipExpirationJob {

    private final MembershipService membershipService;

    /**
     * Persists the ACTIVE to EXPIRED transition once a day at 1 AM. Access checks compute the
     * effective status on their own, so a missed run only delays the stored value.
     */
    @Scheduled(cron = "${gym.jobs.membership-expiration-cron:0 0 1 * * ?}")
    public void expireLapsedMemberships() {
        log.info("Starting daily membership expiration job");

        try {
            int expired = membershipService.expireLapsedMemberships();
            if (expired > 0) {
                log.info("Expired {} lapsed memberships", expired);
            } else {
                log.info("No lapsed memberships found to expire");
            }
        } catch (Exception e) {
            log.error("Error during membership expiration job: {}", e.getMessage(), e);
            throw e;
        }
    }
}
