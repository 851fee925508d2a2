package se.ironpass_be.scheduled;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import se.ironpass_be.service.QrTokenService;

import java.time.Duration;

@Component
public class QrTokenCleanupTask {

    private final QrTokenService qrTokenService;

    @Value("${gym.qr.retention-hours:24}")
    private long retentionHours;

    public QrTokenCleanupTask(QrTokenService qrTokenService) {
        this.qrTokenService = qrTokenService;
    }

    // Hourly; access logs keep their rows, the token reference is nulled on delete
    @Scheduled(cron = "0 0 * * * ?")
    public void cleanupExpiredTokens() {
        qrTokenService.cleanupExpiredTokens(Duration.ofHours(retentionHours));
    }
}
