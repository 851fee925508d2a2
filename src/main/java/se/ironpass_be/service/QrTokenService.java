package se.ironpass_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import se.ironpass_be.dto.response.AccessAttemptResponse;
import se.ironpass_be.dto.response.AccessVerdict;
import se.ironpass_be.dto.response.QrTokenResponse;
import se.ironpass_be.dto.response.QrTokenStatusResponse;
import se.ironpass_be.exception.BusinessLogicException;
import se.ironpass_be.exception.InvalidQrTokenException;
import se.ironpass_be.exception.ResourceNotFoundException;
import se.ironpass_be.exception.StorageUnavailableException;
import se.ironpass_be.mapper.ModelMapper;
import se.ironpass_be.pojo.AccessLog;
import se.ironpass_be.pojo.Member;
import se.ironpass_be.pojo.QrToken;
import se.ironpass_be.pojo.StaffUser;
import se.ironpass_be.pojo.enums.AccessMethod;
import se.ironpass_be.repository.MemberRepository;
import se.ironpass_be.repository.QrTokenRepository;
import se.ironpass_be.util.DayMath;
import se.ironpass_be.util.QrCodeRenderer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Short-lived single-use entry codes.
 * <p>
 * Only the SHA-256 of a code is stored. A code is consumed by a conditional update on
 * {@code used_at}, so of any number of concurrent scans at most one gets past the consume step,
 * whichever instance serves it. Every outcome after the lookup is written to the access log.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QrTokenService {

    public static final String REASON_TOKEN_EXPIRED = "QR token expired";
    public static final String REASON_TOKEN_ALREADY_USED = "QR token already used";

    static final int TOKEN_BYTES = 32;
    static final String CHECK_IN_FAILED = "Could not complete the QR check-in, scan a new code";

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final QrTokenRepository qrTokenRepository;
    private final MemberRepository memberRepository;
    private final AccessDecisionService accessDecisionService;
    private final AccessLogService accessLogService;
    private final SettingsService settingsService;
    private final ModelMapper modelMapper;
    private final QrCodeRenderer qrCodeRenderer;
    private final Clock clock;

    /**
     * Issues a fresh code for an active member. The plaintext and its rendered image are only ever returned here.
     */
    @Transactional
    public QrTokenResponse issueToken(Long memberId) {
        Member member = memberRepository.findById(memberId)
                .orElseThrow(() -> new ResourceNotFoundException("Member not found with id: " + memberId));
        if (!member.isActive()) {
            throw new BusinessLogicException("Member account inactive");
        }

        int durationSeconds = settingsService.getQrDurationSeconds();
        String token = generateToken();
        Instant expiresAt = clock.instant().plusSeconds(durationSeconds);

        QrToken qrToken = qrTokenRepository.save(QrToken.builder()
                .member(member)
                .tokenHash(sha256Hex(token))
                .expiresAt(expiresAt)
                .build());

        log.info("Issued QR token {} for member {}, expires at {}", qrToken.getId(), memberId, expiresAt);
        return QrTokenResponse.builder()
                .token(token)
                .qrImage(qrCodeRenderer.toDataUrl(token))
                .expiresAt(expiresAt)
                .durationSeconds(durationSeconds)
                .build();
    }

    /**
     * Validates a scanned code and, when every check passes, consumes it and records the entry.
     *
     * @throws InvalidQrTokenException when no issued code matches; nothing is logged then
     * @throws StorageUnavailableException when the consume write, or anything after it, cannot be completed;
     *                                     not retryable
     */
    public AccessAttemptResponse validateQrToken(String token, StaffUser verifiedBy) {
        QrToken qrToken = qrTokenRepository.findByTokenHash(sha256Hex(token))
                .orElseThrow(InvalidQrTokenException::new);

        Member member = qrToken.getMember();
        AccessVerdict.MemberSummary memberSummary = modelMapper.toMemberSummary(member);
        Instant now = clock.instant();

        if (qrToken.isExpiredAt(now)) {
            log.warn("Rejected expired QR token {} of member {}", qrToken.getId(), member.getMemberId());
            return denyAndLog(qrToken, verifiedBy, AccessVerdict.deny(REASON_TOKEN_EXPIRED, memberSummary));
        }

        // Sharing guard, checked before the consume so a blocked scan leaves the code usable
        Duration window = Duration.ofMinutes(settingsService.getRecentAccessMinutes());
        Optional<AccessLog> recentEntry = accessLogService.findRecentAllowedEntry(member.getMemberId(), window);
        if (recentEntry.isPresent()) {
            long minutesAgo = DayMath.floorMinutesBetween(recentEntry.get().getAccessedAt(), now);
            String reason = "Already entered " + minutesAgo + (minutesAgo == 1 ? " minute" : " minutes") + " ago";
            log.warn("Rejected QR token {} of member {}: {}", qrToken.getId(), member.getMemberId(), reason);
            return denyAndLog(qrToken, verifiedBy, AccessVerdict.deny(reason, memberSummary));
        }

        if (!consume(qrToken, now)) {
            log.warn("Rejected QR token {} of member {}: already consumed", qrToken.getId(), member.getMemberId());
            return denyAndLog(qrToken, verifiedBy, AccessVerdict.deny(REASON_TOKEN_ALREADY_USED, memberSummary));
        }

        // The code is spent past this point; storage failures are reported as not retryable
        try {
            AccessVerdict verdict = accessDecisionService.evaluate(member.getMemberId());
            AccessLog accessLog = accessLogService.record(
                    member, AccessMethod.QR, verdict.isAllowed(), verdict.getReason(), qrToken, verifiedBy);
            return AccessAttemptResponse.builder()
                    .accessLog(modelMapper.toAccessLogResponse(accessLog))
                    .verdict(verdict)
                    .build();
        } catch (DataAccessException | TransactionException e) {
            log.error("QR token {} of member {} consumed but check-in failed: {}",
                    qrToken.getId(), member.getMemberId(), e.getMessage());
            throw new StorageUnavailableException(CHECK_IN_FAILED, false, e);
        }
    }

    /**
     * Read-only preview of a code for the scanner screen. Does not consume it.
     */
    @Transactional(readOnly = true)
    public QrTokenStatusResponse getTokenStatus(String token) {
        Optional<QrToken> qrTokenOpt = qrTokenRepository.findByTokenHash(sha256Hex(token));
        if (qrTokenOpt.isEmpty()) {
            return QrTokenStatusResponse.builder()
                    .state(QrTokenStatusResponse.TokenState.NOT_FOUND)
                    .build();
        }

        QrToken qrToken = qrTokenOpt.get();
        QrTokenStatusResponse.TokenState state;
        if (qrToken.isUsed()) {
            state = QrTokenStatusResponse.TokenState.ALREADY_USED;
        } else if (qrToken.isExpiredAt(clock.instant())) {
            state = QrTokenStatusResponse.TokenState.EXPIRED;
        } else {
            state = QrTokenStatusResponse.TokenState.VALID;
        }
        return QrTokenStatusResponse.builder()
                .state(state)
                .member(modelMapper.toMemberSummary(qrToken.getMember()))
                .build();
    }

    /**
     * Deletes codes that expired longer ago than the retention window.
     *
     * @return number of rows deleted
     */
    public int cleanupExpiredTokens(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        int deleted = qrTokenRepository.deleteAllExpiredBefore(cutoff);
        log.info("Deleted {} QR tokens expired before {}", deleted, cutoff);
        return deleted;
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String generateToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private boolean consume(QrToken qrToken, Instant now) {
        try {
            return qrTokenRepository.markUsedIfUnused(qrToken.getId(), now) == 1;
        } catch (DataAccessException | TransactionException e) {
            log.error("Could not consume QR token {}: {}", qrToken.getId(), e.getMessage());
            throw new StorageUnavailableException(CHECK_IN_FAILED, false, e);
        }
    }

    private AccessAttemptResponse denyAndLog(QrToken qrToken, StaffUser verifiedBy, AccessVerdict verdict) {
        AccessLog accessLog = accessLogService.record(
                qrToken.getMember(), AccessMethod.QR, false, verdict.getReason(), qrToken, verifiedBy);
        return AccessAttemptResponse.builder()
                .accessLog(modelMapper.toAccessLogResponse(accessLog))
                .verdict(verdict)
                .build();
    }
}
