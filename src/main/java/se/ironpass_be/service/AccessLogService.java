package se.ironpass_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.ironpass_be.dto.response.AccessLogResponse;
import se.ironpass_be.dto.response.AccessStatsResponse;
import se.ironpass_be.dto.response.PagedResponse;
import se.ironpass_be.mapper.ModelMapper;
import se.ironpass_be.pojo.AccessLog;
import se.ironpass_be.pojo.Member;
import se.ironpass_be.pojo.QrToken;
import se.ironpass_be.pojo.StaffUser;
import se.ironpass_be.pojo.enums.AccessMethod;
import se.ironpass_be.repository.AccessLogRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class AccessLogService {

    static final int MAX_REASON_LENGTH = 255;

    private final AccessLogRepository accessLogRepository;
    private final SettingsService settingsService;
    private final ModelMapper modelMapper;
    private final Clock clock;

    /**
     * Appends one row for an access attempt. Rows are never updated afterwards.
     */
    @Transactional
    public AccessLog record(Member member, AccessMethod method, boolean allowed, String reason,
                            QrToken qrToken, StaffUser verifiedBy) {
        AccessLog accessLog = AccessLog.builder()
                .member(member)
                .method(method)
                .allowed(allowed)
                .reason(truncate(reason))
                .qrToken(qrToken)
                .verifiedBy(verifiedBy)
                .accessedAt(clock.instant())
                .build();
        AccessLog saved = accessLogRepository.save(accessLog);

        log.info("Access {} for member {} via {}: {}",
                allowed ? "allowed" : "denied", member.getMemberId(), method, saved.getReason());
        return saved;
    }

    /**
     * Most recent allowed entry of the member inside the given window, used by the sharing guard.
     */
    @Transactional(readOnly = true)
    public Optional<AccessLog> findRecentAllowedEntry(Long memberId, Duration window) {
        Instant since = clock.instant().minus(window);
        return accessLogRepository
                .findFirstByMemberMemberIdAndAllowedTrueAndAccessedAtGreaterThanEqualOrderByAccessedAtDesc(memberId, since);
    }

    @Transactional(readOnly = true)
    public PagedResponse<AccessLogResponse> getAccessLogs(Pageable pageable, Long memberId, Boolean allowed,
                                                          AccessMethod method, LocalDate from, LocalDate to) {
        Specification<AccessLog> spec = Specification.where(hasMember(memberId))
                .and(hasAllowed(allowed))
                .and(hasMethod(method))
                .and(accessedFrom(from))
                .and(accessedBefore(to));

        Page<AccessLogResponse> page = accessLogRepository.findAll(spec, pageable)
                .map(modelMapper::toAccessLogResponse);

        Map<String, Object> filters = new LinkedHashMap<>();
        if (memberId != null) filters.put("memberId", memberId);
        if (allowed != null) filters.put("allowed", allowed);
        if (method != null) filters.put("method", method);
        if (from != null) filters.put("from", from);
        if (to != null) filters.put("to", to);
        return PagedResponse.of(page, filters);
    }

    // Counts since local midnight in the gym's timezone
    @Transactional(readOnly = true)
    public AccessStatsResponse getTodayStats() {
        Instant startOfDay = LocalDate.now(clock.withZone(settingsService.getZoneId()))
                .atStartOfDay(settingsService.getZoneId())
                .toInstant();

        long total = accessLogRepository.countByAccessedAtGreaterThanEqual(startOfDay);
        long allowed = accessLogRepository.countByAllowedAndAccessedAtGreaterThanEqual(true, startOfDay);
        return AccessStatsResponse.builder()
                .total(total)
                .allowed(allowed)
                .denied(total - allowed)
                .build();
    }

    static String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_REASON_LENGTH);
    }

    private Specification<AccessLog> hasMember(Long memberId) {
        return (root, query, criteriaBuilder) -> {
            if (memberId == null) {
                return null;
            }
            return criteriaBuilder.equal(root.get("member").get("memberId"), memberId);
        };
    }

    private Specification<AccessLog> hasAllowed(Boolean allowed) {
        return (root, query, criteriaBuilder) -> {
            if (allowed == null) {
                return null;
            }
            return criteriaBuilder.equal(root.get("allowed"), allowed);
        };
    }

    private Specification<AccessLog> hasMethod(AccessMethod method) {
        return (root, query, criteriaBuilder) -> {
            if (method == null) {
                return null;
            }
            return criteriaBuilder.equal(root.get("method"), method);
        };
    }

    private Specification<AccessLog> accessedFrom(LocalDate from) {
        return (root, query, criteriaBuilder) -> {
            if (from == null) {
                return null;
            }
            Instant start = from.atStartOfDay(settingsService.getZoneId()).toInstant();
            return criteriaBuilder.greaterThanOrEqualTo(root.get("accessedAt"), start);
        };
    }

    // Inclusive of the whole "to" day
    private Specification<AccessLog> accessedBefore(LocalDate to) {
        return (root, query, criteriaBuilder) -> {
            if (to == null) {
                return null;
            }
            Instant end = to.plusDays(1).atStartOfDay(settingsService.getZoneId()).toInstant();
            return criteriaBuilder.lessThan(root.get("accessedAt"), end);
        };
    }
}
