package se.ironpass_be.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import se.ironpass_be.dto.response.AccessStatsResponse;
import se.ironpass_be.mapper.ModelMapper;
import se.ironpass_be.pojo.AccessLog;
import se.ironpass_be.pojo.Member;
import se.ironpass_be.pojo.enums.AccessMethod;
import se.ironpass_be.repository.AccessLogRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AccessLogService")
class AccessLogServiceTest {

    private static final ZoneId BOGOTA = ZoneId.of("America/Bogota");

    @Mock
    private AccessLogRepository accessLogRepository;

    @Mock
    private SettingsService settingsService;

    private AccessLogService serviceAt(Instant now) {
        return new AccessLogService(accessLogRepository, settingsService, new ModelMapper(),
                Clock.fixed(now, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("record")
    class Record {

        @Test
        @DisplayName("stamps the row with the clock and cuts the reason to the column size")
        void truncatesLongReason() {
            Instant now = Instant.parse("2026-07-15T12:00:00Z");
            when(accessLogRepository.save(any(AccessLog.class))).thenAnswer(invocation -> invocation.getArgument(0));
            Member member = Member.builder().memberId(4L).firstName("Ana").lastName("Ruiz").build();

            AccessLog saved = serviceAt(now).record(member, AccessMethod.MANUAL, false, "x".repeat(300), null, null);

            assertThat(saved.getReason()).hasSize(255);
            assertThat(saved.getAccessedAt()).isEqualTo(now);
            assertThat(saved.isAllowed()).isFalse();
        }

        @Test
        void truncateKeepsShortAndNullReasons() {
            assertThat(AccessLogService.truncate(null)).isNull();
            assertThat(AccessLogService.truncate("Access granted")).isEqualTo("Access granted");
            assertThat(AccessLogService.truncate("y".repeat(255))).hasSize(255);
            assertThat(AccessLogService.truncate("y".repeat(256))).isEqualTo("y".repeat(255));
        }
    }

    @Nested
    @DisplayName("findRecentAllowedEntry")
    class RecentEntry {

        @Test
        @DisplayName("looks back exactly one window from now")
        void windowStart() {
            Instant now = Instant.parse("2026-07-15T12:00:00Z");
            when(accessLogRepository.findFirstByMemberMemberIdAndAllowedTrueAndAccessedAtGreaterThanEqualOrderByAccessedAtDesc(
                    any(), any())).thenReturn(Optional.empty());

            assertThat(serviceAt(now).findRecentAllowedEntry(4L, Duration.ofMinutes(10))).isEmpty();

            ArgumentCaptor<Instant> since = ArgumentCaptor.forClass(Instant.class);
            verify(accessLogRepository)
                    .findFirstByMemberMemberIdAndAllowedTrueAndAccessedAtGreaterThanEqualOrderByAccessedAtDesc(
                            eq(4L), since.capture());
            assertThat(since.getValue()).isEqualTo(Instant.parse("2026-07-15T11:50:00Z"));
        }
    }

    @Nested
    @DisplayName("getTodayStats")
    class TodayStats {

        @Test
        @DisplayName("counts from local midnight even when the UTC date is already the next day")
        void localMidnightBeforeUtcRollover() {
            // 22:00 on the 14th in Bogota
            Instant now = Instant.parse("2026-07-15T03:00:00Z");
            Instant localMidnight = Instant.parse("2026-07-14T05:00:00Z");
            when(settingsService.getZoneId()).thenReturn(BOGOTA);
            when(accessLogRepository.countByAccessedAtGreaterThanEqual(localMidnight)).thenReturn(7L);
            when(accessLogRepository.countByAllowedAndAccessedAtGreaterThanEqual(true, localMidnight)).thenReturn(5L);

            AccessStatsResponse stats = serviceAt(now).getTodayStats();

            assertThat(stats.getTotal()).isEqualTo(7);
            assertThat(stats.getAllowed()).isEqualTo(5);
            assertThat(stats.getDenied()).isEqualTo(2);
        }

        @Test
        @DisplayName("a new local day starts a new count")
        void exactlyAtLocalMidnight() {
            Instant now = Instant.parse("2026-07-15T05:00:00Z");
            when(settingsService.getZoneId()).thenReturn(BOGOTA);
            when(accessLogRepository.countByAccessedAtGreaterThanEqual(now)).thenReturn(0L);
            when(accessLogRepository.countByAllowedAndAccessedAtGreaterThanEqual(true, now)).thenReturn(0L);

            AccessStatsResponse stats = serviceAt(now).getTodayStats();

            assertThat(stats.getTotal()).isZero();
            assertThat(stats.getDenied()).isZero();
        }
    }
}
