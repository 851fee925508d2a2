package se.ironpass_be.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import se.ironpass_be.dto.MembershipStatusSnapshot;
import se.ironpass_be.pojo.enums.MembershipStatus;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MembershipStatusCalculator")
class MembershipStatusCalculatorTest {

    private static final Instant NOW = Instant.parse("2026-05-10T15:00:00Z");

    private final MembershipStatusCalculator calculator = new MembershipStatusCalculator();

    @Nested
    @DisplayName("stored ACTIVE")
    class Active {

        @Test
        @DisplayName("stays active with days rounded up")
        void activeInFuture() {
            MembershipStatusSnapshot snapshot = calculator.calculate(
                    MembershipStatus.ACTIVE, NOW.plus(Duration.ofDays(2)).plus(Duration.ofHours(3)), NOW);

            assertThat(snapshot.getCalculatedStatus()).isEqualTo(MembershipStatus.ACTIVE);
            assertThat(snapshot.getDaysRemaining()).isEqualTo(3);
        }

        @Test
        @DisplayName("less than a day left still counts as one day")
        void lastHours() {
            MembershipStatusSnapshot snapshot = calculator.calculate(
                    MembershipStatus.ACTIVE, NOW.plus(Duration.ofMinutes(5)), NOW);

            assertThat(snapshot.getCalculatedStatus()).isEqualTo(MembershipStatus.ACTIVE);
            assertThat(snapshot.getDaysRemaining()).isEqualTo(1);
        }

        @Test
        @DisplayName("end date in the past reads as expired even before the job ran")
        void lapsed() {
            MembershipStatusSnapshot snapshot = calculator.calculate(
                    MembershipStatus.ACTIVE, NOW.minus(Duration.ofDays(4)), NOW);

            assertThat(snapshot.getCalculatedStatus()).isEqualTo(MembershipStatus.EXPIRED);
            assertThat(snapshot.getDaysRemaining()).isZero();
        }

        @Test
        @DisplayName("end date exactly now is expired")
        void endsNow() {
            MembershipStatusSnapshot snapshot = calculator.calculate(MembershipStatus.ACTIVE, NOW, NOW);

            assertThat(snapshot.getCalculatedStatus()).isEqualTo(MembershipStatus.EXPIRED);
            assertThat(snapshot.getDaysRemaining()).isZero();
        }
    }

    @Nested
    @DisplayName("sticky statuses")
    class Sticky {

        @ParameterizedTest
        @EnumSource(value = MembershipStatus.class, names = {"FROZEN", "CANCELLED", "PENDING_PAYMENT"})
        @DisplayName("keep the stored status with the remaining days")
        void keepsStoredStatus(MembershipStatus status) {
            MembershipStatusSnapshot snapshot = calculator.calculate(status, NOW.plus(Duration.ofDays(10)), NOW);

            assertThat(snapshot.getCalculatedStatus()).isEqualTo(status);
            assertThat(snapshot.getDaysRemaining()).isEqualTo(10);
        }

        @ParameterizedTest
        @EnumSource(value = MembershipStatus.class, names = {"FROZEN", "CANCELLED", "PENDING_PAYMENT"})
        @DisplayName("never go below zero days nor turn into expired")
        void pastEndDate(MembershipStatus status) {
            MembershipStatusSnapshot snapshot = calculator.calculate(status, NOW.minus(Duration.ofDays(30)), NOW);

            assertThat(snapshot.getCalculatedStatus()).isEqualTo(status);
            assertThat(snapshot.getDaysRemaining()).isZero();
        }

        @Test
        @DisplayName("a closed EXPIRED row is not revived by a future end date")
        void expiredStaysExpired() {
            MembershipStatusSnapshot snapshot = calculator.calculate(
                    MembershipStatus.EXPIRED, NOW.plus(Duration.ofDays(5)), NOW);

            assertThat(snapshot.getCalculatedStatus()).isEqualTo(MembershipStatus.EXPIRED);
            assertThat(snapshot.getDaysRemaining()).isZero();
        }
    }
}
