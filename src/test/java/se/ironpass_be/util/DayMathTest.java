package se.ironpass_be.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DayMathTest {

    private static final Instant BASE = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    @DisplayName("ceil rounds partial days up in both directions")
    void ceilDaysBetween() {
        assertThat(DayMath.ceilDaysBetween(BASE, BASE.plus(Duration.ofHours(1)))).isEqualTo(1);
        assertThat(DayMath.ceilDaysBetween(BASE, BASE.plus(Duration.ofDays(3)))).isEqualTo(3);
        assertThat(DayMath.ceilDaysBetween(BASE, BASE)).isZero();
        assertThat(DayMath.ceilDaysBetween(BASE, BASE.minus(Duration.ofHours(1)))).isZero();
        assertThat(DayMath.ceilDaysBetween(BASE, BASE.minus(Duration.ofHours(25)))).isEqualTo(-1);
        assertThat(DayMath.ceilDaysBetween(BASE, BASE.minus(Duration.ofDays(7)))).isEqualTo(-7);
    }

    @Test
    @DisplayName("floor rounds partial days down")
    void floorDaysBetween() {
        assertThat(DayMath.floorDaysBetween(BASE, BASE.plus(Duration.ofHours(47)))).isEqualTo(1);
        assertThat(DayMath.floorDaysBetween(BASE, BASE.minus(Duration.ofHours(1)))).isEqualTo(-1);
    }

    @Test
    void floorMinutesBetween() {
        assertThat(DayMath.floorMinutesBetween(BASE, BASE.plusSeconds(59))).isZero();
        assertThat(DayMath.floorMinutesBetween(BASE, BASE.plusSeconds(61))).isEqualTo(1);
    }
}
