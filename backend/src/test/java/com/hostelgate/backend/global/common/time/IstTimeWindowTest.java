package com.hostelgate.backend.global.common.time;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IstTimeWindowTest {

    @Test
    @DisplayName("late UTC evening already counts as the next IST day")
    void todayFollowsIstCalendar() {
        // 2025-03-10T20:00Z is 2025-03-11T01:30 in IST
        IstTimeWindow window = windowAt("2025-03-10T20:00:00Z");

        assertThat(window.today()).isEqualTo(LocalDate.of(2025, 3, 11));
        assertThat(window.nowInIst()).isEqualTo(LocalDateTime.of(2025, 3, 11, 1, 30));
        assertThat(window.isToday(LocalDate.of(2025, 3, 11))).isTrue();
        assertThat(window.isBeforeToday(LocalDate.of(2025, 3, 10))).isTrue();
    }

    @Test
    @DisplayName("day boundaries are IST midnight expressed in UTC")
    void dayBoundariesAreIstMidnight() {
        IstTimeWindow window = windowAt("2025-03-11T06:00:00Z");

        assertThat(window.startOfToday()).isEqualTo(OffsetDateTime.parse("2025-03-10T18:30:00Z"));
        assertThat(window.startOfTomorrow()).isEqualTo(OffsetDateTime.parse("2025-03-11T18:30:00Z"));
        assertThat(window.endOfDay(LocalDate.of(2025, 3, 11)).getOffset()).isEqualTo(ZoneOffset.UTC);
        assertThat(window.endOfDay(LocalDate.of(2025, 3, 11)))
                .isBefore(window.startOfTomorrow())
                .isAfter(OffsetDateTime.parse("2025-03-11T18:29:59Z"));
    }

    @Test
    @DisplayName("stored UTC timestamps map back to their IST calendar date")
    void toIstDateUsesIstOffset() {
        IstTimeWindow window = windowAt("2025-03-11T06:00:00Z");

        assertThat(window.toIstDate(OffsetDateTime.parse("2025-03-10T18:29:00Z"))).isEqualTo(LocalDate.of(2025, 3, 10));
        assertThat(window.toIstDate(OffsetDateTime.parse("2025-03-10T18:30:00Z"))).isEqualTo(LocalDate.of(2025, 3, 11));
        assertThat(window.isBeforeToday(OffsetDateTime.parse("2025-03-10T18:29:00Z"))).isTrue();
        assertThat(window.toUtc(LocalDateTime.of(2025, 3, 11, 16, 30)))
                .isEqualTo(OffsetDateTime.parse("2025-03-11T11:00:00Z"));
    }

    private static IstTimeWindow windowAt(String instant) {
        return new IstTimeWindow(Clock.fixed(OffsetDateTime.parse(instant).toInstant(), ZoneOffset.UTC));
    }
}
