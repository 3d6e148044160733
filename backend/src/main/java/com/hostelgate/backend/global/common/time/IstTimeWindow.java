package com.hostelgate.backend.global.common.time;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Calendar arithmetic pinned to India Standard Time.
 * <p>
 * Requests are filed across the IST day boundary while the server and the database run in UTC, so every
 * "today", daily-limit and expiry decision goes through this class instead of {@code LocalDate.now()}.
 * Returned instants are UTC {@link OffsetDateTime}s, matching the storage columns.
 */
public class IstTimeWindow {

    public static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private final Clock clock;

    public IstTimeWindow(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
    }

    /** Current IST wall-clock time. */
    public LocalDateTime nowInIst() {
        return LocalDateTime.ofInstant(clock.instant(), IST);
    }

    public LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), IST);
    }

    public OffsetDateTime startOfToday() {
        return startOfDay(today());
    }

    public OffsetDateTime startOfTomorrow() {
        return startOfDay(today().plusDays(1));
    }

    public OffsetDateTime startOfDay(LocalDate date) {
        return date.atStartOfDay(IST).toOffsetDateTime().withOffsetSameInstant(ZoneOffset.UTC);
    }

    public OffsetDateTime endOfDay(LocalDate date) {
        return date.atTime(LocalTime.MAX).atZone(IST).toOffsetDateTime().withOffsetSameInstant(ZoneOffset.UTC);
    }

    public OffsetDateTime toUtc(LocalDateTime istDateTime) {
        return istDateTime.atZone(IST).toOffsetDateTime().withOffsetSameInstant(ZoneOffset.UTC);
    }

    public LocalDate toIstDate(OffsetDateTime timestamp) {
        return LocalDate.ofInstant(timestamp.toInstant(), IST);
    }

    public boolean isToday(LocalDate date) {
        return today().equals(date);
    }

    public boolean isBeforeToday(LocalDate date) {
        return date.isBefore(today());
    }

    public boolean isBeforeToday(OffsetDateTime timestamp) {
        return isBeforeToday(toIstDate(timestamp));
    }
}
