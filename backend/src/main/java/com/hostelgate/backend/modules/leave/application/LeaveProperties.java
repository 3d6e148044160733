package com.hostelgate.backend.modules.leave.application;

import java.time.Duration;
import java.time.LocalTime;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.format.annotation.DateTimeFormat;

@ConfigurationProperties(prefix = "app.leave")
public record LeaveProperties(
        @DefaultValue Otp otp,
        @DefaultValue GatePass gatePass,
        // Earliest wall-clock gate pass time for leaves that start on a later day.
        @DefaultValue("16:30") @DateTimeFormat(pattern = "HH:mm") LocalTime gatepassCutoff,
        Map<String, String> courseAliases,
        @DefaultValue Expiry expiry
) {

    public LeaveProperties {
        courseAliases = courseAliases == null ? Map.of() : Map.copyOf(courseAliases);
    }

    public record Otp(
            @DefaultValue("PT5M") Duration resendCooldown,
            @DefaultValue("5") int maxFailedAttempts,
            @DefaultValue("PT15M") Duration lockout
    ) {
    }

    public record GatePass(
            @DefaultValue("2") int maxVisits,
            @DefaultValue("PT30S") Duration duplicateWindow,
            @DefaultValue("PT24H") Duration incomingValidity,
            @DefaultValue("PT2M") Duration leaveLeadTime
    ) {
    }

    public record Expiry(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("0 5 0 * * *") String cron
    ) {
    }

    public static LeaveProperties defaults() {
        return new LeaveProperties(
                new Otp(Duration.ofMinutes(5), 5, Duration.ofMinutes(15)),
                new GatePass(2, Duration.ofSeconds(30), Duration.ofHours(24), Duration.ofMinutes(2)),
                LocalTime.of(16, 30),
                Map.of("BTECH", "B.Tech", "B TECH", "B.Tech"),
                new Expiry(true, "0 5 0 * * *")
        );
    }
}
