package com.hostelgate.backend.modules.leave.application;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

import com.hostelgate.backend.global.common.time.IstTimeWindow;
import com.hostelgate.backend.global.error.RequestValidationException;
import com.hostelgate.backend.modules.leave.domain.LeaveSchedule;
import com.hostelgate.backend.modules.leave.infrastructure.persistence.LeaveRequestRepository;

import org.springframework.stereotype.Component;

/**
 * Checks a submission against the calendar rules of its type and the one-request-per-day limit.
 * Collects every field error before failing.
 */
@Component
public class LeaveRequestValidator {

    private static final Pattern TIME_PATTERN = Pattern.compile("^([0-1]?[0-9]|2[0-3]):[0-5][0-9]$");
    private static final int MAX_REASON_LENGTH = 500;

    private final IstTimeWindow timeWindow;
    private final LeaveRequestRepository leaveRequestRepository;
    private final LeaveProperties properties;

    public LeaveRequestValidator(
            IstTimeWindow timeWindow,
            LeaveRequestRepository leaveRequestRepository,
            LeaveProperties properties
    ) {
        this.timeWindow = timeWindow;
        this.leaveRequestRepository = leaveRequestRepository;
        this.properties = properties;
    }

    public LeaveSchedule validate(UUID studentId, CreateLeaveCommand command) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (command.applicationType() == null) {
            errors.put("applicationType", "Application type is required");
            validateReason(command.reason(), errors);
            throw new RequestValidationException(errors);
        }

        LeaveSchedule schedule = switch (command.applicationType()) {
            case LEAVE -> validateLeave(command, errors);
            case PERMISSION -> validatePermission(command, errors);
            case STAY_IN_HOSTEL -> validateStay(command, errors);
        };
        validateReason(command.reason(), errors);

        if (!errors.isEmpty()) {
            throw new RequestValidationException(errors);
        }

        if (leaveRequestRepository.existsCreatedBetween(
                studentId,
                command.applicationType(),
                timeWindow.startOfToday(),
                timeWindow.startOfTomorrow())) {
            throw LeaveProblems.dailyLimitExceeded(command.applicationType());
        }
        return schedule;
    }

    private LeaveSchedule validateLeave(CreateLeaveCommand command, Map<String, String> errors) {
        LocalDate startDate = command.startDate();
        LocalDate endDate = command.endDate();
        LocalDateTime gatePassDateTime = command.gatePassDateTime();

        if (startDate == null) {
            errors.put("startDate", "Start date is required");
        } else if (timeWindow.isBeforeToday(startDate)) {
            errors.put("startDate", "Start date cannot be in the past");
        }
        if (endDate == null) {
            errors.put("endDate", "End date is required");
        } else if (startDate != null && !endDate.isAfter(startDate)) {
            errors.put("endDate", "End date must be after start date");
        }
        if (gatePassDateTime == null) {
            errors.put("gatePassDateTime", "Gate pass date and time is required");
        } else if (startDate != null && timeWindow.isToday(startDate)) {
            if (gatePassDateTime.isBefore(timeWindow.nowInIst())) {
                errors.put("gatePassDateTime", "Gate pass time cannot be in the past");
            }
        } else if (gatePassDateTime.toLocalTime().isBefore(properties.gatepassCutoff())) {
            errors.put("gatePassDateTime", "Gate pass time must be " + properties.gatepassCutoff() + " or later");
        }

        if (startDate == null || endDate == null || gatePassDateTime == null) {
            return null;
        }
        return new LeaveSchedule.LeaveWindow(startDate, endDate, gatePassDateTime);
    }

    private LeaveSchedule validatePermission(CreateLeaveCommand command, Map<String, String> errors) {
        LocalDate permissionDate = command.permissionDate();
        if (permissionDate == null) {
            errors.put("permissionDate", "Permission date is required");
        } else if (timeWindow.isBeforeToday(permissionDate)) {
            errors.put("permissionDate", "Permission date cannot be in the past");
        }

        LocalTime outTime = parseTime("outTime", "Out time", command.outTime(), errors);
        LocalTime inTime = parseTime("inTime", "In time", command.inTime(), errors);
        if (outTime != null && inTime != null && !outTime.isBefore(inTime)) {
            errors.put("inTime", "In time must be after out time");
        }

        if (permissionDate == null || outTime == null || inTime == null) {
            return null;
        }
        return new LeaveSchedule.PermissionWindow(permissionDate, outTime, inTime);
    }

    private LeaveSchedule validateStay(CreateLeaveCommand command, Map<String, String> errors) {
        LocalDate stayDate = command.stayDate();
        if (stayDate == null) {
            errors.put("stayDate", "Stay date is required");
            return null;
        }
        LocalDate today = timeWindow.today();
        if (!stayDate.equals(today) && !stayDate.equals(today.plusDays(1))) {
            errors.put("stayDate", "Stay date must be today or tomorrow");
            return null;
        }
        return new LeaveSchedule.StayWindow(stayDate);
    }

    private static void validateReason(String reason, Map<String, String> errors) {
        if (reason == null || reason.isBlank()) {
            errors.put("reason", "Reason is required");
        } else if (reason.trim().length() > MAX_REASON_LENGTH) {
            errors.put("reason", "Reason must be at most " + MAX_REASON_LENGTH + " characters");
        }
    }

    private static LocalTime parseTime(String field, String label, String raw, Map<String, String> errors) {
        if (raw == null || raw.isBlank()) {
            errors.put(field, label + " is required");
            return null;
        }
        String trimmed = raw.trim();
        if (!TIME_PATTERN.matcher(trimmed).matches()) {
            errors.put(field, label + " must be in HH:mm format");
            return null;
        }
        String[] parts = trimmed.split(":");
        return LocalTime.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
    }
}
