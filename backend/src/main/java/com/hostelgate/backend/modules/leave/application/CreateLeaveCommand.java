package com.hostelgate.backend.modules.leave.application;

import java.time.LocalDate;
import java.time.LocalDateTime;

import com.hostelgate.backend.modules.leave.domain.ApplicationType;

/**
 * Raw submission fields. Times of a permission arrive as {@code HH:mm} strings and are checked by the validator.
 */
public record CreateLeaveCommand(
        ApplicationType applicationType,
        LocalDate startDate,
        LocalDate endDate,
        LocalDateTime gatePassDateTime,
        LocalDate permissionDate,
        String outTime,
        String inTime,
        LocalDate stayDate,
        String reason
) {
}
