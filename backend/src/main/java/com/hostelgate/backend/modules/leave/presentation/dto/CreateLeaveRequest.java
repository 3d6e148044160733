package com.hostelgate.backend.modules.leave.presentation.dto;

import java.time.LocalDate;
import java.time.LocalDateTime;

import com.hostelgate.backend.modules.leave.application.CreateLeaveCommand;
import com.hostelgate.backend.modules.leave.domain.ApplicationType;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateLeaveRequest(
        @NotNull ApplicationType applicationType,
        LocalDate startDate,
        LocalDate endDate,
        LocalDateTime gatePassDateTime,
        LocalDate permissionDate,
        String outTime,
        String inTime,
        LocalDate stayDate,
        @Size(max = 500) String reason
) {

    public CreateLeaveCommand toCommand() {
        return new CreateLeaveCommand(
                applicationType,
                startDate,
                endDate,
                gatePassDateTime,
                permissionDate,
                outTime,
                inTime,
                stayDate,
                reason
        );
    }
}
