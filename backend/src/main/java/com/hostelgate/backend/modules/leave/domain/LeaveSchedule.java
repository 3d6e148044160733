package com.hostelgate.backend.modules.leave.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;

/**
 * When the student intends to be away (or to stay). Exactly one variant applies per application type.
 * Dates are IST calendar dates and times are IST wall-clock times.
 */
public sealed interface LeaveSchedule permits LeaveSchedule.LeaveWindow, LeaveSchedule.PermissionWindow, LeaveSchedule.StayWindow {

    ApplicationType applicationType();

    /** Last IST calendar day the request covers. */
    LocalDate lastDate();

    record LeaveWindow(LocalDate startDate, LocalDate endDate, LocalDateTime gatePassDateTime) implements LeaveSchedule {

        public LeaveWindow {
            Objects.requireNonNull(startDate, "startDate");
            Objects.requireNonNull(endDate, "endDate");
            Objects.requireNonNull(gatePassDateTime, "gatePassDateTime");
        }

        @Override
        public ApplicationType applicationType() {
            return ApplicationType.LEAVE;
        }

        @Override
        public LocalDate lastDate() {
            return endDate;
        }
    }

    record PermissionWindow(LocalDate permissionDate, LocalTime outTime, LocalTime inTime) implements LeaveSchedule {

        public PermissionWindow {
            Objects.requireNonNull(permissionDate, "permissionDate");
            Objects.requireNonNull(outTime, "outTime");
            Objects.requireNonNull(inTime, "inTime");
        }

        @Override
        public ApplicationType applicationType() {
            return ApplicationType.PERMISSION;
        }

        @Override
        public LocalDate lastDate() {
            return permissionDate;
        }
    }

    record StayWindow(LocalDate stayDate) implements LeaveSchedule {

        public StayWindow {
            Objects.requireNonNull(stayDate, "stayDate");
        }

        @Override
        public ApplicationType applicationType() {
            return ApplicationType.STAY_IN_HOSTEL;
        }

        @Override
        public LocalDate lastDate() {
            return stayDate;
        }
    }
}
