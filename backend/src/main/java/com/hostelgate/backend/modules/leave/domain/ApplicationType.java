package com.hostelgate.backend.modules.leave.domain;

public enum ApplicationType {
    LEAVE,
    PERMISSION,
    STAY_IN_HOSTEL;

    /** Leave and permission requests end in a scannable gate pass; stay-in-hostel requests never leave the premises. */
    public boolean hasGatePass() {
        return this != STAY_IN_HOSTEL;
    }
}
