package com.example.timesheet.leave;

import java.math.BigDecimal;

public enum LeaveType {
    FULL_DAY,
    HALF_DAY,
    SHORT_LEAVE;

    private static final BigDecimal SHORT_LEAVE_MAX = new BigDecimal("2");
    private static final BigDecimal HALF_DAY_MAX = new BigDecimal("4");

    /** Up to 2h is a short leave, up to 4h a half day, anything longer a full day. */
    public static LeaveType fromHoursPerDay(BigDecimal hours) {
        if (hours.compareTo(SHORT_LEAVE_MAX) <= 0) {
            return SHORT_LEAVE;
        }
        if (hours.compareTo(HALF_DAY_MAX) <= 0) {
            return HALF_DAY;
        }
        return FULL_DAY;
    }
}
