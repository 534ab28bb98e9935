package com.example.timesheet.time;

public enum DayType {
    WORKING_DAY,
    WORKING_SATURDAY,
    WEEKEND,
    HOLIDAY;

    /** Every hour logged on such a day counts as overtime. */
    public boolean isOvertimeDay() {
        return this == WEEKEND || this == HOLIDAY;
    }
}
