package com.example.timesheet.time;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Set;

/**
 * Snapshot of declared holidays and working Saturdays used to classify dates.
 */
public record WorkCalendar(Set<LocalDate> holidays, Set<LocalDate> workingSaturdays) {

    public WorkCalendar {
        holidays = holidays == null ? Set.of() : Set.copyOf(holidays);
        workingSaturdays = workingSaturdays == null ? Set.of() : Set.copyOf(workingSaturdays);
    }

    public DayType classify(LocalDate date) {
        if (holidays.contains(date)) {
            return DayType.HOLIDAY;
        }
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY && workingSaturdays.contains(date)) {
            return DayType.WORKING_SATURDAY;
        }
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return DayType.WEEKEND;
        }
        return DayType.WORKING_DAY;
    }
}
