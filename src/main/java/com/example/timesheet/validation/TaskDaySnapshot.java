package com.example.timesheet.validation;

import com.example.timesheet.leave.LeaveRequest;
import com.example.timesheet.task.TaskEntry;
import com.example.timesheet.time.DayType;

import java.util.List;
import java.util.Set;

/**
 * Minimal consistency set for a task entry operation: the owner's entries on the work date,
 * the owner's leave covering it, the bookable clients and the kind of day.
 */
public record TaskDaySnapshot(List<TaskEntry> sameDayEntries,
                              List<LeaveRequest> ownerLeave,
                              Set<Long> activeClientIds,
                              DayType dayType) {

    public TaskDaySnapshot {
        sameDayEntries = List.copyOf(sameDayEntries);
        ownerLeave = List.copyOf(ownerLeave);
        activeClientIds = Set.copyOf(activeClientIds);
        dayType = dayType == null ? DayType.WORKING_DAY : dayType;
    }
}
