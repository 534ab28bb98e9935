package com.example.timesheet.validation;

import com.example.timesheet.leave.LeaveRequest;
import com.example.timesheet.task.TaskEntry;

import java.util.List;

/**
 * Minimal consistency set for a leave operation: the owner's leave requests and the owner's
 * task entries inside the requested range.
 */
public record LeaveSnapshot(List<LeaveRequest> ownerLeave, List<TaskEntry> ownerTaskEntries) {

    public LeaveSnapshot {
        ownerLeave = List.copyOf(ownerLeave);
        ownerTaskEntries = List.copyOf(ownerTaskEntries);
    }
}
