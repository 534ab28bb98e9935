package com.example.timesheet.workflow;

import com.example.timesheet.leave.LeaveFilter;
import com.example.timesheet.leave.LeaveRequest;
import com.example.timesheet.task.TaskEntry;
import com.example.timesheet.task.TaskEntryFilter;
import com.example.timesheet.time.DateRange;
import com.example.timesheet.time.DayType;
import org.springframework.data.domain.Pageable;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Persistence collaborator. Supplies the snapshots the validator works on and stores the
 * accepted mutations. All methods are expected to run inside the caller's transaction.
 */
public interface TimesheetStore {

    /**
     * Takes the per-owner write lock. Held until the surrounding transaction ends, it
     * serializes every check of an owner-wide invariant (daily hours, leave coverage).
     */
    void lockOwner(Long ownerId);

    TaskEntry lockTaskEntry(Long id);

    LeaveRequest lockLeaveRequest(Long id);

    TaskEntry findTaskEntry(Long id);

    LeaveRequest findLeaveRequest(Long id);

    List<TaskEntry> loadTaskEntriesForOwnerOnDate(Long ownerId, LocalDate date);

    List<TaskEntry> loadTaskEntriesForOwnerBetween(Long ownerId, LocalDate from, LocalDate to);

    /** Leave of the owner intersecting the range, any status. */
    List<LeaveRequest> loadLeaveForOwnerBetween(Long ownerId, DateRange range);

    List<TaskEntry> findTaskEntries(TaskEntryFilter filter, Pageable page);

    List<LeaveRequest> findLeaveRequests(LeaveFilter filter, Pageable page);

    Set<Long> activeClientIds();

    DayType classify(LocalDate date);

    TaskEntry save(TaskEntry entry);

    LeaveRequest save(LeaveRequest leaveRequest);

    void delete(TaskEntry entry);

    void delete(LeaveRequest leaveRequest);
}
