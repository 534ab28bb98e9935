package com.example.timesheet.task;

import com.example.timesheet.config.TimesheetPolicy;
import com.example.timesheet.exception.RuleViolation;
import com.example.timesheet.leave.LeaveRequest;
import com.example.timesheet.time.DayType;
import com.example.timesheet.time.Hours;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Consistency rules for one owner's day of task entries. Pure: nothing is mutated.
 */
@Component
public class TaskEntryRules {

    private final TimesheetPolicy policy;

    public TaskEntryRules(TimesheetPolicy policy) {
        this.policy = policy;
    }

    /**
     * Checks a created or revised entry against the rest of the owner's day.
     *
     * @param existingEntriesForDay entries of the same owner and date as currently stored; the
     *                              candidate's prior version may be among them and is skipped
     * @param ownerLeave            leave requests of the owner covering the work date
     * @param activeClientIds       clients sub-tasks may be booked on
     * @param submitting            whether the entry is about to leave {@code DRAFT}
     */
    public List<RuleViolation> validate(TaskEntry candidate,
                                        Collection<TaskEntry> existingEntriesForDay,
                                        Collection<LeaveRequest> ownerLeave,
                                        Set<Long> activeClientIds,
                                        boolean submitting) {
        List<RuleViolation> violations = new ArrayList<>();
        violations.addAll(checkSubTasks(candidate, activeClientIds, submitting));
        checkDailyLimit(candidate, existingEntriesForDay).ifPresent(violations::add);
        checkLeaveCoverage(candidate, ownerLeave).ifPresent(violations::add);
        return violations;
    }

    public List<RuleViolation> checkSubTasks(TaskEntry candidate, Set<Long> activeClientIds, boolean submitting) {
        List<RuleViolation> violations = new ArrayList<>();
        List<SubTask> subTasks = candidate.getSubTasks();
        if (submitting && subTasks.isEmpty()) {
            violations.add(new RuleViolation.EmptySubTaskSet(candidate.getId()));
        }
        BigDecimal granularity = policy.hourGranularity();
        for (SubTask subTask : subTasks) {
            BigDecimal hours = subTask.getHours();
            if (hours.signum() <= 0 || !Hours.isMultipleOf(hours, granularity)) {
                violations.add(new RuleViolation.InvalidHours(hours, granularity));
            }
            Long clientId = subTask.getClientId();
            if (clientId != null && !activeClientIds.contains(clientId)) {
                violations.add(new RuleViolation.UnknownClient(clientId));
            }
        }
        return violations;
    }

    public Optional<RuleViolation> checkDailyLimit(TaskEntry candidate, Collection<TaskEntry> existingEntriesForDay) {
        BigDecimal others = Hours.total(
                existingEntriesForDay.stream()
                        .filter(e -> Objects.equals(e.getOwnerId(), candidate.getOwnerId()))
                        .filter(e -> e.getWorkDate().equals(candidate.getWorkDate()))
                        .filter(e -> e.getStatus().countsTowardsLimits())
                        .filter(e -> candidate.getId() == null || !candidate.getId().equals(e.getId()))
                        .toList(),
                TaskEntry::totalHours);
        BigDecimal attempted = others.add(candidate.totalHours());
        if (attempted.compareTo(policy.dailyHourLimit()) > 0) {
            return Optional.of(new RuleViolation.DailyHoursExceeded(
                    candidate.getWorkDate(), attempted, policy.dailyHourLimit()));
        }
        return Optional.empty();
    }

    public Optional<RuleViolation> checkLeaveCoverage(TaskEntry candidate, Collection<LeaveRequest> ownerLeave) {
        if (candidate.totalHours().signum() == 0) {
            return Optional.empty();
        }
        boolean onLeave = ownerLeave.stream()
                .filter(l -> Objects.equals(l.getOwnerId(), candidate.getOwnerId()))
                .filter(l -> l.getStatus().countsTowardsLimits())
                .anyMatch(l -> l.range().contains(candidate.getWorkDate()));
        if (onLeave) {
            return Optional.of(new RuleViolation.LeaveTaskConflict(candidate.getWorkDate()));
        }
        return Optional.empty();
    }

    /** Every hour on a weekend or holiday is overtime. */
    public BigDecimal overtimeHours(DayType dayType, BigDecimal totalHours) {
        return dayType.isOvertimeDay() ? totalHours : Hours.ZERO;
    }
}
