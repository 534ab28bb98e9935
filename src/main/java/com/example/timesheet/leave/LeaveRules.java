package com.example.timesheet.leave;

import com.example.timesheet.config.TimesheetPolicy;
import com.example.timesheet.exception.RuleViolation;
import com.example.timesheet.task.TaskEntry;
import com.example.timesheet.time.DateRange;
import com.example.timesheet.time.Hours;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Consistency rules for a leave request against the owner's other leave and logged work.
 */
@Component
public class LeaveRules {

    private final TimesheetPolicy policy;

    public LeaveRules(TimesheetPolicy policy) {
        this.policy = policy;
    }

    public List<RuleViolation> validate(LeaveRequest candidate,
                                        Collection<LeaveRequest> existingLeaveForOwner,
                                        Collection<TaskEntry> existingTaskEntriesForOwner) {
        List<RuleViolation> violations = new ArrayList<>();
        BigDecimal hours = candidate.getHoursPerDay();
        if (hours.signum() <= 0 || hours.compareTo(policy.maxLeaveHoursPerDay()) > 0) {
            violations.add(new RuleViolation.InvalidHours(hours, null));
        }
        violations.addAll(checkOverlap(candidate, existingLeaveForOwner));
        violations.addAll(checkTaskConflicts(candidate, existingTaskEntriesForOwner));
        return violations;
    }

    public List<RuleViolation> checkOverlap(LeaveRequest candidate, Collection<LeaveRequest> existingLeaveForOwner) {
        DateRange range = candidate.range();
        return existingLeaveForOwner.stream()
                .filter(l -> Objects.equals(l.getOwnerId(), candidate.getOwnerId()))
                .filter(l -> l.getStatus().countsTowardsLimits())
                .filter(l -> candidate.getId() == null || !candidate.getId().equals(l.getId()))
                .filter(l -> l.range().overlaps(range))
                .<RuleViolation>map(l -> new RuleViolation.LeaveOverlap(l.getId()))
                .toList();
    }

    /**
     * One violation per covered date that already carries logged hours, in date order.
     */
    public List<RuleViolation> checkTaskConflicts(LeaveRequest candidate, Collection<TaskEntry> existingTaskEntriesForOwner) {
        DateRange range = candidate.range();
        Map<LocalDate, BigDecimal> hoursByDate = new TreeMap<>();
        for (TaskEntry entry : existingTaskEntriesForOwner) {
            if (!Objects.equals(entry.getOwnerId(), candidate.getOwnerId())
                    || !entry.getStatus().countsTowardsLimits()
                    || !range.contains(entry.getWorkDate())) {
                continue;
            }
            hoursByDate.merge(entry.getWorkDate(), entry.totalHours(), BigDecimal::add);
        }
        List<RuleViolation> violations = new ArrayList<>();
        hoursByDate.forEach((date, total) -> {
            if (total.compareTo(Hours.ZERO) > 0) {
                violations.add(new RuleViolation.LeaveTaskConflict(date));
            }
        });
        return violations;
    }
}
