package com.example.timesheet.validation;

import com.example.timesheet.approval.Approvable;
import com.example.timesheet.approval.ApprovalDecision;
import com.example.timesheet.approval.ApprovalEvent;
import com.example.timesheet.approval.ApprovalStateMachine;
import com.example.timesheet.approval.ApprovalStatus;
import com.example.timesheet.approval.AuditStamp;
import com.example.timesheet.approval.Transition;
import com.example.timesheet.common.Verdict;
import com.example.timesheet.exception.RuleViolation;
import com.example.timesheet.leave.LeaveRequest;
import com.example.timesheet.leave.LeaveRules;
import com.example.timesheet.task.SubTask;
import com.example.timesheet.task.TaskEntry;
import com.example.timesheet.task.TaskEntryRules;
import com.example.timesheet.user.Actor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Single entry point for every timesheet operation.
 * <p>
 * Each method checks the actor, fires the lifecycle event and runs the aggregate rules
 * against the snapshot it is handed, then returns either the complete mutation to apply or
 * the violations. Nothing is loaded, written or mutated here; the caller applies an accepted
 * mutation in the same transaction that produced the snapshot.
 */
@Component
public class TimesheetValidator {

    private final ApprovalStateMachine stateMachine;
    private final TaskEntryRules taskEntryRules;
    private final LeaveRules leaveRules;
    private final Clock clock;

    public TimesheetValidator(ApprovalStateMachine stateMachine,
                              TaskEntryRules taskEntryRules,
                              LeaveRules leaveRules,
                              Clock clock) {
        this.stateMachine = stateMachine;
        this.taskEntryRules = taskEntryRules;
        this.leaveRules = leaveRules;
        this.clock = clock;
    }

    // ---- task entries ----

    public Verdict<EntryMutation> createTaskEntry(Actor actor, TaskEntry candidate, TaskDaySnapshot snapshot) {
        if (!stateMachine.mayFire(candidate.getOwnerId(), ApprovalEvent.CREATE, actor)) {
            return Verdict.rejected(new RuleViolation.Forbidden(ApprovalEvent.CREATE, actor.id()));
        }
        List<RuleViolation> violations = taskEntryRules.validate(candidate, snapshot.sameDayEntries(),
                snapshot.ownerLeave(), snapshot.activeClientIds(), false);
        if (!violations.isEmpty()) {
            return Verdict.rejected(violations);
        }
        return Verdict.accepted(new EntryMutation(ApprovalEvent.CREATE, ApprovalStatus.DRAFT,
                AuditStamp.creation(now(), actor.id()), null, overtime(candidate, snapshot)));
    }

    public Verdict<EntryMutation> updateTaskEntry(Actor actor, TaskEntry current, String taskName,
                                                  List<SubTask> subTasks, TaskDaySnapshot snapshot) {
        return stateMachine.fire(current, ApprovalEvent.UPDATE, actor).flatMap(transition -> {
            TaskEntry revised = current.revisedWith(taskName, subTasks);
            List<RuleViolation> violations = taskEntryRules.validate(revised, snapshot.sameDayEntries(),
                    snapshot.ownerLeave(), snapshot.activeClientIds(), false);
            if (!violations.isEmpty()) {
                return Verdict.rejected(violations);
            }
            return Verdict.accepted(modification(transition, actor, overtime(revised, snapshot)));
        });
    }

    /**
     * Re-runs the full rule set, since other entries of the day may have changed after the
     * draft was saved.
     */
    public Verdict<EntryMutation> submitTaskEntry(Actor actor, TaskEntry current, TaskDaySnapshot snapshot) {
        return stateMachine.fire(current, ApprovalEvent.SUBMIT, actor).flatMap(transition -> {
            List<RuleViolation> violations = taskEntryRules.validate(current, snapshot.sameDayEntries(),
                    snapshot.ownerLeave(), snapshot.activeClientIds(), true);
            if (!violations.isEmpty()) {
                return Verdict.rejected(violations);
            }
            return Verdict.accepted(modification(transition, actor, overtime(current, snapshot)));
        });
    }

    public Verdict<EntryMutation> deleteTaskEntry(Actor actor, TaskEntry current) {
        return remove(actor, current);
    }

    /**
     * Validates stored data as it is. Produces no audit stamp, so running it any number of
     * times leaves the record untouched.
     */
    public Verdict<TaskEntry> recheckTaskEntry(TaskEntry entry, TaskDaySnapshot snapshot) {
        List<RuleViolation> violations = taskEntryRules.validate(entry, snapshot.sameDayEntries(),
                snapshot.ownerLeave(), snapshot.activeClientIds(), entry.getStatus() != ApprovalStatus.DRAFT);
        return violations.isEmpty() ? Verdict.accepted(entry) : Verdict.rejected(violations);
    }

    // ---- leave requests ----

    public Verdict<EntryMutation> createLeave(Actor actor, LeaveRequest candidate, LeaveSnapshot snapshot) {
        if (!stateMachine.mayFire(candidate.getOwnerId(), ApprovalEvent.CREATE, actor)) {
            return Verdict.rejected(new RuleViolation.Forbidden(ApprovalEvent.CREATE, actor.id()));
        }
        List<RuleViolation> violations = leaveRules.validate(candidate, snapshot.ownerLeave(), snapshot.ownerTaskEntries());
        if (!violations.isEmpty()) {
            return Verdict.rejected(violations);
        }
        return Verdict.accepted(new EntryMutation(ApprovalEvent.CREATE, ApprovalStatus.DRAFT,
                AuditStamp.creation(now(), actor.id()), null, null));
    }

    public Verdict<EntryMutation> submitLeave(Actor actor, LeaveRequest current, LeaveSnapshot snapshot) {
        return stateMachine.fire(current, ApprovalEvent.SUBMIT, actor).flatMap(transition -> {
            List<RuleViolation> violations = leaveRules.validate(current, snapshot.ownerLeave(), snapshot.ownerTaskEntries());
            if (!violations.isEmpty()) {
                return Verdict.rejected(violations);
            }
            return Verdict.accepted(modification(transition, actor, null));
        });
    }

    public Verdict<EntryMutation> deleteLeave(Actor actor, LeaveRequest current) {
        return remove(actor, current);
    }

    public Verdict<LeaveRequest> recheckLeave(LeaveRequest leave, LeaveSnapshot snapshot) {
        List<RuleViolation> violations = leaveRules.validate(leave, snapshot.ownerLeave(), snapshot.ownerTaskEntries());
        return violations.isEmpty() ? Verdict.accepted(leave) : Verdict.rejected(violations);
    }

    // ---- administrator decisions, shared by both kinds ----

    public Verdict<EntryMutation> approve(Actor actor, Approvable target, String comment) {
        return decide(actor, target, ApprovalEvent.APPROVE, comment);
    }

    public Verdict<EntryMutation> reject(Actor actor, Approvable target, String comment) {
        return decide(actor, target, ApprovalEvent.REJECT, comment);
    }

    private Verdict<EntryMutation> decide(Actor actor, Approvable target, ApprovalEvent event, String comment) {
        return stateMachine.fire(target, event, actor).map(transition -> {
            Instant now = now();
            ApprovalDecision decision = new ApprovalDecision(transition.to(), actor.id(), now, comment);
            return new EntryMutation(event, transition.to(), AuditStamp.modification(now, actor.id()), decision, null);
        });
    }

    private Verdict<EntryMutation> remove(Actor actor, Approvable target) {
        return stateMachine.fire(target, ApprovalEvent.DELETE, actor)
                .map(transition -> modification(transition, actor, null));
    }

    private EntryMutation modification(Transition transition, Actor actor, BigDecimal overtimeHours) {
        return new EntryMutation(transition.event(), transition.to(),
                AuditStamp.modification(now(), actor.id()), null, overtimeHours);
    }

    private BigDecimal overtime(TaskEntry entry, TaskDaySnapshot snapshot) {
        return taskEntryRules.overtimeHours(snapshot.dayType(), entry.totalHours());
    }

    private Instant now() {
        return Instant.now(clock);
    }
}
