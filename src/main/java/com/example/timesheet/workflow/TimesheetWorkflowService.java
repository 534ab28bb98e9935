package com.example.timesheet.workflow;

import com.example.timesheet.approval.ApprovalDecidedEvent;
import com.example.timesheet.approval.ApprovalDecidedEvent.RecordKind;
import com.example.timesheet.approval.ApprovalEvent;
import com.example.timesheet.approval.ApprovalStatus;
import com.example.timesheet.common.Verdict;
import com.example.timesheet.exception.ResourceNotFoundException;
import com.example.timesheet.exception.RuleViolation;
import com.example.timesheet.exception.RuleViolationException;
import com.example.timesheet.leave.LeaveFilter;
import com.example.timesheet.leave.LeaveRequest;
import com.example.timesheet.task.SubTask;
import com.example.timesheet.task.TaskEntry;
import com.example.timesheet.task.TaskEntryFilter;
import com.example.timesheet.time.DateRange;
import com.example.timesheet.user.Actor;
import com.example.timesheet.user.UserDirectory;
import com.example.timesheet.validation.EntryMutation;
import com.example.timesheet.validation.LeaveSnapshot;
import com.example.timesheet.validation.TaskDaySnapshot;
import com.example.timesheet.validation.TimesheetValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Runs timesheet operations inside one transaction each: resolve the caller, take the row
 * locks, load a snapshot, ask {@link TimesheetValidator} for a verdict and apply it.
 * <p>
 * Lock order is always record row before owner row. Owner-scoped checks (daily hour cap,
 * leave overlap, leave/task conflict) run under the owner lock so two writers for the same
 * person never validate against the same stale snapshot.
 */
@Service
@Transactional
public class TimesheetWorkflowService {

    private static final Logger logger = LoggerFactory.getLogger(TimesheetWorkflowService.class);

    /** Upper bound for one page of a listing. */
    public static final int MAX_PAGE_SIZE = 100;

    private final UserDirectory userDirectory;
    private final TimesheetStore store;
    private final TimesheetValidator validator;
    private final ApplicationEventPublisher eventPublisher;

    public TimesheetWorkflowService(UserDirectory userDirectory,
                                    TimesheetStore store,
                                    TimesheetValidator validator,
                                    ApplicationEventPublisher eventPublisher) {
        this.userDirectory = userDirectory;
        this.store = store;
        this.validator = validator;
        this.eventPublisher = eventPublisher;
    }

    // ---- task entries ----

    public TaskEntry createTaskEntry(Long actorId, LocalDate workDate, String taskName, List<SubTask> subTasks) {
        Actor actor = userDirectory.resolve(actorId);
        store.lockOwner(actor.id());

        TaskEntry candidate = new TaskEntry(actor.id(), workDate, taskName, subTasks);
        EntryMutation mutation = accept(
                validator.createTaskEntry(actor, candidate, taskDaySnapshot(actor.id(), workDate)),
                "create task entry", actor);

        candidate.setStatus(mutation.status());
        candidate.applyAudit(mutation.audit());
        candidate.applyOvertime(mutation.overtimeHours());
        TaskEntry saved = store.save(candidate);

        logger.info("Task entry created: ID={}, owner={}, date={}, hours={}",
                saved.getId(), saved.getOwnerId(), saved.getWorkDate(), saved.totalHours());
        return saved;
    }

    public TaskEntry updateTaskEntry(Long actorId, Long entryId, String taskName, List<SubTask> subTasks) {
        Actor actor = userDirectory.resolve(actorId);
        TaskEntry entry = store.lockTaskEntry(entryId);
        store.lockOwner(entry.getOwnerId());

        EntryMutation mutation = accept(
                validator.updateTaskEntry(actor, entry, taskName, subTasks,
                        taskDaySnapshot(entry.getOwnerId(), entry.getWorkDate())),
                "update task entry " + entryId, actor);

        entry.replaceContent(taskName, subTasks);
        entry.setStatus(mutation.status());
        entry.applyAudit(mutation.audit());
        entry.applyOvertime(mutation.overtimeHours());
        TaskEntry saved = store.save(entry);

        logger.info("Task entry updated: ID={}, hours={}", saved.getId(), saved.totalHours());
        return saved;
    }

    public TaskEntry submitTaskEntry(Long actorId, Long entryId) {
        Actor actor = userDirectory.resolve(actorId);
        TaskEntry entry = store.lockTaskEntry(entryId);
        store.lockOwner(entry.getOwnerId());

        EntryMutation mutation = accept(
                validator.submitTaskEntry(actor, entry,
                        taskDaySnapshot(entry.getOwnerId(), entry.getWorkDate())),
                "submit task entry " + entryId, actor);

        entry.setStatus(mutation.status());
        entry.applyAudit(mutation.audit());
        entry.applyOvertime(mutation.overtimeHours());
        TaskEntry saved = store.save(entry);

        logger.info("Task entry submitted: ID={}, owner={}", saved.getId(), saved.getOwnerId());
        return saved;
    }

    public void deleteTaskEntry(Long actorId, Long entryId) {
        Actor actor = userDirectory.resolve(actorId);
        TaskEntry entry = store.lockTaskEntry(entryId);

        accept(validator.deleteTaskEntry(actor, entry), "delete task entry " + entryId, actor);
        store.delete(entry);
        logger.info("Task entry deleted: ID={}, owner={}", entryId, entry.getOwnerId());
    }

    public TaskEntry approveTaskEntry(Long actorId, Long entryId, String comment) {
        return decideTaskEntry(actorId, entryId, ApprovalEvent.APPROVE, comment);
    }

    public TaskEntry rejectTaskEntry(Long actorId, Long entryId, String comment) {
        return decideTaskEntry(actorId, entryId, ApprovalEvent.REJECT, comment);
    }

    private TaskEntry decideTaskEntry(Long actorId, Long entryId, ApprovalEvent event, String comment) {
        Actor actor = userDirectory.resolve(actorId);
        TaskEntry entry = store.lockTaskEntry(entryId);

        Verdict<EntryMutation> verdict = event == ApprovalEvent.APPROVE
                ? validator.approve(actor, entry, comment)
                : validator.reject(actor, entry, comment);
        EntryMutation mutation = accept(verdict, event.label() + " task entry " + entryId, actor);

        entry.applyDecision(mutation.decision());
        entry.applyAudit(mutation.audit());
        TaskEntry saved = store.save(entry);

        eventPublisher.publishEvent(new ApprovalDecidedEvent(RecordKind.TASK_ENTRY,
                saved.getId(), saved.getOwnerId(), mutation.decision()));
        logger.info("Task entry {}: ID={}, by={}", saved.getStatus(), saved.getId(), actor.id());
        return saved;
    }

    /**
     * Entry visible to the caller: their own, or any entry for an administrator. Others get
     * the same 404 as a missing id.
     */
    @Transactional(readOnly = true)
    public TaskEntry getTaskEntry(Long actorId, Long entryId) {
        return visibleTaskEntry(userDirectory.resolve(actorId), entryId);
    }

    /**
     * Validates a stored entry against the current state of its day. Writes nothing.
     */
    @Transactional(readOnly = true)
    public List<RuleViolation> recheckTaskEntry(Long actorId, Long entryId) {
        TaskEntry entry = visibleTaskEntry(userDirectory.resolve(actorId), entryId);
        return validator.recheckTaskEntry(entry, taskDaySnapshot(entry.getOwnerId(), entry.getWorkDate()))
                .violations();
    }

    /** The caller's own entries matching {@code filter}, newest work date first. */
    @Transactional(readOnly = true)
    public List<TaskEntry> listTaskEntries(Long actorId, TaskEntryFilter filter, int page, int size) {
        Actor actor = userDirectory.resolve(actorId);
        requireOrdered(filter.from(), filter.to());
        return store.findTaskEntries(filter.forOwner(actor.id()), pageOf(page, size, "workDate"));
    }

    /** Administrator queue over all owners, usually filtered to {@code SUBMITTED}. */
    @Transactional(readOnly = true)
    public List<TaskEntry> taskEntryQueue(Long actorId, ApprovalStatus status, int page, int size) {
        requireAdmin(actorId);
        return store.findTaskEntries(TaskEntryFilter.withStatus(status), pageOf(page, size, "workDate"));
    }

    // ---- leave requests ----

    public LeaveRequest createLeave(Long actorId, LocalDate startDate, LocalDate endDate,
                                    BigDecimal hoursPerDay, String reason) {
        Actor actor = userDirectory.resolve(actorId);
        store.lockOwner(actor.id());

        LeaveRequest candidate = new LeaveRequest(actor.id(), DateRange.of(startDate, endDate), hoursPerDay, reason);
        EntryMutation mutation = accept(
                validator.createLeave(actor, candidate, leaveSnapshot(actor.id(), candidate.range())),
                "create leave request", actor);

        candidate.setStatus(mutation.status());
        candidate.applyAudit(mutation.audit());
        LeaveRequest saved = store.save(candidate);

        logger.info("Leave request created: ID={}, owner={}, range={}, type={}",
                saved.getId(), saved.getOwnerId(), saved.range(), saved.getLeaveType());
        return saved;
    }

    public LeaveRequest submitLeave(Long actorId, Long leaveId) {
        Actor actor = userDirectory.resolve(actorId);
        LeaveRequest leave = store.lockLeaveRequest(leaveId);
        store.lockOwner(leave.getOwnerId());

        EntryMutation mutation = accept(
                validator.submitLeave(actor, leave, leaveSnapshot(leave.getOwnerId(), leave.range())),
                "submit leave request " + leaveId, actor);

        leave.setStatus(mutation.status());
        leave.applyAudit(mutation.audit());
        LeaveRequest saved = store.save(leave);

        logger.info("Leave request submitted: ID={}, owner={}", saved.getId(), saved.getOwnerId());
        return saved;
    }

    public void deleteLeave(Long actorId, Long leaveId) {
        Actor actor = userDirectory.resolve(actorId);
        LeaveRequest leave = store.lockLeaveRequest(leaveId);

        accept(validator.deleteLeave(actor, leave), "delete leave request " + leaveId, actor);
        store.delete(leave);
        logger.info("Leave request deleted: ID={}, owner={}", leaveId, leave.getOwnerId());
    }

    public LeaveRequest approveLeave(Long actorId, Long leaveId, String comment) {
        return decideLeave(actorId, leaveId, ApprovalEvent.APPROVE, comment);
    }

    public LeaveRequest rejectLeave(Long actorId, Long leaveId, String comment) {
        return decideLeave(actorId, leaveId, ApprovalEvent.REJECT, comment);
    }

    private LeaveRequest decideLeave(Long actorId, Long leaveId, ApprovalEvent event, String comment) {
        Actor actor = userDirectory.resolve(actorId);
        LeaveRequest leave = store.lockLeaveRequest(leaveId);

        Verdict<EntryMutation> verdict = event == ApprovalEvent.APPROVE
                ? validator.approve(actor, leave, comment)
                : validator.reject(actor, leave, comment);
        EntryMutation mutation = accept(verdict, event.label() + " leave request " + leaveId, actor);

        leave.applyDecision(mutation.decision());
        leave.applyAudit(mutation.audit());
        LeaveRequest saved = store.save(leave);

        eventPublisher.publishEvent(new ApprovalDecidedEvent(RecordKind.LEAVE_REQUEST,
                saved.getId(), saved.getOwnerId(), mutation.decision()));
        logger.info("Leave request {}: ID={}, by={}", saved.getStatus(), saved.getId(), actor.id());
        return saved;
    }

    @Transactional(readOnly = true)
    public LeaveRequest getLeave(Long actorId, Long leaveId) {
        return visibleLeave(userDirectory.resolve(actorId), leaveId);
    }

    @Transactional(readOnly = true)
    public List<RuleViolation> recheckLeave(Long actorId, Long leaveId) {
        LeaveRequest leave = visibleLeave(userDirectory.resolve(actorId), leaveId);
        return validator.recheckLeave(leave, leaveSnapshot(leave.getOwnerId(), leave.range())).violations();
    }

    @Transactional(readOnly = true)
    public List<LeaveRequest> listLeave(Long actorId, LeaveFilter filter, int page, int size) {
        Actor actor = userDirectory.resolve(actorId);
        requireOrdered(filter.from(), filter.to());
        return store.findLeaveRequests(filter.forOwner(actor.id()), pageOf(page, size, "startDate"));
    }

    @Transactional(readOnly = true)
    public List<LeaveRequest> leaveQueue(Long actorId, ApprovalStatus status, int page, int size) {
        requireAdmin(actorId);
        return store.findLeaveRequests(LeaveFilter.withStatus(status), pageOf(page, size, "startDate"));
    }

    // ---- helpers ----

    private TaskDaySnapshot taskDaySnapshot(Long ownerId, LocalDate workDate) {
        return new TaskDaySnapshot(
                store.loadTaskEntriesForOwnerOnDate(ownerId, workDate),
                store.loadLeaveForOwnerBetween(ownerId, DateRange.single(workDate)),
                store.activeClientIds(),
                store.classify(workDate));
    }

    private LeaveSnapshot leaveSnapshot(Long ownerId, DateRange range) {
        return new LeaveSnapshot(
                store.loadLeaveForOwnerBetween(ownerId, range),
                store.loadTaskEntriesForOwnerBetween(ownerId, range.start(), range.end()));
    }

    private TaskEntry visibleTaskEntry(Actor actor, Long entryId) {
        TaskEntry entry = store.findTaskEntry(entryId);
        if (!actor.isAdmin() && !actor.is(entry.getOwnerId())) {
            throw new ResourceNotFoundException("Task entry", entryId);
        }
        return entry;
    }

    private LeaveRequest visibleLeave(Actor actor, Long leaveId) {
        LeaveRequest leave = store.findLeaveRequest(leaveId);
        if (!actor.isAdmin() && !actor.is(leave.getOwnerId())) {
            throw new ResourceNotFoundException("Leave request", leaveId);
        }
        return leave;
    }

    private static void requireOrdered(LocalDate from, LocalDate to) {
        if (from != null && to != null) {
            DateRange.of(from, to);
        }
    }

    /** Page {@code page} of at most {@link #MAX_PAGE_SIZE} rows, latest {@code dateProperty} first. */
    private static Pageable pageOf(int page, int size, String dateProperty) {
        return PageRequest.of(page, Math.min(size, MAX_PAGE_SIZE),
                Sort.by(Sort.Order.desc(dateProperty), Sort.Order.desc("id")));
    }

    private void requireAdmin(Long actorId) {
        Actor actor = userDirectory.resolve(actorId);
        if (!actor.isAdmin()) {
            logger.warn("User {} requested the approval queue without the admin role", actorId);
            throw new RuleViolationException(new RuleViolation.Forbidden(ApprovalEvent.APPROVE, actorId));
        }
    }

    private <T> T accept(Verdict<T> verdict, String operation, Actor actor) {
        if (verdict.isRejected()) {
            logger.warn("Rejected {} for user {}: {}", operation, actor.id(), verdict.violations());
        }
        return verdict.orElseThrow();
    }
}
