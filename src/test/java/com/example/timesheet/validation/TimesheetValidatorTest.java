package com.example.timesheet.validation;

import com.example.timesheet.Fixtures;
import com.example.timesheet.approval.ApprovalEvent;
import com.example.timesheet.approval.ApprovalStateMachine;
import com.example.timesheet.approval.ApprovalStatus;
import com.example.timesheet.common.Verdict;
import com.example.timesheet.exception.RuleViolation;
import com.example.timesheet.leave.LeaveRequest;
import com.example.timesheet.leave.LeaveRules;
import com.example.timesheet.task.SubTask;
import com.example.timesheet.task.TaskEntry;
import com.example.timesheet.task.TaskEntryRules;
import com.example.timesheet.time.DateRange;
import com.example.timesheet.time.DayType;
import com.example.timesheet.user.Actor;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TimesheetValidatorTest {

    private static final Instant NOW = Instant.parse("2026-02-10T09:00:00Z");
    private static final Long OWNER = 5L;
    private static final Long CLIENT = 40L;
    private static final LocalDate FEB_10 = LocalDate.of(2026, 2, 10);

    private final Actor owner = Fixtures.employee(OWNER);
    private final Actor admin = Fixtures.admin(1L);

    private final TimesheetValidator validator = new TimesheetValidator(
            new ApprovalStateMachine(),
            new TaskEntryRules(Fixtures.defaultPolicy()),
            new LeaveRules(Fixtures.defaultPolicy()),
            Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void createTaskEntry_acceptedAsDraftWithCreationAudit() {
        TaskEntry candidate = entry(null, "3");

        EntryMutation mutation = validator.createTaskEntry(owner, candidate, day(List.of(), DayType.WORKING_DAY)).value();

        assertThat(mutation.status()).isEqualTo(ApprovalStatus.DRAFT);
        assertThat(mutation.audit().createdAt()).isEqualTo(NOW);
        assertThat(mutation.audit().createdBy()).isEqualTo(OWNER);
        assertThat(mutation.audit().updatedAt()).isEqualTo(NOW);
        assertThat(mutation.overtimeHours()).isEqualByComparingTo("0");
    }

    @Test
    void createTaskEntry_onWeekend_countsAllHoursAsOvertime() {
        TaskEntry candidate = entry(null, "4.5");

        EntryMutation mutation = validator.createTaskEntry(owner, candidate, day(List.of(), DayType.WEEKEND)).value();

        assertThat(mutation.overtimeHours()).isEqualTo(new BigDecimal("4.50"));
    }

    @Test
    void createTaskEntry_forSomeoneElse_isForbidden() {
        TaskEntry candidate = entry(null, "3");

        Verdict<EntryMutation> verdict = validator.createTaskEntry(admin, candidate, day(List.of(), DayType.WORKING_DAY));

        assertThat(verdict.violations()).containsExactly(new RuleViolation.Forbidden(ApprovalEvent.CREATE, 1L));
    }

    @Test
    void createTaskEntry_reportsEveryViolationAtOnce() {
        TaskEntry existing = entry(1L, "7");
        TaskEntry candidate = new TaskEntry(OWNER, FEB_10, "bad", List.of(SubTask.of(999L, "unknown", "2")));
        LeaveRequest leave = new LeaveRequest(OWNER, DateRange.single(FEB_10), "sick");

        TaskDaySnapshot snapshot = new TaskDaySnapshot(List.of(existing), List.of(leave), Set.of(CLIENT), DayType.WORKING_DAY);

        assertThat(validator.createTaskEntry(owner, candidate, snapshot).violations()).containsExactly(
                new RuleViolation.UnknownClient(999L),
                new RuleViolation.DailyHoursExceeded(FEB_10, new BigDecimal("9.00"), new BigDecimal("8.00")),
                new RuleViolation.LeaveTaskConflict(FEB_10));
    }

    @Test
    void updateTaskEntry_validatesRevisedContentWithoutMutatingTheCurrentEntry() {
        TaskEntry current = entry(1L, "2");
        TaskEntry other = entry(2L, "5");

        Verdict<EntryMutation> verdict = validator.updateTaskEntry(owner, current, null,
                List.of(SubTask.of(CLIENT, "more", "4")), day(List.of(current, other), DayType.WORKING_DAY));

        assertThat(verdict.violations()).singleElement()
                .isEqualTo(new RuleViolation.DailyHoursExceeded(FEB_10, new BigDecimal("9.00"), new BigDecimal("8.00")));
        assertThat(current.totalHours()).isEqualTo(new BigDecimal("2.00"));
    }

    @Test
    void submitTaskEntry_emptyDraftIsRejected() {
        TaskEntry empty = new TaskEntry(OWNER, FEB_10, "later", List.of());
        Fixtures.withId(empty, 3L);

        assertThat(validator.submitTaskEntry(owner, empty, day(List.of(empty), DayType.WORKING_DAY)).violations())
                .containsExactly(new RuleViolation.EmptySubTaskSet(3L));
    }

    @Test
    void submitTaskEntry_movesToSubmitted() {
        TaskEntry draft = entry(3L, "6");

        EntryMutation mutation = validator.submitTaskEntry(owner, draft, day(List.of(draft), DayType.WORKING_DAY)).value();

        assertThat(mutation.status()).isEqualTo(ApprovalStatus.SUBMITTED);
        assertThat(mutation.audit().isCreation()).isFalse();
        assertThat(mutation.audit().updatedBy()).isEqualTo(OWNER);
    }

    @Test
    void approve_carriesDecisionAndAudit() {
        TaskEntry submitted = entry(4L, "6");
        submitted.setStatus(ApprovalStatus.SUBMITTED);

        EntryMutation mutation = validator.approve(admin, submitted, "  ").value();

        assertThat(mutation.status()).isEqualTo(ApprovalStatus.APPROVED);
        assertThat(mutation.decision().actorId()).isEqualTo(1L);
        assertThat(mutation.decision().decidedAt()).isEqualTo(NOW);
        assertThat(mutation.decision().comment()).isNull();
        assertThat(mutation.audit().updatedBy()).isEqualTo(1L);
    }

    @Test
    void reject_keepsTheComment() {
        LeaveRequest submitted = new LeaveRequest(OWNER, DateRange.single(FEB_10), "trip");
        Fixtures.withId(submitted, 8L);
        submitted.setStatus(ApprovalStatus.SUBMITTED);

        EntryMutation mutation = validator.reject(admin, submitted, "peak season").value();

        assertThat(mutation.status()).isEqualTo(ApprovalStatus.REJECTED);
        assertThat(mutation.decision().comment()).isEqualTo("peak season");
    }

    @Test
    void approve_secondTimeIsInvalidTransition() {
        TaskEntry entry = entry(4L, "6");
        entry.setStatus(ApprovalStatus.SUBMITTED);
        entry.applyDecision(validator.approve(admin, entry, null).value().decision());

        assertThat(validator.approve(admin, entry, null).violations())
                .containsExactly(new RuleViolation.InvalidTransition(ApprovalStatus.APPROVED, ApprovalEvent.APPROVE));
    }

    @Test
    void deleteTaskEntry_onlyDraftsAreRemoved() {
        TaskEntry draft = entry(5L, "1");
        TaskEntry submitted = entry(6L, "1");
        submitted.setStatus(ApprovalStatus.SUBMITTED);

        assertThat(validator.deleteTaskEntry(owner, draft).value().status()).isNull();
        assertThat(validator.deleteTaskEntry(owner, submitted).violations()).singleElement()
                .isEqualTo(new RuleViolation.InvalidTransition(ApprovalStatus.SUBMITTED, ApprovalEvent.DELETE));
    }

    @Test
    void recheckTaskEntry_onApprovedEntry_leavesAuditUntouched() {
        TaskEntry approved = entry(7L, "6");
        approved.setStatus(ApprovalStatus.SUBMITTED);
        approved.applyDecision(validator.approve(admin, approved, null).value().decision());
        Instant decidedAt = approved.getDecidedAt();
        Instant updatedAt = approved.getUpdatedAt();
        TaskDaySnapshot snapshot = day(List.of(approved), DayType.WORKING_DAY);

        Verdict<TaskEntry> first = validator.recheckTaskEntry(approved, snapshot);
        Verdict<TaskEntry> second = validator.recheckTaskEntry(approved, snapshot);

        assertThat(first.isAccepted()).isTrue();
        assertThat(second.isAccepted()).isTrue();
        assertThat(approved.getStatus()).isEqualTo(ApprovalStatus.APPROVED);
        assertThat(approved.getDecidedAt()).isEqualTo(decidedAt);
        assertThat(approved.getUpdatedAt()).isEqualTo(updatedAt);
    }

    @Test
    void createLeave_overlappingLeaveIsRejected() {
        LeaveRequest existing = new LeaveRequest(OWNER, DateRange.of(LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 5)), "trip");
        Fixtures.withId(existing, 1L);
        LeaveRequest candidate = new LeaveRequest(OWNER, DateRange.of(LocalDate.of(2026, 3, 4), LocalDate.of(2026, 3, 6)), "extra");

        Verdict<EntryMutation> verdict = validator.createLeave(owner, candidate, new LeaveSnapshot(List.of(existing), List.of()));

        assertThat(verdict.violations()).containsExactly(new RuleViolation.LeaveOverlap(1L));
    }

    @Test
    void submitLeave_rechecksAgainstTasksLoggedSinceCreation() {
        LeaveRequest draft = new LeaveRequest(OWNER, DateRange.of(LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 5)), "trip");
        Fixtures.withId(draft, 2L);
        TaskEntry logged = new TaskEntry(OWNER, LocalDate.of(2026, 3, 3), "hotfix", List.of(SubTask.of(CLIENT, "fix", "2")));

        Verdict<EntryMutation> verdict = validator.submitLeave(owner, draft, new LeaveSnapshot(List.of(draft), List.of(logged)));

        assertThat(verdict.violations()).containsExactly(new RuleViolation.LeaveTaskConflict(LocalDate.of(2026, 3, 3)));
    }

    private TaskDaySnapshot day(List<TaskEntry> entries, DayType dayType) {
        return new TaskDaySnapshot(entries, List.of(), Set.of(CLIENT), dayType);
    }

    private static TaskEntry entry(Long id, String hours) {
        TaskEntry entry = new TaskEntry(OWNER, FEB_10, "work", List.of(SubTask.of(CLIENT, "work", hours)));
        Fixtures.withId(entry, id);
        return entry;
    }
}
