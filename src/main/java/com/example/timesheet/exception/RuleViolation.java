package com.example.timesheet.exception;

import com.example.timesheet.approval.ApprovalEvent;
import com.example.timesheet.approval.ApprovalStatus;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A business rule rejected the requested operation.
 * <p>
 * Violations are values: the engine returns them, the service layer turns them into
 * {@link RuleViolationException}. Each kind carries the data needed to render a precise
 * message (dates, limits, conflicting ids).
 */
public interface RuleViolation {

    enum Category {
        MALFORMED_INPUT,
        CONFLICT,
        STATE,
        AUTHORIZATION
    }

    String code();

    String message();

    Category category();

    record InvalidRange(LocalDate start, LocalDate end) implements RuleViolation {
        public String code() { return "INVALID_RANGE"; }
        public String message() { return "end date " + end + " is before start date " + start; }
        public Category category() { return Category.MALFORMED_INPUT; }
    }

    record InvalidHours(BigDecimal hours, BigDecimal granularity) implements RuleViolation {
        public String code() { return "INVALID_HOURS"; }
        public String message() {
            if (granularity == null) {
                return "invalid hours: " + hours.toPlainString();
            }
            return "invalid hours: " + hours.toPlainString() + " (must be a positive multiple of "
                    + granularity.toPlainString() + ")";
        }
        public Category category() { return Category.MALFORMED_INPUT; }
    }

    record EmptySubTaskSet(Long entryId) implements RuleViolation {
        public String code() { return "EMPTY_SUB_TASK_SET"; }
        public String message() { return "a submitted task entry needs at least one sub-task"; }
        public Category category() { return Category.MALFORMED_INPUT; }
    }

    record UnknownClient(Long clientId) implements RuleViolation {
        public String code() { return "UNKNOWN_CLIENT"; }
        public String message() { return "client not found or inactive: " + clientId; }
        public Category category() { return Category.MALFORMED_INPUT; }
    }

    record DailyHoursExceeded(LocalDate date, BigDecimal attempted, BigDecimal limit) implements RuleViolation {
        public String code() { return "DAILY_HOURS_EXCEEDED"; }
        public String message() {
            return "cannot log " + attempted.toPlainString() + " hours on " + date
                    + ": daily limit is " + limit.toPlainString();
        }
        public Category category() { return Category.CONFLICT; }
    }

    record LeaveOverlap(Long conflictingId) implements RuleViolation {
        public String code() { return "LEAVE_OVERLAP"; }
        public String message() { return "leave overlaps with existing leave request " + conflictingId; }
        public Category category() { return Category.CONFLICT; }
    }

    record LeaveTaskConflict(LocalDate date) implements RuleViolation {
        public String code() { return "LEAVE_TASK_CONFLICT"; }
        public String message() { return "leave and logged work collide on " + date; }
        public Category category() { return Category.CONFLICT; }
    }

    record InvalidTransition(ApprovalStatus from, ApprovalEvent event) implements RuleViolation {
        public String code() { return "INVALID_TRANSITION"; }
        public String message() { return "cannot " + event.label() + " a record in status " + from; }
        public Category category() { return Category.STATE; }
    }

    record Forbidden(ApprovalEvent event, Long actorId) implements RuleViolation {
        public String code() { return "FORBIDDEN"; }
        public String message() {
            if (event == null) {
                return "user " + actorId + " is not allowed to act";
            }
            return "user " + actorId + " may not " + event.label() + " this record";
        }
        public Category category() { return Category.AUTHORIZATION; }
    }
}
