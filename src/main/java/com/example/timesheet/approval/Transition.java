package com.example.timesheet.approval;

/**
 * A permitted move through the lifecycle. {@code to} is {@code null} when the record is removed.
 */
public record Transition(ApprovalStatus from, ApprovalEvent event, ApprovalStatus to) {
}
