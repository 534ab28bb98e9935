package com.example.timesheet.approval;

/**
 * Published when an administrator approves or rejects a record. Consumers run after commit.
 */
public record ApprovalDecidedEvent(RecordKind kind, Long recordId, Long ownerId, ApprovalDecision decision) {

    public enum RecordKind {
        TASK_ENTRY,
        LEAVE_REQUEST
    }
}
