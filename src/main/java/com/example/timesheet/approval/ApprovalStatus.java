package com.example.timesheet.approval;

public enum ApprovalStatus {
    DRAFT,
    SUBMITTED,
    APPROVED,
    REJECTED;

    /** Rejected records no longer count towards hour caps or leave coverage. */
    public boolean countsTowardsLimits() {
        return this != REJECTED;
    }
}
