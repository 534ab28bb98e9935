package com.example.timesheet.approval;

import java.time.Instant;
import java.util.Objects;

/**
 * Administrator verdict on a submitted record. Applied to the target, never stored on its own.
 */
public record ApprovalDecision(ApprovalStatus outcome, Long actorId, Instant decidedAt, String comment) {

    public ApprovalDecision {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(actorId, "actorId");
        Objects.requireNonNull(decidedAt, "decidedAt");
        if (outcome != ApprovalStatus.APPROVED && outcome != ApprovalStatus.REJECTED) {
            throw new IllegalArgumentException("decision outcome must be APPROVED or REJECTED: " + outcome);
        }
        if (comment != null && comment.isBlank()) {
            comment = null;
        }
    }
}
