package com.example.timesheet.approval;

import java.time.Instant;

/**
 * Audit fields to write along with a mutation. {@code createdAt}/{@code createdBy} are only
 * set when the mutation creates the record.
 */
public record AuditStamp(Instant createdAt, Long createdBy, Instant updatedAt, Long updatedBy) {

    public static AuditStamp creation(Instant now, Long actorId) {
        return new AuditStamp(now, actorId, now, actorId);
    }

    public static AuditStamp modification(Instant now, Long actorId) {
        return new AuditStamp(null, null, now, actorId);
    }

    public boolean isCreation() {
        return createdAt != null;
    }
}
