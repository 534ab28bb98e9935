package com.example.timesheet.approval;

/**
 * A record that moves through the approval lifecycle.
 */
public interface Approvable {

    Long getId();

    Long getOwnerId();

    ApprovalStatus getStatus();
}
