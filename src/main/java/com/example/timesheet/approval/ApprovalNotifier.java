package com.example.timesheet.approval;

/**
 * Notification collaborator: tells the owner about a decision on their record.
 */
public interface ApprovalNotifier {

    void notifyDecision(ApprovalDecidedEvent event);
}
