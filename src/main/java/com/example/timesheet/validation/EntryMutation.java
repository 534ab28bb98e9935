package com.example.timesheet.validation;

import com.example.timesheet.approval.ApprovalDecision;
import com.example.timesheet.approval.ApprovalEvent;
import com.example.timesheet.approval.ApprovalStatus;
import com.example.timesheet.approval.AuditStamp;

import java.math.BigDecimal;

/**
 * Accepted change to apply atomically to one record.
 *
 * @param event         what happened
 * @param status        status after the change; {@code null} when the record is removed
 * @param audit         audit fields to write
 * @param decision      administrator decision for approve/reject, otherwise {@code null}
 * @param overtimeHours recomputed overtime for task entries, otherwise {@code null}
 */
public record EntryMutation(ApprovalEvent event,
                            ApprovalStatus status,
                            AuditStamp audit,
                            ApprovalDecision decision,
                            BigDecimal overtimeHours) {
}
