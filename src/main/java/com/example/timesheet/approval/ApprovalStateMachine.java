package com.example.timesheet.approval;

import com.example.timesheet.common.Verdict;
import com.example.timesheet.exception.RuleViolation;
import com.example.timesheet.user.Actor;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lifecycle shared by task entries and leave requests:
 * {@code DRAFT -> SUBMITTED -> APPROVED | REJECTED}, plus in-place updates and deletion of drafts.
 * <p>
 * The actor requirement of an event is checked before the table, so a caller lacking the
 * right gets {@code Forbidden} whatever the record's state.
 */
@Component
public class ApprovalStateMachine {

    private static final Map<ApprovalStatus, Map<ApprovalEvent, Optional<ApprovalStatus>>> TABLE;

    static {
        Map<ApprovalStatus, Map<ApprovalEvent, Optional<ApprovalStatus>>> table = new EnumMap<>(ApprovalStatus.class);
        for (ApprovalStatus status : ApprovalStatus.values()) {
            table.put(status, new EnumMap<>(ApprovalEvent.class));
        }
        table.get(ApprovalStatus.DRAFT).put(ApprovalEvent.UPDATE, Optional.of(ApprovalStatus.DRAFT));
        table.get(ApprovalStatus.DRAFT).put(ApprovalEvent.SUBMIT, Optional.of(ApprovalStatus.SUBMITTED));
        table.get(ApprovalStatus.DRAFT).put(ApprovalEvent.DELETE, Optional.empty());
        table.get(ApprovalStatus.SUBMITTED).put(ApprovalEvent.APPROVE, Optional.of(ApprovalStatus.APPROVED));
        table.get(ApprovalStatus.SUBMITTED).put(ApprovalEvent.REJECT, Optional.of(ApprovalStatus.REJECTED));
        table.replaceAll((status, events) -> Collections.unmodifiableMap(events));
        TABLE = Collections.unmodifiableMap(table);
    }

    public Verdict<Transition> fire(Approvable target, ApprovalEvent event, Actor actor) {
        if (!mayFire(target.getOwnerId(), event, actor)) {
            return Verdict.rejected(new RuleViolation.Forbidden(event, actor.id()));
        }
        ApprovalStatus from = target.getStatus();
        Optional<ApprovalStatus> to = TABLE.get(from).get(event);
        if (to == null) {
            return Verdict.rejected(new RuleViolation.InvalidTransition(from, event));
        }
        return Verdict.accepted(new Transition(from, event, to.orElse(null)));
    }

    public boolean mayFire(Long ownerId, ApprovalEvent event, Actor actor) {
        return switch (event.party()) {
            case OWNER -> actor.is(ownerId);
            case ADMIN -> actor.isAdmin();
        };
    }
}
