package com.example.timesheet.approval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default notifier. Mail delivery lives outside this service; decisions are logged instead.
 */
@Component
public class LoggingApprovalNotifier implements ApprovalNotifier {

    private static final Logger logger = LoggerFactory.getLogger(LoggingApprovalNotifier.class);

    @Override
    public void notifyDecision(ApprovalDecidedEvent event) {
        ApprovalDecision decision = event.decision();
        logger.info("Notify user {}: {} {} was {} by {} at {}{}",
                event.ownerId(), event.kind(), event.recordId(), decision.outcome(),
                decision.actorId(), decision.decidedAt(),
                decision.comment() == null ? "" : " (" + decision.comment() + ")");
    }
}
