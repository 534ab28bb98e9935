package com.example.timesheet.approval;

import com.example.timesheet.config.AsyncConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class ApprovalNotificationListener {

    private static final Logger logger = LoggerFactory.getLogger(ApprovalNotificationListener.class);

    private final ApprovalNotifier notifier;

    public ApprovalNotificationListener(ApprovalNotifier notifier) {
        this.notifier = notifier;
    }

    /**
     * Runs only once the decision is committed. A failed notification is logged and does not
     * affect the decision.
     */
    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onDecision(ApprovalDecidedEvent event) {
        try {
            notifier.notifyDecision(event);
        } catch (RuntimeException ex) {
            logger.error("Failed to notify user {} about {} {}", event.ownerId(), event.kind(), event.recordId(), ex);
        }
    }
}
