package com.example.delivery.infrastructure.compensation;

import com.example.delivery.application.dto.CompensationScheduledEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Runs a cancellation's compensation as soon as the cancellation has committed.
 */
@Component
@ConditionalOnProperty(value = "delivery.compensation.dispatch-immediately", havingValue = "true", matchIfMissing = true)
public class CompensationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CompensationDispatcher.class);

    private final CompensationTaskProcessor processor;

    public CompensationDispatcher(CompensationTaskProcessor processor) {
        this.processor = processor;
    }

    @Async("compensationExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onCompensationScheduled(CompensationScheduledEvent event) {
        int done = processor.processOrder(event.orderId().getValue());
        log.debug("Dispatched compensation for order {}: {}/{} tasks done", event.orderId(), done, event.taskCount());
    }
}
