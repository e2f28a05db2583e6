package com.example.delivery.infrastructure.compensation;

import com.example.delivery.application.service.CompensationStepExecutor;
import com.example.delivery.infrastructure.persistence.entity.CompensationTaskEntity;
import com.example.delivery.infrastructure.persistence.entity.CompensationTaskStatus;
import com.example.delivery.infrastructure.persistence.mapper.CompensationTaskMapper;
import com.example.delivery.infrastructure.persistence.repository.CompensationTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * Claims and executes compensation tasks.
 * <p>
 * A task is only executed after its status was moved to PROCESSING by a conditional update,
 * so the after-commit dispatch and the poller never run the same task twice. The same update
 * refuses a task while an earlier step of its order is pending or running, which keeps the
 * steps of one cancellation in sequence. A failing task is recorded and the next one proceeds.
 */
@Component
public class CompensationTaskProcessor {

    private static final Logger log = LoggerFactory.getLogger(CompensationTaskProcessor.class);
    private static final Set<CompensationTaskStatus> UNSETTLED =
            EnumSet.of(CompensationTaskStatus.PENDING, CompensationTaskStatus.PROCESSING);

    private final CompensationTaskRepository taskRepository;
    private final CompensationTaskMapper mapper;
    private final CompensationStepExecutor stepExecutor;
    private final Clock clock;
    private final int maxRetries;

    public CompensationTaskProcessor(
            CompensationTaskRepository taskRepository,
            CompensationTaskMapper mapper,
            CompensationStepExecutor stepExecutor,
            Clock clock,
            @Value("${delivery.compensation.max-retries:5}") int maxRetries) {
        this.taskRepository = taskRepository;
        this.mapper = mapper;
        this.stepExecutor = stepExecutor;
        this.clock = clock;
        this.maxRetries = maxRetries;
    }

    /**
     * Runs the pending tasks of one order in sequence.
     *
     * @return number of tasks that completed
     */
    public int processOrder(String orderId) {
        return processAll(taskRepository.findByOrderIdAndStatus(orderId, CompensationTaskStatus.PENDING),
                CompensationTaskStatus.PENDING);
    }

    public int processPending(int limit) {
        return processAll(taskRepository.findByStatus(CompensationTaskStatus.PENDING, limit),
                CompensationTaskStatus.PENDING);
    }

    public int retryFailed(int limit) {
        List<CompensationTaskEntity> failed =
                taskRepository.findRetryable(CompensationTaskStatus.FAILED, maxRetries, limit);
        if (!failed.isEmpty()) {
            log.info("Retrying {} failed compensation tasks", failed.size());
        }
        return processAll(failed, CompensationTaskStatus.FAILED);
    }

    /**
     * Fails tasks that have been PROCESSING for longer than {@code lease} so the retry pass
     * picks them up again.
     */
    public int failExpiredClaims(Duration lease) {
        int expired = taskRepository.failExpiredClaims(CompensationTaskStatus.PROCESSING,
                CompensationTaskStatus.FAILED, "Claim expired after " + lease, clock.instant().minus(lease));
        if (expired > 0) {
            log.warn("Released {} compensation tasks whose worker did not finish within {}", expired, lease);
        }
        return expired;
    }

    private int processAll(List<CompensationTaskEntity> tasks, CompensationTaskStatus expected) {
        int done = 0;
        for (CompensationTaskEntity task : tasks) {
            if (process(task, expected)) {
                done++;
            }
        }
        return done;
    }

    private boolean process(CompensationTaskEntity task, CompensationTaskStatus expected) {
        Instant claimedAt = clock.instant();
        if (taskRepository.claim(task.getId(), expected, CompensationTaskStatus.PROCESSING, UNSETTLED, claimedAt) == 0) {
            log.debug("Compensation task {} not claimable (taken or waiting on an earlier step)", task.getId());
            return false;
        }
        task.markClaimed(claimedAt);

        try {
            stepExecutor.execute(mapper.toTask(task));
            task.markDone(clock.instant());
            taskRepository.save(task);
            log.info("Compensation {} done for order {}", task.getStep(), task.getOrderId());
            return true;
        } catch (RuntimeException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            recordFailure(task, cause);
            return false;
        } catch (Error e) {
            recordFailure(task, e);
            throw e;
        }
    }

    private void recordFailure(CompensationTaskEntity task, Throwable cause) {
        task.markFailed(cause.getMessage());
        taskRepository.save(task);
        if (task.getRetryCount() >= maxRetries) {
            log.error("Compensation {} for order {} gave up after {} attempts, needs manual reconciliation: {}",
                    task.getStep(), task.getOrderId(), task.getRetryCount(), cause.getMessage(), cause);
        } else {
            log.warn("Compensation {} for order {} failed (attempt {}/{}): {}",
                    task.getStep(), task.getOrderId(), task.getRetryCount(), maxRetries, cause.getMessage());
        }
    }
}
