package com.example.delivery.infrastructure.compensation;

import com.example.delivery.infrastructure.persistence.entity.CompensationTaskStatus;
import com.example.delivery.infrastructure.persistence.repository.CompensationTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Picks up compensation tasks the after-commit dispatch missed, retries failed ones and
 * purges old completed ones. A task left PROCESSING past its claim lease is failed first,
 * so a worker that died mid-step does not strand it.
 */
@Component
@ConditionalOnProperty(value = "delivery.compensation.poller.enabled", havingValue = "true", matchIfMissing = true)
public class CompensationPoller {

    private static final Logger log = LoggerFactory.getLogger(CompensationPoller.class);

    private final CompensationTaskProcessor processor;
    private final CompensationTaskRepository taskRepository;
    private final Clock clock;
    private final int batchSize;
    private final Duration retention;
    private final Duration claimLease;

    public CompensationPoller(
            CompensationTaskProcessor processor,
            CompensationTaskRepository taskRepository,
            Clock clock,
            @Value("${delivery.compensation.poller.batch-size:100}") int batchSize,
            @Value("${delivery.compensation.retention-hours:24}") long retentionHours,
            @Value("${delivery.compensation.claim-lease-seconds:300}") long claimLeaseSeconds) {
        this.processor = processor;
        this.taskRepository = taskRepository;
        this.clock = clock;
        this.batchSize = batchSize;
        this.retention = Duration.ofHours(retentionHours);
        this.claimLease = Duration.ofSeconds(claimLeaseSeconds);
    }

    @Scheduled(fixedDelayString = "${delivery.compensation.poller.interval-ms:1000}")
    public void pollPending() {
        int done = processor.processPending(batchSize);
        if (done > 0) {
            log.debug("Poller completed {} pending compensation tasks", done);
        }
    }

    @Scheduled(fixedDelayString = "${delivery.compensation.poller.retry-interval-ms:30000}")
    public void retryFailed() {
        processor.failExpiredClaims(claimLease);
        processor.retryFailed(batchSize);
    }

    @Scheduled(fixedRate = 3600000)
    @Transactional
    public void purgeCompleted() {
        Instant cutoff = clock.instant().minus(retention);
        int deleted = taskRepository.deleteByStatusAndProcessedAtBefore(CompensationTaskStatus.DONE, cutoff);
        if (deleted > 0) {
            log.info("Purged {} completed compensation tasks older than {}", deleted, retention);
        }
    }
}
