package com.example.delivery.infrastructure.persistence;

import com.example.delivery.application.dto.CompensationTask;
import com.example.delivery.application.port.out.CompensationQueuePort;
import com.example.delivery.infrastructure.persistence.mapper.CompensationTaskMapper;
import com.example.delivery.infrastructure.persistence.repository.CompensationTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Writes compensation tasks into the caller's transaction, next to the status change
 * they compensate for.
 */
@Component
public class CompensationQueueAdapter implements CompensationQueuePort {

    private static final Logger log = LoggerFactory.getLogger(CompensationQueueAdapter.class);

    private final CompensationTaskRepository taskRepository;
    private final CompensationTaskMapper mapper;

    public CompensationQueueAdapter(CompensationTaskRepository taskRepository, CompensationTaskMapper mapper) {
        this.taskRepository = taskRepository;
        this.mapper = mapper;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void enqueue(List<CompensationTask> tasks) {
        taskRepository.saveAll(tasks.stream().map(mapper::toEntity).toList());
        tasks.forEach(task -> log.debug("Queued {} #{} for order {}", task.step(), task.sequence(), task.orderId()));
    }
}
