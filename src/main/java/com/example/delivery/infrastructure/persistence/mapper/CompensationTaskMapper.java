package com.example.delivery.infrastructure.persistence.mapper;

import com.example.delivery.application.dto.CompensationStep;
import com.example.delivery.application.dto.CompensationTask;
import com.example.delivery.domain.model.OrderId;
import com.example.delivery.infrastructure.persistence.entity.CompensationTaskEntity;
import com.example.delivery.infrastructure.persistence.entity.CompensationTaskStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Maps compensation tasks to rows; the payload is stored as JSON.
 */
@Component
public class CompensationTaskMapper {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public CompensationTaskMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CompensationTaskEntity toEntity(CompensationTask task) {
        CompensationTaskEntity entity = new CompensationTaskEntity();
        entity.setId(task.id());
        entity.setOrderId(task.orderId().getValue());
        entity.setStep(task.step().name());
        entity.setSequence(task.sequence());
        entity.setPayload(writePayload(task));
        entity.setStatus(CompensationTaskStatus.PENDING);
        entity.setCreatedAt(task.createdAt());
        return entity;
    }

    public CompensationTask toTask(CompensationTaskEntity entity) {
        return new CompensationTask(
                entity.getId(),
                OrderId.of(entity.getOrderId()),
                CompensationStep.valueOf(entity.getStep()),
                entity.getSequence(),
                readPayload(entity),
                entity.getCreatedAt());
    }

    private String writePayload(CompensationTask task) {
        try {
            return objectMapper.writeValueAsString(task.payload());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize payload of " + task.step() + " for order " + task.orderId(), e);
        }
    }

    private Map<String, Object> readPayload(CompensationTaskEntity entity) {
        if (entity.getPayload() == null || entity.getPayload().isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(entity.getPayload(), PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt payload in compensation task " + entity.getId(), e);
        }
    }
}
