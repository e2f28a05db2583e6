package com.example.delivery.infrastructure.persistence.entity;

public enum CompensationTaskStatus {
    PENDING,
    PROCESSING,
    DONE,
    FAILED
}
