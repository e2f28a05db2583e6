package com.example.delivery.infrastructure.adapter.out.notification.dto;

public record NotificationRequest(String userId, String message) {
}
