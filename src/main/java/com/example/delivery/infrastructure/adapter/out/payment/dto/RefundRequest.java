package com.example.delivery.infrastructure.adapter.out.payment.dto;

public record RefundRequest(String charge) {
}
