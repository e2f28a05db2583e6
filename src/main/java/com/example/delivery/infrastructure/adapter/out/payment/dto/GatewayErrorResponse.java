package com.example.delivery.infrastructure.adapter.out.payment.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Error envelope of a 4xx gateway response: {@code {"error": {"type", "code", "message"}}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayErrorResponse(ErrorBody error) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ErrorBody(String type, String code, String message) {
    }
}
