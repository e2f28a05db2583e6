package com.example.delivery.infrastructure.adapter.out.analytics.dto;

import java.util.Map;

/**
 * Body of {@code POST /v1/track}. {@code timestamp} is ISO-8601.
 */
public record TrackRequest(
        String userId,
        String event,
        Map<String, Object> properties,
        String timestamp
) {
}
