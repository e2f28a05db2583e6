package com.example.delivery.application.port.out;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for analytics events.
 */
public interface EventTrackerPort {

    /**
     * Records a named event for a user.
     *
     * @param userId     the user the event is attributed to
     * @param eventName  e.g. {@code "Complete Order"}
     * @param properties event properties; values may be null
     * @return future completing when the event was handed off
     */
    CompletableFuture<Void> track(String userId, String eventName, Map<String, Object> properties);
}
