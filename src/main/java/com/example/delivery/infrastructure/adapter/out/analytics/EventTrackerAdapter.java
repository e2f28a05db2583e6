package com.example.delivery.infrastructure.adapter.out.analytics;

import com.example.delivery.application.port.out.EventTrackerPort;
import com.example.delivery.infrastructure.adapter.out.analytics.dto.TrackRequest;
import com.example.delivery.infrastructure.exception.NonRetryableServiceException;
import com.example.delivery.infrastructure.exception.RetryableServiceException;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter for the analytics tracking service. Events that cannot be delivered after
 * retries are logged and dropped.
 */
@Component
public class EventTrackerAdapter implements EventTrackerPort {

    private static final Logger log = LoggerFactory.getLogger(EventTrackerAdapter.class);
    private static final String SERVICE_NAME = "analytics";

    private final WebClient webClient;
    private final Clock clock;

    public EventTrackerAdapter(@Qualifier("analyticsWebClient") WebClient webClient, Clock clock) {
        this.webClient = webClient;
        this.clock = clock;
    }

    @Override
    @Retry(name = "analyticsRetry", fallbackMethod = "trackFallback")
    public CompletableFuture<Void> track(String userId, String eventName, Map<String, Object> properties) {
        log.debug("Tracking '{}' for {}", eventName, userId);

        TrackRequest request = new TrackRequest(userId, eventName, properties, clock.instant().toString());
        return webClient.post()
                .uri("/v1/track")
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, response -> response.releaseBody()
                        .then(Mono.error(new NonRetryableServiceException(
                                SERVICE_NAME, response.statusCode().value(), "Event '" + eventName + "' rejected"))))
                .onStatus(HttpStatusCode::is5xxServerError, response -> response.releaseBody()
                        .then(Mono.error(new RetryableServiceException(
                                SERVICE_NAME, response.statusCode().value(), "Analytics service temporarily unavailable"))))
                .toBodilessEntity()
                .then()
                .toFuture();
    }

    @SuppressWarnings("unused")
    private CompletableFuture<Void> trackFallback(String userId, String eventName, Map<String, Object> properties,
                                                  Throwable throwable) {
        log.warn("Dropping analytics event '{}' for {}: {}", eventName, userId, throwable.getMessage());
        return CompletableFuture.completedFuture(null);
    }
}
