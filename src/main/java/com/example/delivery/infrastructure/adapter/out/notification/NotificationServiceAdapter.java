package com.example.delivery.infrastructure.adapter.out.notification;

import com.example.delivery.application.port.out.NotifierPort;
import com.example.delivery.infrastructure.adapter.out.notification.dto.NotificationRequest;
import com.example.delivery.infrastructure.exception.NonRetryableServiceException;
import com.example.delivery.infrastructure.exception.RetryableServiceException;
import com.example.delivery.infrastructure.exception.ServiceUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;

/**
 * Adapter for the push/SMS notification service.
 * Decorator order: Retry → CircuitBreaker → HTTP call; only 5xx responses are retried and
 * the fallback sees the error left after the last attempt.
 */
@Component
public class NotificationServiceAdapter implements NotifierPort {

    private static final Logger log = LoggerFactory.getLogger(NotificationServiceAdapter.class);
    private static final String SERVICE_NAME = "notification";

    private final WebClient webClient;

    public NotificationServiceAdapter(@Qualifier("notificationWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    @CircuitBreaker(name = "notificationCB")
    @Retry(name = "notificationRetry", fallbackMethod = "deliveryFallback")
    public CompletableFuture<Void> push(String userId, String message) {
        return send("/api/notifications/push", userId, message);
    }

    @Override
    @CircuitBreaker(name = "notificationCB")
    @Retry(name = "notificationRetry", fallbackMethod = "deliveryFallback")
    public CompletableFuture<Void> sms(String userId, String message) {
        return send("/api/notifications/sms", userId, message);
    }

    private CompletableFuture<Void> send(String path, String userId, String message) {
        log.debug("Sending {} to {}", path, userId);

        return webClient.post()
                .uri(path)
                .bodyValue(new NotificationRequest(userId, message))
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, response -> response.releaseBody()
                        .then(Mono.error(new NonRetryableServiceException(
                                SERVICE_NAME, response.statusCode().value(),
                                "Notification rejected for " + userId))))
                .onStatus(HttpStatusCode::is5xxServerError, response -> response.releaseBody()
                        .then(Mono.error(new RetryableServiceException(
                                SERVICE_NAME, response.statusCode().value(),
                                "Notification service temporarily unavailable"))))
                .toBodilessEntity()
                .then()
                .toFuture();
    }

    @SuppressWarnings("unused")
    private CompletableFuture<Void> deliveryFallback(String userId, String message, Throwable throwable) {
        log.warn("Notification to {} not delivered: {}", userId, throwable.getMessage());
        if (throwable instanceof NonRetryableServiceException) {
            return CompletableFuture.failedFuture(throwable);
        }
        return CompletableFuture.failedFuture(
                new ServiceUnavailableException(SERVICE_NAME, "Notification service unavailable", throwable));
    }
}
