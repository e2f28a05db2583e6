package com.example.delivery.infrastructure.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

/**
 * Logs Resilience4j events for the payment, notification and analytics decorators,
 * including instances created lazily after startup.
 */
@Configuration
public class Resilience4jEventConfig {

    private static final Logger log = LoggerFactory.getLogger(Resilience4jEventConfig.class);

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryRegistry retryRegistry;
    private final TimeLimiterRegistry timeLimiterRegistry;

    public Resilience4jEventConfig(
            CircuitBreakerRegistry circuitBreakerRegistry,
            RetryRegistry retryRegistry,
            TimeLimiterRegistry timeLimiterRegistry) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.retryRegistry = retryRegistry;
        this.timeLimiterRegistry = timeLimiterRegistry;
    }

    @PostConstruct
    public void registerEventListeners() {
        circuitBreakerRegistry.getAllCircuitBreakers().forEach(this::onCircuitBreaker);
        circuitBreakerRegistry.getEventPublisher().onEntryAdded(event -> onCircuitBreaker(event.getAddedEntry()));

        retryRegistry.getAllRetries().forEach(this::onRetry);
        retryRegistry.getEventPublisher().onEntryAdded(event -> onRetry(event.getAddedEntry()));

        timeLimiterRegistry.getAllTimeLimiters().forEach(this::onTimeLimiter);
        timeLimiterRegistry.getEventPublisher().onEntryAdded(event -> onTimeLimiter(event.getAddedEntry()));
    }

    private void onCircuitBreaker(CircuitBreaker circuitBreaker) {
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.info("[CB_STATE] name={}, {}",
                        event.getCircuitBreakerName(), event.getStateTransition()))
                .onError(event -> log.warn("[CB_ERROR] name={}, duration={}ms, error={}",
                        event.getCircuitBreakerName(),
                        event.getElapsedDuration().toMillis(),
                        event.getThrowable().toString()))
                .onCallNotPermitted(event -> log.warn("[CB_REJECTED] name={}, circuit is OPEN",
                        event.getCircuitBreakerName()));
    }

    private void onRetry(Retry retry) {
        retry.getEventPublisher()
                .onRetry(event -> log.info("[RETRY] name={}, attempt={}, wait={}ms, cause={}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "N/A"))
                .onError(event -> log.warn("[RETRY_EXHAUSTED] name={}, attempts={}, error={}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "N/A"))
                .onIgnoredError(event -> log.debug("[RETRY_IGNORED] name={}, error={}",
                        event.getName(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "N/A"));
    }

    private void onTimeLimiter(TimeLimiter timeLimiter) {
        timeLimiter.getEventPublisher()
                .onTimeout(event -> log.warn("[TIMEOUT] name={}", event.getTimeLimiterName()));
    }
}
