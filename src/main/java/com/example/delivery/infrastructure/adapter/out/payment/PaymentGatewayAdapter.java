package com.example.delivery.infrastructure.adapter.out.payment;

import com.example.delivery.application.port.out.PaymentGatewayPort;
import com.example.delivery.infrastructure.adapter.out.payment.dto.ChargeResponse;
import com.example.delivery.infrastructure.adapter.out.payment.dto.GatewayErrorResponse;
import com.example.delivery.infrastructure.adapter.out.payment.dto.RefundRequest;
import com.example.delivery.infrastructure.adapter.out.payment.dto.RefundResponse;
import com.example.delivery.infrastructure.adapter.out.payment.mapper.PaymentMapper;
import com.example.delivery.infrastructure.exception.BusinessException;
import com.example.delivery.infrastructure.exception.RetryableServiceException;
import com.example.delivery.infrastructure.exception.ServiceUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;

/**
 * Adapter for the card payment gateway with time limiter and circuit breaker.
 * Decorator order: CircuitBreaker → TimeLimiter → HTTP call. No retry: a capture or refund
 * is never repeated in-line.
 */
@Component
public class PaymentGatewayAdapter implements PaymentGatewayPort {

    private static final Logger log = LoggerFactory.getLogger(PaymentGatewayAdapter.class);
    private static final String SERVICE_NAME = "payment";

    private final WebClient webClient;
    private final PaymentMapper mapper;

    public PaymentGatewayAdapter(
            @Qualifier("paymentWebClient") WebClient webClient,
            PaymentMapper mapper) {
        this.webClient = webClient;
        this.mapper = mapper;
    }

    @Override
    @TimeLimiter(name = "paymentTL")
    @CircuitBreaker(name = "paymentCB", fallbackMethod = "captureFallback")
    public CompletableFuture<CaptureResult> capture(String chargeId) {
        log.debug("Capturing charge {}", chargeId);

        return webClient.post()
                .uri("/v1/charges/{chargeId}/capture", chargeId)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, this::rejection)
                .onStatus(HttpStatusCode::is5xxServerError, this::unavailable)
                .bodyToMono(ChargeResponse.class)
                .map(mapper::toCaptureResult)
                .onErrorResume(BusinessException.class, ex -> {
                    log.info("Capture of {} declined: [{}] {}", chargeId, ex.getErrorCode(), ex.getMessage());
                    return Mono.just(CaptureResult.failure(ex.getErrorCode(), ex.getMessage()));
                })
                .toFuture();
    }

    @Override
    @TimeLimiter(name = "paymentTL")
    @CircuitBreaker(name = "paymentCB", fallbackMethod = "refundFallback")
    public CompletableFuture<RefundResult> refund(String chargeId) {
        log.debug("Refunding charge {}", chargeId);

        return webClient.post()
                .uri("/v1/refunds")
                .bodyValue(new RefundRequest(chargeId))
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, this::rejection)
                .onStatus(HttpStatusCode::is5xxServerError, this::unavailable)
                .bodyToMono(RefundResponse.class)
                .map(mapper::toRefundResult)
                .onErrorResume(BusinessException.class, ex -> {
                    log.info("Refund of {} rejected: [{}] {}", chargeId, ex.getErrorCode(), ex.getMessage());
                    return Mono.just(RefundResult.failure(ex.getErrorCode(), ex.getMessage()));
                })
                .toFuture();
    }

    private Mono<? extends Throwable> rejection(ClientResponse response) {
        int statusCode = response.statusCode().value();
        return response.bodyToMono(GatewayErrorResponse.class)
                .onErrorResume(ex -> Mono.empty())
                .defaultIfEmpty(new GatewayErrorResponse(null))
                .map(body -> mapper.toRejection(body, statusCode));
    }

    private Mono<? extends Throwable> unavailable(ClientResponse response) {
        return response.releaseBody()
                .then(Mono.error(new RetryableServiceException(
                        SERVICE_NAME, response.statusCode().value(), "Payment gateway temporarily unavailable")));
    }

    @SuppressWarnings("unused")
    private CompletableFuture<CaptureResult> captureFallback(String chargeId, CallNotPermittedException ex) {
        log.warn("Circuit breaker is OPEN for payment gateway, capture of {} not attempted", chargeId);
        return CompletableFuture.failedFuture(
                new ServiceUnavailableException(SERVICE_NAME, "Payment gateway circuit is open", ex));
    }

    @SuppressWarnings("unused")
    private CompletableFuture<CaptureResult> captureFallback(String chargeId, Throwable throwable) {
        log.error("Capture of {} failed: {}", chargeId, throwable.getMessage());
        return CompletableFuture.failedFuture(
                new ServiceUnavailableException(SERVICE_NAME, "Payment gateway unavailable", throwable));
    }

    @SuppressWarnings("unused")
    private CompletableFuture<RefundResult> refundFallback(String chargeId, Throwable throwable) {
        log.error("Refund of {} failed: {}", chargeId, throwable.getMessage());
        return CompletableFuture.failedFuture(
                new ServiceUnavailableException(SERVICE_NAME, "Payment gateway unavailable", throwable));
    }
}
