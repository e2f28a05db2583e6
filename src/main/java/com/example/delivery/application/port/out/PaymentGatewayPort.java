package com.example.delivery.application.port.out;

import com.example.delivery.domain.model.ChargeCapture;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for the card payment gateway.
 * <p>
 * Declines and other gateway-reported failures complete normally with a failure result.
 * Transport problems complete exceptionally.
 */
public interface PaymentGatewayPort {

    /**
     * Captures a previously authorized charge.
     *
     * @param chargeId the gateway charge id
     * @return future containing the capture result
     */
    CompletableFuture<CaptureResult> capture(String chargeId);

    /**
     * Refunds a charge in full.
     *
     * @param chargeId the gateway charge id
     * @return future containing the refund result
     */
    CompletableFuture<RefundResult> refund(String chargeId);

    /**
     * Result of a capture call.
     */
    record CaptureResult(
            boolean success,
            ChargeCapture charge,
            String errorCode,
            String errorMessage
    ) {
        public static CaptureResult success(ChargeCapture charge) {
            return new CaptureResult(true, charge, null, null);
        }

        public static CaptureResult failure(String errorCode, String errorMessage) {
            return new CaptureResult(false, null, errorCode, errorMessage);
        }
    }

    /**
     * Result of a refund call.
     */
    record RefundResult(
            boolean success,
            String refundId,
            String errorCode,
            String errorMessage
    ) {
        public static RefundResult success(String refundId) {
            return new RefundResult(true, refundId, null, null);
        }

        public static RefundResult failure(String errorCode, String errorMessage) {
            return new RefundResult(false, null, errorCode, errorMessage);
        }
    }
}
