package com.example.delivery.application.port.in;

import com.example.delivery.application.dto.OrderActionResult;
import com.example.delivery.domain.model.OrderId;

import java.util.concurrent.CompletableFuture;

/**
 * Inbound port for completing an order and capturing its payment.
 */
public interface CompleteOrderUseCase {

    /**
     * Marks the order complete, captures the charge when there is one, and runs the
     * post-payment fan-out.
     *
     * @param orderId the order to complete
     * @return future containing success, or the gateway's failure on capture failure
     */
    CompletableFuture<OrderActionResult> complete(OrderId orderId);
}
