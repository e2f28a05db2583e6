package com.example.delivery.application.port.in;

import com.example.delivery.application.dto.CancelOrderCommand;
import com.example.delivery.application.dto.OrderActionResult;

/**
 * Inbound port for cancelling an order.
 */
public interface CancelOrderUseCase {

    /**
     * Cancels the order and schedules its compensation. Returns as soon as the status
     * change and the compensation tasks are durable.
     *
     * @param command the cancellation command
     * @return the cancellation result
     */
    OrderActionResult cancel(CancelOrderCommand command);
}
