package com.example.delivery.application.dto;

/**
 * Result of an order workflow call, shown to whoever invoked it.
 */
public record OrderActionResult(
        boolean success,
        String message,
        String errorCode,
        CustomerDetails customer
) {
    public static final String NOT_FOUND_MESSAGE = "An order with that ID could not be found.";
    public static final String TOO_LATE_TO_CANCEL_MESSAGE = "Sorry, it is too late for this order to be cancelled.";

    public static OrderActionResult succeeded() {
        return new OrderActionResult(true, null, null, null);
    }

    /**
     * Successful result carrying the caller's current profile.
     */
    public static OrderActionResult succeeded(CustomerDetails customer) {
        return new OrderActionResult(true, null, null, customer);
    }

    public static OrderActionResult notFound() {
        return new OrderActionResult(false, NOT_FOUND_MESSAGE, "ORDER_NOT_FOUND", null);
    }

    public static OrderActionResult tooLateToCancel() {
        return new OrderActionResult(false, TOO_LATE_TO_CANCEL_MESSAGE, "NOT_CANCELLABLE", null);
    }

    /**
     * Failure reported by the payment gateway, passed through unchanged.
     */
    public static OrderActionResult gatewayFailure(String errorCode, String message) {
        return new OrderActionResult(false, message, errorCode, null);
    }
}
