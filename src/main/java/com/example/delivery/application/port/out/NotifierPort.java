package com.example.delivery.application.port.out;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for customer and courier notifications.
 */
public interface NotifierPort {

    /**
     * Sends a push message to the user's registered device.
     */
    CompletableFuture<Void> push(String userId, String message);

    /**
     * Sends a text message to the user's phone number.
     */
    CompletableFuture<Void> sms(String userId, String message);
}
