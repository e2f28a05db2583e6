package com.example.delivery.infrastructure.exception;

/**
 * Request rejected by the collaborator (4xx); repeating it would not help.
 */
public class NonRetryableServiceException extends ExternalServiceException {

    private final int statusCode;

    public NonRetryableServiceException(String serviceName, int statusCode, String message) {
        super(serviceName, message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
