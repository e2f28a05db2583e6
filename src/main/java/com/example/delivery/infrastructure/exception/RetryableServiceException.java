package com.example.delivery.infrastructure.exception;

/**
 * Transient failure (5xx). The notifier and analytics retries are configured on this type.
 */
public class RetryableServiceException extends ExternalServiceException {

    private final int statusCode;

    public RetryableServiceException(String serviceName, int statusCode, String message) {
        super(serviceName, message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
