package com.example.delivery.infrastructure.exception;

/**
 * Final fallback failure: circuit open, time limit exceeded or retries exhausted.
 */
public class ServiceUnavailableException extends ExternalServiceException {

    public ServiceUnavailableException(String serviceName, String message) {
        super(serviceName, message);
    }

    public ServiceUnavailableException(String serviceName, String message, Throwable cause) {
        super(serviceName, message, cause);
    }
}
