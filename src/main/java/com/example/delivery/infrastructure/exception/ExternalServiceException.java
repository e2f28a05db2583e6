package com.example.delivery.infrastructure.exception;

/**
 * Base class for failures talking to an external HTTP collaborator.
 */
public abstract class ExternalServiceException extends RuntimeException {

    private final String serviceName;

    protected ExternalServiceException(String serviceName, String message) {
        super(message);
        this.serviceName = serviceName;
    }

    protected ExternalServiceException(String serviceName, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
