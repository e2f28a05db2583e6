package com.example.delivery.infrastructure.exception;

/**
 * A collaborator answered with a business-level rejection carrying its own error code,
 * e.g. a card decline. Adapters translate it into a failure result before it leaves them.
 */
public class BusinessException extends RuntimeException {

    private final String errorCode;

    public BusinessException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
