package com.example.delivery.domain.exception;

/**
 * Base class for violations of order domain rules.
 */
public abstract class DomainException extends RuntimeException {

    protected DomainException(String message) {
        super(message);
    }
}
