package com.purchasingpower.entityrevert.exception;

import lombok.Getter;

/**
 * A Git operation on the entity store failed unexpectedly.
 */
@Getter
public class RepositoryOperationException extends RuntimeException {

    private final String operation;

    public RepositoryOperationException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public RepositoryOperationException(String operation, String message) {
        super(message);
        this.operation = operation;
    }
}
