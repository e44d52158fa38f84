package com.purchasingpower.entityrevert.exception;

/**
 * The entity schema is missing, malformed or does not know an entity name.
 */
public class SchemaException extends RuntimeException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
