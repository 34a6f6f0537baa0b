package com.di.bancodemo.exception;

/**
 * Thrown when a table schema file is missing or malformed, or when a column the
 * write layout needs is not part of the schema.
 */
public class SchemaException extends BancoDemoException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
