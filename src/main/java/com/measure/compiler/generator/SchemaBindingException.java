package com.measure.compiler.generator;

/**
 * Raised when a schema binding cannot be loaded or lacks a table or column the generator needs.
 */
public class SchemaBindingException extends RuntimeException {

    public SchemaBindingException(String message) {
        super(message);
    }

    public SchemaBindingException(String message, Throwable cause) {
        super(message, cause);
    }
}
