package com.measure.compiler.client;

/**
 * The terminology server stayed unreachable after all retry attempts.
 */
public class TerminologyServerException extends RuntimeException {

    public TerminologyServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
