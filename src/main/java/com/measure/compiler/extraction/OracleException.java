package com.measure.compiler.extraction;

/**
 * The oracle could not be reached or refused the request.
 */
public class OracleException extends RuntimeException {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
