package com.gamemind.oracle;

/**
 * Thrown by an {@link OracleBackend} when it cannot produce text: connection failure, timeout,
 * non-success status or an unreadable response body.
 */
public class OracleBackendException extends Exception {

    public OracleBackendException(String message) {
        super(message);
    }

    public OracleBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
