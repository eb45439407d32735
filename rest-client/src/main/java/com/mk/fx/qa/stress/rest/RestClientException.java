package com.mk.fx.qa.stress.rest;

/**
 * Raised when a request could not be completed at the transport level (connection refused, reset,
 * timeout, TLS failure). HTTP error statuses are not transport failures and never raise this.
 */
public class RestClientException extends RuntimeException {

    public RestClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
