package com.poolradar.client;

/**
 * Connection failure or timeout before a complete response arrived. Safe for the caller to retry.
 */
public class TransportException extends PaprikaApiException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
