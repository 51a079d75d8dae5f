package com.poolradar.client;

/**
 * Base of every failure a DexPaprika request can surface to callers.
 */
public abstract class PaprikaApiException extends RuntimeException {

    protected PaprikaApiException(String message) {
        super(message);
    }

    protected PaprikaApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
