package com.poolradar.client;

/**
 * The caller's cancellation token fired or its deadline passed.
 */
public class RequestCancelledException extends PaprikaApiException {

    public RequestCancelledException(String message) {
        super(message);
    }

    public RequestCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
