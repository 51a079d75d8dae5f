package com.poolradar.client;

/**
 * Response body did not match the shape declared for the endpoint. Such responses are never cached.
 */
public class DecodeException extends PaprikaApiException {

    private final String endpoint;

    public DecodeException(String endpoint, String message, Throwable cause) {
        super("Failed to decode response of " + endpoint + ": " + message, cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
