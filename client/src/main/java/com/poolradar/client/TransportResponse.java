package com.poolradar.client;

/**
 * Raw HTTP outcome handed back by an {@link ApiTransport}: any status, body as text.
 */
public record TransportResponse(int status, String body) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
