package com.poolradar.client;

import com.poolradar.domain.ApiErrorBody;

import java.util.Optional;

/**
 * Non-2xx response from the API. Carries the status, the raw body and, when the body parsed, the
 * API's own error code and message.
 */
public class RemoteApiException extends PaprikaApiException {

    private final int status;
    private final String body;
    private final ApiErrorBody errorBody;

    public RemoteApiException(int status, String body, ApiErrorBody errorBody) {
        super(buildMessage(status, body, errorBody));
        this.status = status;
        this.body = body;
        this.errorBody = errorBody;
    }

    private static String buildMessage(int status, String body, ApiErrorBody errorBody) {
        if (errorBody != null && errorBody.error() != null) {
            String detail = errorBody.message() != null ? " (" + errorBody.message() + ")" : "";
            return "API error " + status + ": " + errorBody.error() + detail;
        }
        return "API error " + status + ": " + (body == null || body.isBlank() ? "<empty body>" : body);
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    public Optional<ApiErrorBody> getErrorBody() {
        return Optional.ofNullable(errorBody);
    }

    public boolean isClientError() {
        return status >= 400 && status < 500;
    }

    public boolean isServerError() {
        return status >= 500;
    }
}
