package com.teamleader.sdk.exceptions;

import com.teamleader.sdk.errors.ApiFailure;
import com.teamleader.sdk.errors.ErrorKind;

import java.util.List;

/**
 * Base exception for all Teamleader API errors.
 */
public class TeamleaderException extends RuntimeException {

    private final ApiFailure failure;

    public TeamleaderException(ApiFailure failure) {
        super(failure.getMessage(), failure.getCause());
        this.failure = failure;
    }

    protected TeamleaderException(ErrorKind kind, String message) {
        this(ApiFailure.of(kind, message));
    }

    public ApiFailure getFailure() {
        return failure;
    }

    public ErrorKind getKind() {
        return failure.getKind();
    }

    public int getStatusCode() {
        return failure.getStatusCode();
    }

    public List<String> getErrors() {
        return failure.getErrors();
    }

    public String getResponseBody() {
        return failure.getResponseBody();
    }

    public boolean isUnauthorized() {
        return failure.getKind() == ErrorKind.UNAUTHORIZED;
    }

    public boolean isNotFound() {
        return failure.getKind() == ErrorKind.NOT_FOUND;
    }

    public boolean isRateLimited() {
        return failure.getKind() == ErrorKind.RATE_LIMIT_EXCEEDED;
    }

    public boolean isServerError() {
        return failure.getKind() == ErrorKind.SERVER_ERROR;
    }

    public boolean isRetryable() {
        return failure.isRetryable();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append('{');
        sb.append("kind=").append(failure.getKind());
        if (failure.getStatusCode() > 0) {
            sb.append(", statusCode=").append(failure.getStatusCode());
        }
        sb.append(", message='").append(getMessage()).append('\'');
        sb.append('}');
        return sb.toString();
    }
}
