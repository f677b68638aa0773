package com.teamleader.sdk.exceptions;

import com.teamleader.sdk.errors.ApiFailure;
import com.teamleader.sdk.errors.ErrorKind;

/**
 * Exception thrown when rate limited (429 Too Many Requests).
 */
public class RateLimitException extends TeamleaderException {

    public RateLimitException(String message) {
        super(ErrorKind.RATE_LIMIT_EXCEEDED, message);
    }

    public RateLimitException(ApiFailure failure) {
        super(failure);
    }

    /**
     * Returns the number of seconds to wait before retrying, or null if the server did not say.
     */
    public Long getRetryAfter() {
        return getFailure().getRetryAfterSeconds();
    }
}
