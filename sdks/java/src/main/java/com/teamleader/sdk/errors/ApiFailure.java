package com.teamleader.sdk.errors;

import com.teamleader.sdk.exceptions.AuthenticationException;
import com.teamleader.sdk.exceptions.ConfigurationException;
import com.teamleader.sdk.exceptions.NotFoundException;
import com.teamleader.sdk.exceptions.RateLimitException;
import com.teamleader.sdk.exceptions.ServerException;
import com.teamleader.sdk.exceptions.TeamleaderException;
import com.teamleader.sdk.exceptions.TransportException;
import com.teamleader.sdk.exceptions.ValidationException;

import java.util.List;
import java.util.Objects;

/**
 * A classified failure: exactly one {@link ErrorKind} plus the details needed to report it.
 *
 * <p>Instances are immutable. {@link #toException()} produces the typed exception used
 * when the client runs in throw mode, so both reporting paths carry the same kind and message.</p>
 */
public final class ApiFailure {

    private final ErrorKind kind;
    private final String message;
    private final int statusCode;
    private final List<String> errors;
    private final String responseBody;
    private final Long retryAfterSeconds;
    private final Throwable cause;

    private ApiFailure(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "kind must not be null");
        this.message = builder.message != null ? builder.message : "Unknown error";
        this.statusCode = builder.statusCode;
        this.errors = builder.errors != null && !builder.errors.isEmpty()
                ? List.copyOf(builder.errors)
                : List.of(this.message);
        this.responseBody = builder.responseBody;
        this.retryAfterSeconds = builder.retryAfterSeconds;
        this.cause = builder.cause;
    }

    public static Builder builder(ErrorKind kind) {
        return new Builder(kind);
    }

    public static ApiFailure of(ErrorKind kind, String message) {
        return builder(kind).message(message).build();
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    /**
     * HTTP status of the response, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public List<String> getErrors() {
        return errors;
    }

    public String getResponseBody() {
        return responseBody;
    }

    /**
     * Seconds the server asked us to wait, from {@code Retry-After}; null when not sent.
     */
    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public Throwable getCause() {
        return cause;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public TeamleaderException toException() {
        switch (kind) {
            case VALIDATION:
                return new ValidationException(this);
            case UNAUTHORIZED:
                return new AuthenticationException(this);
            case NOT_FOUND:
                return new NotFoundException(this);
            case RATE_LIMIT_EXCEEDED:
                return new RateLimitException(this);
            case SERVER_ERROR:
                return new ServerException(this);
            case TRANSPORT:
                return new TransportException(this);
            case CONFIGURATION:
                return new ConfigurationException(this);
            default:
                return new TeamleaderException(this);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ApiFailure{kind=").append(kind);
        if (statusCode > 0) {
            sb.append(", statusCode=").append(statusCode);
        }
        sb.append(", message='").append(message).append('\'');
        if (retryAfterSeconds != null) {
            sb.append(", retryAfterSeconds=").append(retryAfterSeconds);
        }
        sb.append('}');
        return sb.toString();
    }

    /**
     * Builder for creating ApiFailure instances.
     */
    public static class Builder {
        private final ErrorKind kind;
        private String message;
        private int statusCode;
        private List<String> errors;
        private String responseBody;
        private Long retryAfterSeconds;
        private Throwable cause;

        private Builder(ErrorKind kind) {
            this.kind = kind;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder statusCode(int statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder errors(List<String> errors) {
            this.errors = errors == null || errors.isEmpty() ? null : errors;
            return this;
        }

        public Builder responseBody(String responseBody) {
            this.responseBody = responseBody;
            return this;
        }

        public Builder retryAfterSeconds(Long retryAfterSeconds) {
            this.retryAfterSeconds = retryAfterSeconds;
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public ApiFailure build() {
            return new ApiFailure(this);
        }
    }
}
