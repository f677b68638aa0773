package com.teamleader.sdk.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.teamleader.sdk.errors.ApiFailure;
import com.teamleader.sdk.errors.ErrorKind;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of a call through the client: a decoded payload, an explicit no-content marker,
 * or a classified failure.
 *
 * <p>Resource code switches on {@link #getType()} instead of probing the payload for error keys.</p>
 */
public final class RequestOutcome {

    /**
     * Variant of an outcome.
     */
    public enum Type {
        SUCCESS,
        NO_CONTENT,
        FAILURE
    }

    private final Type type;
    private final int statusCode;
    private final JsonNode payload;
    private final Map<String, List<String>> headers;
    private final ApiFailure failure;

    private RequestOutcome(Type type, int statusCode, JsonNode payload,
                           Map<String, List<String>> headers, ApiFailure failure) {
        this.type = type;
        this.statusCode = statusCode;
        this.payload = payload;
        this.headers = headers != null ? headers : Map.of();
        this.failure = failure;
    }

    public static RequestOutcome success(int statusCode, JsonNode payload, Map<String, List<String>> headers) {
        return new RequestOutcome(Type.SUCCESS, statusCode,
                payload != null ? payload : MissingNode.getInstance(), headers, null);
    }

    public static RequestOutcome noContent(Map<String, List<String>> headers) {
        return new RequestOutcome(Type.NO_CONTENT, 204, MissingNode.getInstance(), headers, null);
    }

    public static RequestOutcome failure(ApiFailure failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        return new RequestOutcome(Type.FAILURE, failure.getStatusCode(), null, Map.of(), failure);
    }

    public Type getType() {
        return type;
    }

    /**
     * True for both {@link Type#SUCCESS} and {@link Type#NO_CONTENT}.
     */
    public boolean isSuccess() {
        return type != Type.FAILURE;
    }

    public boolean isNoContent() {
        return type == Type.NO_CONTENT;
    }

    public boolean isFailure() {
        return type == Type.FAILURE;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Decoded JSON body. A {@link MissingNode} for 204 or an empty body; null for failures.
     */
    public JsonNode getPayload() {
        return payload;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    public ApiFailure getFailure() {
        return failure;
    }

    public ErrorKind getErrorKind() {
        return failure != null ? failure.getKind() : null;
    }

    public String getMessage() {
        return failure != null ? failure.getMessage() : null;
    }

    /**
     * Returns the payload, or throws the typed exception for the failure.
     */
    public JsonNode getOrThrow() {
        if (failure != null) {
            throw failure.toException();
        }
        return payload;
    }

    @Override
    public String toString() {
        if (failure != null) {
            return "RequestOutcome{FAILURE, " + failure + "}";
        }
        return "RequestOutcome{" + type + ", statusCode=" + statusCode + "}";
    }
}
