package com.teamleader.sdk.http;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An outbound HTTP request as seen by a {@link HttpTransport}.
 */
public final class TransportRequest {

    private final String method;
    private final String url;
    private final Map<String, String> headers;
    private final String body;
    private final String contentType;

    private TransportRequest(Builder builder) {
        this.method = builder.method;
        this.url = builder.url;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.body = builder.body;
        this.contentType = builder.contentType;
    }

    public static Builder builder(String method, String url) {
        return new Builder(method, url);
    }

    public String getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * Request body, or null when the request carries none.
     */
    public String getBody() {
        return body;
    }

    public String getContentType() {
        return contentType;
    }

    @Override
    public String toString() {
        return "TransportRequest{" + method + " " + url + "}";
    }

    /**
     * Builder for creating TransportRequest instances.
     */
    public static class Builder {
        private final String method;
        private final String url;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String body;
        private String contentType = "application/json";

        private Builder(String method, String url) {
            this.method = Objects.requireNonNull(method, "method must not be null").toUpperCase();
            this.url = Objects.requireNonNull(url, "url must not be null");
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder body(String body, String contentType) {
            this.body = body;
            this.contentType = Objects.requireNonNull(contentType, "contentType must not be null");
            return this;
        }

        public TransportRequest build() {
            return new TransportRequest(this);
        }
    }
}
