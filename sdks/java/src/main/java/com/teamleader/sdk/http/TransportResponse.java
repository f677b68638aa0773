package com.teamleader.sdk.http;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A raw HTTP response: status, body and headers, whatever the status.
 *
 * <p>Header lookups are case-insensitive.</p>
 */
public final class TransportResponse {

    private final int statusCode;
    private final String body;
    private final Map<String, List<String>> headers;

    public TransportResponse(int statusCode, String body, Map<String, List<String>> headers) {
        this.statusCode = statusCode;
        this.body = body != null ? body : "";
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        }
        this.headers = Collections.unmodifiableMap(copy);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    /**
     * Returns the first value of the named header, or null.
     */
    public String header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
