package com.teamleader.sdk.errors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns a raw HTTP status and body, or a transport failure, into exactly one {@link ApiFailure}.
 *
 * <p>Status mapping:</p>
 * <ul>
 *   <li>401 &rarr; {@link ErrorKind#UNAUTHORIZED}</li>
 *   <li>404 &rarr; {@link ErrorKind#NOT_FOUND}</li>
 *   <li>429 &rarr; {@link ErrorKind#RATE_LIMIT_EXCEEDED}, with {@code Retry-After} when present</li>
 *   <li>500-599 &rarr; {@link ErrorKind#SERVER_ERROR}</li>
 *   <li>any other non-2xx &rarr; {@link ErrorKind#VALIDATION}</li>
 * </ul>
 *
 * <p>The classifier never logs; reporting is left to the caller so each failure is logged once.</p>
 */
public class ErrorClassifier {

    public static final String UNKNOWN_ERROR = "Unknown error";

    /** Upper bound for a server-provided {@code Retry-After}. */
    public static final long MAX_RETRY_AFTER_SECONDS = Duration.ofDays(1).getSeconds();

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ErrorClassifier(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public ErrorKind classifyStatus(int statusCode) {
        if (statusCode == 401) {
            return ErrorKind.UNAUTHORIZED;
        }
        if (statusCode == 404) {
            return ErrorKind.NOT_FOUND;
        }
        if (statusCode == 429) {
            return ErrorKind.RATE_LIMIT_EXCEEDED;
        }
        if (statusCode >= 500 && statusCode <= 599) {
            return ErrorKind.SERVER_ERROR;
        }
        return ErrorKind.VALIDATION;
    }

    /**
     * Classifies a non-2xx response.
     *
     * @param headers response headers; may be null or empty
     */
    public ApiFailure classify(int statusCode, String body, Map<String, List<String>> headers) {
        ErrorKind kind = classifyStatus(statusCode);
        List<String> errors = parseErrors(body);

        ApiFailure.Builder builder = ApiFailure.builder(kind)
                .statusCode(statusCode)
                .message(errors.isEmpty() ? UNKNOWN_ERROR : errors.get(0))
                .errors(errors)
                .responseBody(body);

        if (kind == ErrorKind.RATE_LIMIT_EXCEEDED) {
            builder.retryAfterSeconds(parseRetryAfter(firstHeader(headers, "Retry-After")));
        }
        return builder.build();
    }

    /**
     * Classifies a failure where no HTTP response was received.
     */
    public ApiFailure classifyTransportFailure(IOException exception) {
        return ApiFailure.builder(ErrorKind.TRANSPORT)
                .message("HTTP request failed: " + exception.getMessage())
                .cause(exception)
                .build();
    }

    public boolean isRetryable(ErrorKind kind) {
        return kind.isRetryable();
    }

    /**
     * Returns the primary human-readable message of an error body, or {@value #UNKNOWN_ERROR}.
     */
    public String primaryMessage(String body) {
        List<String> errors = parseErrors(body);
        return errors.isEmpty() ? UNKNOWN_ERROR : errors.get(0);
    }

    /**
     * Extracts error messages from the envelopes the API uses. The first matching shape wins:
     * an {@code errors} list of {@code {title}} objects or strings, then an
     * {@code error}/{@code error_description} pair, then a flat {@code message}.
     */
    public List<String> parseErrors(String body) {
        List<String> errors = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return errors;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return errors;
        }
        if (root == null || !root.isObject()) {
            return errors;
        }

        JsonNode errorList = root.get("errors");
        if (errorList != null && errorList.isArray()) {
            for (JsonNode error : errorList) {
                if (error.isObject() && error.hasNonNull("title")) {
                    errors.add(error.get("title").asText());
                } else if (error.isTextual()) {
                    errors.add(error.asText());
                }
            }
        } else if (root.hasNonNull("error")) {
            JsonNode description = root.get("error_description");
            errors.add(description != null && !description.isNull()
                    ? description.asText()
                    : root.get("error").asText());
        } else if (root.hasNonNull("message")) {
            errors.add(root.get("message").asText());
        }
        return errors;
    }

    /**
     * Parses a {@code Retry-After} value given either as delta-seconds or as an HTTP date.
     *
     * @return seconds to wait, between 0 and {@link #MAX_RETRY_AFTER_SECONDS}, or null when absent
     *         or unparseable
     */
    public Long parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            try {
                return Math.min(Long.parseLong(trimmed), MAX_RETRY_AFTER_SECONDS);
            } catch (NumberFormatException e) {
                // more digits than a long holds
                return MAX_RETRY_AFTER_SECONDS;
            }
        }
        try {
            ZonedDateTime date = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
            long seconds = Duration.between(clock.instant(), date.toInstant()).getSeconds();
            return Math.min(Math.max(0L, seconds), MAX_RETRY_AFTER_SECONDS);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private static String firstHeader(Map<String, List<String>> headers, String name) {
        if (headers == null || headers.isEmpty()) {
            return null;
        }
        Map<String, List<String>> lookup = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        lookup.putAll(headers);
        List<String> values = lookup.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
