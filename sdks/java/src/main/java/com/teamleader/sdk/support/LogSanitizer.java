package com.teamleader.sdk.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts tokens, secrets and similar values before they are written to a log.
 */
public final class LogSanitizer {

    public static final String REDACTED = "***REDACTED***";

    private static final int MAX_DEPTH = 10;
    private static final int MAX_LENGTH = 2000;

    private static final List<String> SENSITIVE_KEYS = List.of(
            "access_token", "refresh_token", "token", "bearer", "authorization",
            "api_key", "apikey", "secret", "password", "passwd", "passphrase",
            "private_key", "code", "otp", "pin", "iban", "card_number", "cvv");

    private static final Set<String> SENSITIVE_HEADERS = Set.of(
            "authorization", "x-api-key", "x-auth-token", "cookie", "set-cookie");

    private static final Pattern BEARER = Pattern.compile("Bearer\\s+[A-Za-z0-9\\-._~+/]+=*");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LogSanitizer() {
    }

    /**
     * Returns true if a field with this name must never be logged.
     */
    public static boolean isSensitiveKey(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        for (String sensitive : SENSITIVE_KEYS) {
            if (lower.contains(sensitive)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Sanitizes a raw response or request body. JSON bodies are redacted field by field;
     * anything else only has bearer strings masked. Long bodies are truncated.
     */
    public static String sanitizeBody(String body) {
        if (body == null || body.isEmpty()) {
            return body;
        }
        String result;
        try {
            JsonNode node = MAPPER.readTree(body);
            result = node == null ? maskBearer(body) : MAPPER.writeValueAsString(sanitize(node, 0));
        } catch (JsonProcessingException e) {
            result = maskBearer(body);
        }
        return result.length() > MAX_LENGTH ? result.substring(0, MAX_LENGTH) + "...(truncated)" : result;
    }

    public static Map<String, List<String>> sanitizeHeaders(Map<String, List<String>> headers) {
        Map<String, List<String>> sanitized = new LinkedHashMap<>();
        headers.forEach((name, values) -> sanitized.put(name,
                SENSITIVE_HEADERS.contains(name.toLowerCase(Locale.ROOT)) ? List.of(REDACTED) : values));
        return sanitized;
    }

    private static JsonNode sanitize(JsonNode node, int depth) {
        if (depth > MAX_DEPTH) {
            return TextNode.valueOf("[MAX_DEPTH_REACHED]");
        }
        if (node.isObject()) {
            ObjectNode copy = MAPPER.createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), isSensitiveKey(field.getKey())
                        ? TextNode.valueOf(REDACTED)
                        : sanitize(field.getValue(), depth + 1));
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = MAPPER.createArrayNode();
            node.forEach(element -> copy.add(sanitize(element, depth + 1)));
            return copy;
        }
        if (node.isTextual() && BEARER.matcher(node.asText()).find()) {
            return TextNode.valueOf(REDACTED);
        }
        return node;
    }

    private static String maskBearer(String value) {
        return BEARER.matcher(value).replaceAll("Bearer " + REDACTED);
    }
}
