package com.teamleader.sdk.support;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LogSanitizerTest {

    @Test
    void testRedactsSensitiveJsonFields() {
        String body = "{\"access_token\":\"abc\",\"expires_in\":3600," +
                "\"nested\":{\"client_secret\":\"s3cr3t\",\"name\":\"Acme\"}}";

        String sanitized = LogSanitizer.sanitizeBody(body);

        assertFalse(sanitized.contains("abc"));
        assertFalse(sanitized.contains("s3cr3t"));
        assertTrue(sanitized.contains("\"expires_in\":3600"));
        assertTrue(sanitized.contains("\"name\":\"Acme\""));
        assertTrue(sanitized.contains(LogSanitizer.REDACTED));
    }

    @Test
    void testMasksBearerInPlainText() {
        String sanitized = LogSanitizer.sanitizeBody("failed with Authorization: Bearer eyJhbGciOi.abc-123");

        assertFalse(sanitized.contains("eyJhbGciOi"));
        assertTrue(sanitized.contains("Bearer " + LogSanitizer.REDACTED));
    }

    @Test
    void testTruncatesLongBodies() {
        String sanitized = LogSanitizer.sanitizeBody("x".repeat(5000));

        assertTrue(sanitized.length() < 2100);
        assertTrue(sanitized.endsWith("...(truncated)"));
    }

    @Test
    void testNullAndEmptyBodies() {
        assertNull(LogSanitizer.sanitizeBody(null));
        assertEquals("", LogSanitizer.sanitizeBody(""));
    }

    @Test
    void testSanitizeHeaders() {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("Authorization", List.of("Bearer abc"));
        headers.put("X-RateLimit-Remaining", List.of("99"));

        Map<String, List<String>> sanitized = LogSanitizer.sanitizeHeaders(headers);

        assertEquals(List.of(LogSanitizer.REDACTED), sanitized.get("Authorization"));
        assertEquals(List.of("99"), sanitized.get("X-RateLimit-Remaining"));
    }

    @Test
    void testSensitiveKeys() {
        assertTrue(LogSanitizer.isSensitiveKey("refresh_token"));
        assertTrue(LogSanitizer.isSensitiveKey("Client_Secret"));
        assertFalse(LogSanitizer.isSensitiveKey("email"));
        assertFalse(LogSanitizer.isSensitiveKey(null));
    }
}
