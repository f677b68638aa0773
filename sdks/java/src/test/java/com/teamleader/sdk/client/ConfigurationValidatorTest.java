package com.teamleader.sdk.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationValidatorTest {

    private final ConfigurationValidator validator = new ConfigurationValidator();

    private TeamleaderClientConfig.Builder valid() {
        return TeamleaderClientConfig.builder()
                .clientId("client-id-1234")
                .clientSecret("client-secret-0123456789")
                .redirectUri("https://example.com/callback");
    }

    @Test
    void testValidConfiguration() {
        ConfigurationValidator.ValidationResult result = validator.validate(valid().build());

        assertTrue(result.isValid());
        assertTrue(result.getErrors().isEmpty());
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    void testMissingCredentials() {
        ConfigurationValidator.ValidationResult result = validator.validate(TeamleaderClientConfig.builder().build());

        assertFalse(result.isValid());
        assertTrue(result.getErrors().contains("Missing required configuration: clientId"));
        assertTrue(result.getErrors().contains("Missing required configuration: clientSecret"));
        assertTrue(result.getErrors().contains("Missing required configuration: redirectUri"));
    }

    @Test
    void testInvalidUrlsAndLimits() {
        ConfigurationValidator.ValidationResult result = validator.validate(valid()
                .baseUrl("not a url")
                .redirectUri("ftp://example.com/callback")
                .apiVersion(" ")
                .maxAttempts(0)
                .build());

        assertFalse(result.isValid());
        assertEquals(4, result.getErrors().size(), result.getSummary());
    }

    @Test
    void testWarnings() {
        ConfigurationValidator.ValidationResult result = validator.validate(valid()
                .clientId("short")
                .clientSecret("also-short")
                .redirectUri("http://localhost:8080/callback")
                .build());

        assertTrue(result.isValid());
        assertEquals(3, result.getWarnings().size());
    }
}
