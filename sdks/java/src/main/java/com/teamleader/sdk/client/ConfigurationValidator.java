package com.teamleader.sdk.client;

import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Checks a {@link TeamleaderClientConfig} before any network call is made.
 */
public class ConfigurationValidator {

    public ValidationResult validate(TeamleaderClientConfig config) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        requireValue(config.getClientId(), "clientId", errors);
        requireValue(config.getClientSecret(), "clientSecret", errors);
        requireValue(config.getRedirectUri(), "redirectUri", errors);

        if (!isBlank(config.getClientId()) && config.getClientId().length() < 10) {
            warnings.add("Client ID seems too short - please verify it's correct");
        }
        if (!isBlank(config.getClientSecret()) && config.getClientSecret().length() < 20) {
            warnings.add("Client secret seems too short - please verify it's correct");
        }

        requireUrl(config.getBaseUrl(), "baseUrl", errors);
        requireUrl(config.getAuthUrl(), "authUrl", errors);

        if (!isBlank(config.getRedirectUri())) {
            // HttpUrl only parses http and https, so a parse failure also covers other schemes
            HttpUrl redirect = HttpUrl.parse(config.getRedirectUri());
            if (redirect == null) {
                errors.add("Invalid redirectUri: " + config.getRedirectUri() + " (must be an http or https URL)");
            } else if (!redirect.isHttps()) {
                warnings.add("Redirect URI uses plain HTTP - use HTTPS outside local development");
            }
        }

        if (isBlank(config.getApiVersion())) {
            errors.add("Missing required configuration: apiVersion");
        }
        if (config.getMaxAttempts() < 1) {
            errors.add("maxAttempts must be at least 1");
        }
        if (config.getCallLogCapacity() < 0) {
            errors.add("callLogCapacity must not be negative");
        }

        return new ValidationResult(errors, warnings);
    }

    private static void requireValue(String value, String name, List<String> errors) {
        if (isBlank(value)) {
            errors.add("Missing required configuration: " + name);
        }
    }

    private static void requireUrl(String value, String name, List<String> errors) {
        if (isBlank(value)) {
            errors.add("Missing required configuration: " + name);
        } else if (HttpUrl.parse(value) == null) {
            errors.add("Invalid " + name + ": " + value);
        }
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Outcome of a configuration check.
     */
    public static final class ValidationResult {
        private final List<String> errors;
        private final List<String> warnings;

        ValidationResult(List<String> errors, List<String> warnings) {
            this.errors = Collections.unmodifiableList(errors);
            this.warnings = Collections.unmodifiableList(warnings);
        }

        public boolean isValid() {
            return errors.isEmpty();
        }

        public List<String> getErrors() {
            return errors;
        }

        public List<String> getWarnings() {
            return warnings;
        }

        public String getSummary() {
            if (isValid()) {
                return warnings.isEmpty()
                        ? "Configuration is valid"
                        : "Configuration is valid with " + warnings.size() + " warning(s)";
            }
            return "Configuration has " + errors.size() + " error(s): " + String.join("; ", errors);
        }
    }
}
