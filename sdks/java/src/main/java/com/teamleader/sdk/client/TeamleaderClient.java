package com.teamleader.sdk.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.teamleader.sdk.auth.InMemoryTokenStore;
import com.teamleader.sdk.auth.TokenService;
import com.teamleader.sdk.auth.TokenStore;
import com.teamleader.sdk.errors.ErrorClassifier;
import com.teamleader.sdk.exceptions.ConfigurationException;
import com.teamleader.sdk.exceptions.TeamleaderException;
import com.teamleader.sdk.http.HttpTransport;
import com.teamleader.sdk.http.OkHttpTransport;
import com.teamleader.sdk.models.HealthStatus;
import com.teamleader.sdk.models.RequestOutcome;
import com.teamleader.sdk.models.TokenInfo;
import com.teamleader.sdk.ratelimit.RateLimitStatistics;
import com.teamleader.sdk.ratelimit.RateLimiter;
import okhttp3.HttpUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Main client for the Teamleader Focus API.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * TeamleaderClient client = TeamleaderClient.builder()
 *     .config(TeamleaderClientConfig.builder()
 *         .clientId("your-client-id")
 *         .clientSecret("your-client-secret")
 *         .redirectUri("https://example.com/callback")
 *         .build())
 *     .build();
 *
 * // Redirect the user to client.getAuthorizationUrl(state), then on callback:
 * client.handleOAuthCallback(code, state);
 *
 * RequestOutcome outcome = client.request("POST", "contacts.list", Map.of("page", Map.of("size", 20)));
 * if (outcome.isSuccess()) {
 *     JsonNode contacts = outcome.getPayload().path("data");
 * }
 *
 * client.close();
 * }</pre>
 */
public class TeamleaderClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TeamleaderClient.class);

    private static final String AUTHORIZE_PATH = "oauth2/authorize";

    private final TeamleaderClientConfig config;
    private final HttpTransport transport;
    private final boolean ownsTransport;
    private final Clock clock;
    private final TokenService tokenService;
    private final RateLimiter rateLimiter;
    private final CallLog callLog;
    private final RequestDispatcher dispatcher;
    private volatile String manualAccessToken;

    private TeamleaderClient(Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "config must not be null");

        ConfigurationValidator.ValidationResult validation = new ConfigurationValidator().validate(config);
        if (!validation.isValid()) {
            throw new ConfigurationException("Invalid Teamleader configuration: " + validation.getSummary());
        }
        for (String warning : validation.getWarnings()) {
            logger.warn("Configuration warning: {}", warning);
        }

        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        if (builder.transport != null) {
            this.transport = builder.transport;
            this.ownsTransport = false;
        } else {
            this.transport = new OkHttpTransport(config.getConnectTimeout(), config.getReadTimeout(),
                    config.getTimeout());
            this.ownsTransport = true;
        }

        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        ErrorClassifier errorClassifier = new ErrorClassifier(objectMapper, clock);
        TokenStore tokenStore = builder.tokenStore != null ? builder.tokenStore : new InMemoryTokenStore(clock);

        this.tokenService = new TokenService(config, tokenStore, transport, objectMapper, errorClassifier, clock);
        this.rateLimiter = new RateLimiter(config.getRateLimiter(), clock);
        this.callLog = new CallLog(config.getCallLogCapacity());
        this.dispatcher = new RequestDispatcher(config, transport, rateLimiter, errorClassifier,
                RetryPolicy.from(config), callLog, objectMapper,
                builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM, clock, this::getToken);

        logger.debug("Teamleader client created for {} (API version {})", config.getBaseUrl(), config.getApiVersion());
    }

    /**
     * Creates a new client builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Sends a request to the API. This is the single entry point for resource calls; it handles
     * tokens, rate limiting, retries and error classification.
     *
     * @param method HTTP method, usually POST
     * @param path   endpoint, e.g. {@code contacts.info}
     * @param body   request body, serialized as JSON, or null
     * @return the outcome; in throw mode failures are raised as {@link TeamleaderException} instead
     */
    public RequestOutcome request(String method, String path, Object body) {
        return dispatcher.dispatch(method, path, body);
    }

    /**
     * Exchanges an OAuth2 authorization code for tokens, using the same retry handling as
     * {@link #request}.
     *
     * @return true if tokens were stored; false on failure unless throw mode is on
     */
    public boolean handleOAuthCallback(String code, String state) {
        logger.info("Handling OAuth callback (state {})", state != null && !state.isEmpty() ? "present" : "absent");
        try {
            dispatcher.withRetry("OAuth callback", (attempt, delayBefore) ->
                    tokenService.exchangeAuthorizationCode(code));
        } catch (TeamleaderException e) {
            if (config.isThrowExceptions()) {
                throw e;
            }
            return false;
        }
        manualAccessToken = null;
        logger.info("OAuth callback handled, tokens stored");
        return true;
    }

    /**
     * URL to send the user to for granting access.
     */
    public String getAuthorizationUrl(String state) {
        HttpUrl.Builder url = HttpUrl.get(config.getAuthUrl()).newBuilder()
                .addPathSegments(AUTHORIZE_PATH)
                .addQueryParameter("client_id", config.getClientId())
                .addQueryParameter("response_type", "code")
                .addQueryParameter("redirect_uri", config.getRedirectUri());
        if (state != null && !state.isEmpty()) {
            url.addQueryParameter("state", state);
        }
        return url.build().toString();
    }

    /**
     * True when a manual token is set or the token service can supply a valid token.
     */
    public boolean isAuthenticated() {
        return getToken() != null;
    }

    /**
     * Overrides the token service with a fixed access token, for testing and embedding.
     */
    public void setAccessToken(String accessToken) {
        this.manualAccessToken = accessToken;
        logger.debug("Manual access token {}", accessToken != null ? "set" : "cleared");
    }

    /**
     * Drops a manual token override so tokens come from the token service again.
     */
    public void useTokenService() {
        this.manualAccessToken = null;
    }

    /**
     * Returns the manual token if one is set, otherwise a valid token from the token service.
     */
    public String getToken() {
        String manual = manualAccessToken;
        return manual != null ? manual : tokenService.getValidAccessToken();
    }

    /**
     * Clears the manual token and the stored tokens.
     */
    public void logout() {
        manualAccessToken = null;
        tokenService.clearTokens();
        logger.info("Logged out");
    }

    public String getApiVersion() {
        return dispatcher.getApiVersion();
    }

    public void setApiVersion(String apiVersion) {
        if (apiVersion == null || apiVersion.isBlank()) {
            throw new ConfigurationException("API version must not be blank");
        }
        dispatcher.setApiVersion(apiVersion);
    }

    public TokenService getTokenService() {
        return tokenService;
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public RateLimitStatistics getRateLimitStats() {
        return rateLimiter.getStatistics();
    }

    public CallLog getCallLog() {
        return callLog;
    }

    public TeamleaderClientConfig getConfig() {
        return config;
    }

    /**
     * Performs a health check. When authenticated this sends a {@code users.me} request to
     * verify API connectivity.
     */
    public HealthStatus healthCheck() {
        Map<String, String> components = new LinkedHashMap<>();

        ConfigurationValidator.ValidationResult validation = new ConfigurationValidator().validate(config);
        components.put("configuration", validation.isValid() ? "ok" : "invalid");

        boolean authenticated = isAuthenticated();
        components.put("authentication", authenticated ? "ok" : "not_authenticated");

        TokenInfo tokenInfo = tokenService.getTokenInfo();
        RateLimitStatistics stats = rateLimiter.getStatistics();
        components.put("rate_limit", rateLimiter.isThrottled() ? "throttled" : "ok");

        boolean apiReachable = true;
        if (authenticated) {
            String apiCheck;
            try {
                RequestOutcome outcome = dispatcher.dispatch("POST", "users.me", null);
                apiCheck = outcome.isSuccess() ? "ok" : "error: " + outcome.getMessage();
                apiReachable = outcome.isSuccess();
            } catch (TeamleaderException e) {
                apiCheck = "error: " + e.getMessage();
                apiReachable = false;
            }
            components.put("api", apiCheck);
        } else {
            components.put("api", "skipped");
        }

        String status;
        if (!validation.isValid() || !apiReachable) {
            status = HealthStatus.UNHEALTHY;
        } else if (!authenticated || rateLimiter.isThrottled()) {
            status = HealthStatus.DEGRADED;
        } else {
            status = HealthStatus.HEALTHY;
        }

        List<String> errors = validation.getErrors();
        logger.debug("Health check: {} {}", status, components);
        return new HealthStatus(status, clock.instant(), getApiVersion(), errors, validation.getWarnings(),
                authenticated, tokenInfo, stats, components);
    }

    /**
     * Closes the client and releases the HTTP transport it created.
     */
    @Override
    public void close() {
        if (ownsTransport && transport instanceof AutoCloseable) {
            try {
                ((AutoCloseable) transport).close();
            } catch (Exception e) {
                logger.warn("Failed to close HTTP transport: {}", e.getMessage());
            }
        }
    }

    /**
     * Builder for creating TeamleaderClient instances.
     */
    public static class Builder {
        private TeamleaderClientConfig config;
        private HttpTransport transport;
        private TokenStore tokenStore;
        private Clock clock;
        private Sleeper sleeper;

        public Builder config(TeamleaderClientConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Uses the given transport instead of an OkHttp one. The caller keeps ownership of it.
         */
        public Builder transport(HttpTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder tokenStore(TokenStore tokenStore) {
            this.tokenStore = tokenStore;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public TeamleaderClient build() {
            return new TeamleaderClient(this);
        }
    }
}
