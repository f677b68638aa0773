package com.teamleader.sdk.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamleader.sdk.client.TeamleaderClientConfig;
import com.teamleader.sdk.errors.ApiFailure;
import com.teamleader.sdk.errors.ErrorClassifier;
import com.teamleader.sdk.errors.ErrorKind;
import com.teamleader.sdk.exceptions.AuthenticationException;
import com.teamleader.sdk.exceptions.ConfigurationException;
import com.teamleader.sdk.exceptions.TeamleaderException;
import com.teamleader.sdk.exceptions.ValidationException;
import com.teamleader.sdk.http.HttpTransport;
import com.teamleader.sdk.http.TransportRequest;
import com.teamleader.sdk.http.TransportResponse;
import com.teamleader.sdk.models.TokenInfo;
import com.teamleader.sdk.models.TokenResponse;
import com.teamleader.sdk.support.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

/**
 * Owns the OAuth2 token lifecycle: storage, validity checks, proactive refresh and
 * authorization-code exchange.
 *
 * <p>Refreshes are single-flight per process. The first caller to need a refresh starts it and
 * publishes a future; callers arriving while it runs wait for that future. The refresh itself
 * runs under the store's per-account lock, and a caller that gets the lock after someone else
 * already replaced the tokens returns the stored pair without another network call.</p>
 */
public class TokenService {

    private static final Logger logger = LoggerFactory.getLogger(TokenService.class);

    private static final int DEFAULT_EXPIRES_IN = 3600;

    private final TeamleaderClientConfig config;
    private final TokenStore store;
    private final HttpTransport transport;
    private final ObjectMapper objectMapper;
    private final ErrorClassifier errorClassifier;
    private final Clock clock;

    private final Object flightMonitor = new Object();
    private CompletableFuture<TokenPair> inFlight;

    public TokenService(TeamleaderClientConfig config, TokenStore store, HttpTransport transport,
                        ObjectMapper objectMapper, ErrorClassifier errorClassifier, Clock clock) {
        requireCredential(config.getClientId(), "clientId");
        requireCredential(config.getClientSecret(), "clientSecret");
        requireCredential(config.getRedirectUri(), "redirectUri");

        this.config = config;
        this.store = store;
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.errorClassifier = errorClassifier;
        this.clock = clock;
    }

    /**
     * Returns an access token that is valid now, refreshing it first when it is within the
     * refresh buffer of expiry.
     *
     * @return the token, or null when no tokens are stored or the refresh failed
     */
    public String getValidAccessToken() {
        Optional<TokenPair> stored = store.load(config.getAccountKey());
        if (stored.isEmpty()) {
            logger.debug("No access token found for account '{}'", config.getAccountKey());
            return null;
        }

        TokenPair tokens = stored.get();
        Instant now = clock.instant();
        if (!tokens.needsRefresh(now, config.getRefreshBuffer())) {
            return tokens.getAccessToken();
        }

        logger.debug("Token needs refreshing: expires at {}, {}s left", tokens.getExpiresAt(),
                tokens.secondsUntilExpiry(now));
        try {
            return refreshIfUnchanged(tokens).getAccessToken();
        } catch (TeamleaderException e) {
            logger.warn("Token refresh failed ({}): {}", e.getKind(), e.getMessage());
            return null;
        }
    }

    /**
     * Exchanges the stored refresh token for a new pair.
     *
     * <p>Concurrent callers share one exchange and all receive the same pair.</p>
     *
     * @throws AuthenticationException if there is no refresh token or the server rejected it;
     *                                 the stored tokens are cleared in that case
     * @throws TeamleaderException     for transport or server failures; stored tokens are kept
     */
    public TokenPair refresh() {
        return refreshIfUnchanged(store.load(config.getAccountKey()).orElse(null));
    }

    /**
     * Stores the pair described by a token endpoint response, replacing any previous pair.
     *
     * <p>When the response carries no refresh token, the previously stored one is kept.</p>
     *
     * @throws ValidationException if the response has no access token
     */
    public TokenPair storeTokens(TokenResponse response) {
        if (response == null || response.getAccessToken() == null || response.getAccessToken().isBlank()) {
            throw new ValidationException("No access token in token response");
        }

        String refreshToken = response.getRefreshToken();
        boolean preserved = false;
        if (refreshToken == null || refreshToken.isBlank()) {
            refreshToken = store.load(config.getAccountKey()).map(TokenPair::getRefreshToken).orElse(null);
            preserved = true;
        }

        int expiresIn = response.getExpiresIn() != null ? response.getExpiresIn() : DEFAULT_EXPIRES_IN;
        Instant now = clock.instant();
        Instant expiresAt = now.plusSeconds(expiresIn);
        // an already-expired grant still gets issuedAt < expiresAt
        Instant issuedAt = expiresAt.isAfter(now) ? now : expiresAt.minusSeconds(1);

        TokenPair tokens = new TokenPair(response.getAccessToken(), refreshToken,
                response.getTokenType(), issuedAt, expiresAt);
        store.save(config.getAccountKey(), tokens, config.getTokenTtl());

        logger.info("Tokens stored: expires at {} ({} min), refresh token {}",
                expiresAt, Math.round(expiresIn / 6.0) / 10.0,
                refreshToken == null ? "absent" : preserved ? "preserved" : "new");
        return tokens;
    }

    /**
     * Exchanges an OAuth2 authorization code for a token pair and stores it.
     */
    public TokenPair exchangeAuthorizationCode(String code) {
        if (code == null || code.isBlank()) {
            throw new ValidationException("Authorization code must not be empty");
        }

        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", config.getClientId());
        form.put("client_secret", config.getClientSecret());
        form.put("code", code);
        form.put("grant_type", "authorization_code");
        form.put("redirect_uri", config.getRedirectUri());

        TokenPair tokens = storeTokens(requestTokens(form));
        logger.info("Authorization code exchanged for tokens");
        return tokens;
    }

    /**
     * Deletes the stored tokens. {@link #getValidAccessToken()} returns null until new tokens are stored.
     */
    public void clearTokens() {
        store.delete(config.getAccountKey());
        logger.info("Tokens cleared for account '{}'", config.getAccountKey());
    }

    /**
     * True when both tokens are stored and the access token is outside the refresh buffer.
     */
    public boolean hasValidTokens() {
        Optional<TokenPair> stored = store.load(config.getAccountKey());
        if (stored.isEmpty()) {
            return false;
        }
        TokenPair tokens = stored.get();
        if (tokens.getRefreshToken() == null || tokens.getRefreshToken().isBlank()) {
            return false;
        }
        return !tokens.needsRefresh(clock.instant(), config.getRefreshBuffer());
    }

    public Optional<TokenPair> getCurrentTokens() {
        return store.load(config.getAccountKey());
    }

    public TokenInfo getTokenInfo() {
        Optional<TokenPair> stored = store.load(config.getAccountKey());
        if (stored.isEmpty()) {
            return TokenInfo.empty();
        }
        TokenPair tokens = stored.get();
        Instant now = clock.instant();
        return new TokenInfo(true,
                tokens.getRefreshToken() != null,
                tokens.getExpiresAt(),
                tokens.secondsUntilExpiry(now),
                tokens.needsRefresh(now, config.getRefreshBuffer()));
    }

    private TokenPair refreshIfUnchanged(TokenPair observed) {
        CompletableFuture<TokenPair> flight;
        boolean owner = false;
        synchronized (flightMonitor) {
            flight = inFlight;
            if (flight == null) {
                flight = new CompletableFuture<>();
                inFlight = flight;
                owner = true;
            }
        }

        if (!owner) {
            logger.debug("Another refresh is in progress, waiting for its result");
            return await(flight);
        }

        Lock lock = store.lockFor(config.getAccountKey());
        try {
            acquire(lock);
            try {
                TokenPair current = store.load(config.getAccountKey()).orElse(null);
                TokenPair result;
                if (current != null && !Objects.equals(current, observed)) {
                    logger.debug("Tokens were replaced while waiting for the refresh lock, reusing them");
                    result = current;
                } else {
                    result = performRefresh(current);
                }
                flight.complete(result);
                return result;
            } finally {
                lock.unlock();
            }
        } catch (RuntimeException e) {
            flight.completeExceptionally(e);
            throw e;
        } finally {
            synchronized (flightMonitor) {
                if (inFlight == flight) {
                    inFlight = null;
                }
            }
        }
    }

    private TokenPair performRefresh(TokenPair current) {
        if (current == null || current.getRefreshToken() == null || current.getRefreshToken().isBlank()) {
            logger.error("No refresh token available for account '{}'", config.getAccountKey());
            clearTokens();
            throw new AuthenticationException("No refresh token available. Please connect to Teamleader again.");
        }

        logger.info("Attempting to refresh access token");

        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", config.getClientId());
        form.put("client_secret", config.getClientSecret());
        form.put("refresh_token", current.getRefreshToken());
        form.put("grant_type", "refresh_token");

        TokenResponse response;
        try {
            response = requestTokens(form);
        } catch (TeamleaderException e) {
            int status = e.getStatusCode();
            if (status == 400 || status == 401) {
                logger.error("Refresh token was rejected (HTTP {}), clearing stored tokens", status);
                clearTokens();
                throw new AuthenticationException(ApiFailure.builder(ErrorKind.UNAUTHORIZED)
                        .statusCode(status)
                        .message("Refresh token rejected: " + e.getMessage())
                        .errors(e.getErrors())
                        .responseBody(e.getResponseBody())
                        .cause(e)
                        .build());
            }
            throw e;
        }

        TokenPair tokens = storeTokens(response);
        logger.info("Access token refreshed successfully, new refresh token {}",
                response.getRefreshToken() != null ? "issued" : "not issued");
        return tokens;
    }

    private TokenResponse requestTokens(Map<String, String> form) {
        TransportRequest request = TransportRequest.builder("POST", config.getTokenUrl())
                .header("Accept", "application/json")
                .body(encodeForm(form), "application/x-www-form-urlencoded")
                .build();

        TransportResponse response;
        try {
            response = transport.execute(request);
        } catch (IOException e) {
            throw errorClassifier.classifyTransportFailure(e).toException();
        }

        if (response.getStatusCode() != 200) {
            logger.debug("Token endpoint returned HTTP {}: {}", response.getStatusCode(),
                    LogSanitizer.sanitizeBody(response.getBody()));
            throw errorClassifier.classify(response.getStatusCode(), response.getBody(), response.getHeaders())
                    .toException();
        }

        try {
            return objectMapper.readValue(response.getBody(), TokenResponse.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException(ApiFailure.builder(ErrorKind.VALIDATION)
                    .statusCode(response.getStatusCode())
                    .message("Token endpoint returned an unreadable body: " + e.getOriginalMessage())
                    .cause(e)
                    .build());
        }
    }

    private void acquire(Lock lock) {
        Duration timeout = config.getRefreshLockTimeout();
        try {
            if (!lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new AuthenticationException("Timed out after " + timeout + " waiting for token refresh lock");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthenticationException("Interrupted while waiting for token refresh lock");
        }
    }

    private static TokenPair await(CompletableFuture<TokenPair> flight) {
        try {
            return flight.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new AuthenticationException("Token refresh failed: " + e.getMessage());
        }
    }

    private static String encodeForm(Map<String, String> form) {
        List<String> pairs = new ArrayList<>();
        form.forEach((name, value) -> pairs.add(URLEncoder.encode(name, StandardCharsets.UTF_8)
                + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8)));
        return String.join("&", pairs);
    }

    private static void requireCredential(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Missing required configuration: " + name);
        }
    }
}
