package com.teamleader.sdk.auth;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.teamleader.sdk.client.TeamleaderClientConfig;
import com.teamleader.sdk.errors.ErrorClassifier;
import com.teamleader.sdk.exceptions.AuthenticationException;
import com.teamleader.sdk.exceptions.ConfigurationException;
import com.teamleader.sdk.exceptions.ServerException;
import com.teamleader.sdk.exceptions.ValidationException;
import com.teamleader.sdk.http.OkHttpTransport;
import com.teamleader.sdk.models.TokenInfo;
import com.teamleader.sdk.models.TokenResponse;
import com.teamleader.sdk.testing.MutableClock;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.*;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TokenServiceTest {

    private static final String REFRESHED =
            "{\"access_token\":\"new-access\",\"refresh_token\":\"new-refresh\"," +
                    "\"token_type\":\"Bearer\",\"expires_in\":3600}";

    private MockWebServer mockServer;
    private OkHttpTransport transport;
    private MutableClock clock;
    private InMemoryTokenStore store;
    private TokenService tokenService;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        store = new InMemoryTokenStore(clock);
        transport = new OkHttpTransport(Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofSeconds(10));
        tokenService = newService(config().build());
    }

    @AfterEach
    void tearDown() throws IOException {
        transport.close();
        mockServer.shutdown();
    }

    private TeamleaderClientConfig.Builder config() {
        return TeamleaderClientConfig.builder()
                .authUrl(mockServer.url("/").toString())
                .clientId("test-client-id")
                .clientSecret("test-client-secret-value")
                .redirectUri("https://example.com/callback");
    }

    private TokenService newService(TeamleaderClientConfig config) {
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        return new TokenService(config, store, transport, objectMapper,
                new ErrorClassifier(objectMapper, clock), clock);
    }

    @Test
    void testStoreAndClearTokens() {
        tokenService.storeTokens(new TokenResponse("access-1", "refresh-1", 3600));

        assertEquals("access-1", tokenService.getValidAccessToken());
        assertTrue(tokenService.hasValidTokens());

        tokenService.clearTokens();

        assertNull(tokenService.getValidAccessToken());
        assertFalse(tokenService.hasValidTokens());
        assertEquals(0, mockServer.getRequestCount());
    }

    @Test
    void testAlreadyExpiredGrantIsInvalid() {
        TokenPair tokens = tokenService.storeTokens(new TokenResponse("access-1", "refresh-1", -100));

        assertTrue(tokens.isExpired(clock.instant()));
        assertTrue(tokens.getIssuedAt().isBefore(tokens.getExpiresAt()));
        assertFalse(tokenService.hasValidTokens());
        assertTrue(tokenService.getTokenInfo().needsRefresh());
    }

    @Test
    void testMissingExpiresInDefaultsToOneHour() {
        TokenPair tokens = tokenService.storeTokens(new TokenResponse("access-1", "refresh-1", null));

        assertEquals(clock.instant().plusSeconds(3600), tokens.getExpiresAt());
    }

    @Test
    void testStoreKeepsPreviousRefreshToken() {
        tokenService.storeTokens(new TokenResponse("access-1", "refresh-1", 3600));
        TokenPair tokens = tokenService.storeTokens(new TokenResponse("access-2", null, 3600));

        assertEquals("access-2", tokens.getAccessToken());
        assertEquals("refresh-1", tokens.getRefreshToken());
    }

    @Test
    void testStoreRejectsMissingAccessToken() {
        assertThrows(ValidationException.class,
                () -> tokenService.storeTokens(new TokenResponse(" ", "refresh-1", 3600)));
    }

    @Test
    void testTokenInfo() {
        assertFalse(tokenService.getTokenInfo().hasAccessToken());

        tokenService.storeTokens(new TokenResponse("access-1", "refresh-1", 3600));
        clock.advance(Duration.ofMinutes(10));

        TokenInfo info = tokenService.getTokenInfo();
        assertTrue(info.hasAccessToken());
        assertTrue(info.hasRefreshToken());
        assertEquals(3000, info.getExpiresInSeconds());
        assertFalse(info.needsRefresh());
    }

    @Test
    void testRefreshesTokenInsideBuffer() throws Exception {
        tokenService.storeTokens(new TokenResponse("old-access", "old-refresh", 2));
        mockServer.enqueue(new MockResponse()
                .setBody(REFRESHED)
                .setHeader("Content-Type", "application/json"));

        assertEquals("new-access", tokenService.getValidAccessToken());
        assertEquals("new-access", tokenService.getValidAccessToken());
        assertEquals(1, mockServer.getRequestCount());

        RecordedRequest request = mockServer.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/oauth2/access_token", request.getPath());
        String form = request.getBody().readUtf8();
        assertTrue(form.contains("grant_type=refresh_token"));
        assertTrue(form.contains("refresh_token=old-refresh"));
        assertTrue(form.contains("client_id=test-client-id"));
        assertEquals("new-refresh", tokenService.getCurrentTokens().orElseThrow().getRefreshToken());
    }

    @Test
    void testConcurrentRefreshMakesOneCall() throws Exception {
        tokenService.storeTokens(new TokenResponse("old-access", "old-refresh", 3600));
        mockServer.enqueue(new MockResponse()
                .setBody(REFRESHED)
                .setHeader("Content-Type", "application/json")
                .setBodyDelay(300, TimeUnit.MILLISECONDS));
        mockServer.enqueue(new MockResponse().setResponseCode(500));

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<TokenPair>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            results.add(executor.submit(() -> {
                start.await();
                return tokenService.refresh();
            }));
        }
        start.countDown();

        TokenPair first = results.get(0).get(10, TimeUnit.SECONDS);
        for (Future<TokenPair> result : results) {
            assertEquals(first, result.get(10, TimeUnit.SECONDS));
        }
        executor.shutdown();

        assertEquals("new-access", first.getAccessToken());
        assertEquals(1, mockServer.getRequestCount());
    }

    @Test
    void testRejectedRefreshClearsTokens() {
        tokenService.storeTokens(new TokenResponse("old-access", "old-refresh", 3600));
        mockServer.enqueue(new MockResponse()
                .setResponseCode(400)
                .setBody("{\"error\":\"invalid_grant\",\"error_description\":\"Refresh token revoked\"}"));

        AuthenticationException e = assertThrows(AuthenticationException.class, () -> tokenService.refresh());

        assertEquals(400, e.getStatusCode());
        assertTrue(e.getMessage().contains("Refresh token revoked"));
        assertTrue(tokenService.getCurrentTokens().isEmpty());
    }

    @Test
    void testServerErrorDuringRefreshKeepsTokens() {
        tokenService.storeTokens(new TokenResponse("old-access", "old-refresh", 3600));
        mockServer.enqueue(new MockResponse().setResponseCode(503).setBody("{\"message\":\"down\"}"));

        assertThrows(ServerException.class, () -> tokenService.refresh());

        assertEquals("old-access", tokenService.getCurrentTokens().orElseThrow().getAccessToken());
    }

    @Test
    void testFailedRefreshReturnsNullToken() {
        tokenService.storeTokens(new TokenResponse("old-access", "old-refresh", 60));
        mockServer.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"invalid_client\"}"));

        assertNull(tokenService.getValidAccessToken());
        assertTrue(tokenService.getCurrentTokens().isEmpty());
    }

    @Test
    void testRefreshWithoutRefreshTokenFails() {
        tokenService.storeTokens(new TokenResponse("access-only", null, 3600));

        assertThrows(AuthenticationException.class, () -> tokenService.refresh());
        assertTrue(tokenService.getCurrentTokens().isEmpty());
        assertEquals(0, mockServer.getRequestCount());
    }

    @Test
    void testExchangeAuthorizationCode() throws Exception {
        mockServer.enqueue(new MockResponse()
                .setBody(REFRESHED)
                .setHeader("Content-Type", "application/json"));

        TokenPair tokens = tokenService.exchangeAuthorizationCode("auth-code-123");

        assertEquals("new-access", tokens.getAccessToken());
        assertEquals("new-access", tokenService.getValidAccessToken());

        String form = mockServer.takeRequest().getBody().readUtf8();
        assertTrue(form.contains("grant_type=authorization_code"));
        assertTrue(form.contains("code=auth-code-123"));
        assertTrue(form.contains("redirect_uri=https%3A%2F%2Fexample.com%2Fcallback"));
    }

    @Test
    void testMissingCredentialsRejected() {
        TeamleaderClientConfig config = config().clientSecret(null).build();

        assertThrows(ConfigurationException.class, () -> newService(config));
    }

    @Test
    void testMissingTokenIsNotLoggedAsWarning() {
        Logger logger = (Logger) LoggerFactory.getLogger(TokenService.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            assertNull(tokenService.getValidAccessToken());
            assertNull(tokenService.getValidAccessToken());
        } finally {
            logger.detachAppender(appender);
        }

        assertTrue(appender.list.stream().noneMatch(event -> event.getLevel().isGreaterOrEqual(Level.WARN)));
    }
}
