package com.teamleader.sdk.auth;

import com.teamleader.sdk.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.Lock;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTokenStoreTest {

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    private final InMemoryTokenStore store = new InMemoryTokenStore(clock);

    private TokenPair pair(String access) {
        Instant now = clock.instant();
        return new TokenPair(access, "refresh", "Bearer", now, now.plusSeconds(3600));
    }

    @Test
    void testSaveLoadDelete() {
        TokenPair tokens = pair("access");
        store.save("acme", tokens, Duration.ofDays(30));

        assertEquals(tokens, store.load("acme").orElseThrow());
        assertTrue(store.load("other").isEmpty());

        store.delete("acme");
        assertTrue(store.load("acme").isEmpty());
    }

    @Test
    void testEntryExpiresAfterTtl() {
        store.save("acme", pair("access"), Duration.ofMinutes(10));

        clock.advance(Duration.ofMinutes(9));
        assertTrue(store.load("acme").isPresent());

        clock.advance(Duration.ofMinutes(2));
        assertTrue(store.load("acme").isEmpty());
    }

    @Test
    void testSaveReplacesPreviousPair() {
        store.save("acme", pair("first"), Duration.ofDays(1));
        store.save("acme", pair("second"), Duration.ofDays(1));

        assertEquals("second", store.load("acme").orElseThrow().getAccessToken());
    }

    @Test
    void testLockIsPerAccount() {
        Lock lock = store.lockFor("acme");

        assertSame(lock, store.lockFor("acme"));
        assertNotSame(lock, store.lockFor("other"));
    }
}
