package com.teamleader.sdk.auth;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory token store using Caffeine, with a TTL per entry.
 *
 * <p>Single process only. Expiry is measured against the supplied {@link Clock}.</p>
 */
public class InMemoryTokenStore implements TokenStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTokenStore.class);

    private final Cache<String, Entry> cache;
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public InMemoryTokenStore() {
        this(Clock.systemUTC());
    }

    public InMemoryTokenStore(Clock clock) {
        this.cache = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry entry, long currentTime) {
                        return entry.ttlNanos;
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                        return entry.ttlNanos;
                    }

                    @Override
                    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public Optional<TokenPair> load(String accountKey) {
        Entry entry = cache.getIfPresent(accountKey);
        return entry == null ? Optional.empty() : Optional.of(entry.tokens);
    }

    @Override
    public void save(String accountKey, TokenPair tokens, Duration ttl) {
        cache.put(accountKey, new Entry(tokens, ttl));
        logger.debug("Stored tokens for account '{}' (ttl {})", accountKey, ttl);
    }

    @Override
    public void delete(String accountKey) {
        cache.invalidate(accountKey);
        logger.debug("Deleted tokens for account '{}'", accountKey);
    }

    @Override
    public Lock lockFor(String accountKey) {
        return locks.computeIfAbsent(accountKey, key -> new ReentrantLock());
    }

    private static final class Entry {
        private final TokenPair tokens;
        private final long ttlNanos;

        private Entry(TokenPair tokens, Duration ttl) {
            this.tokens = tokens;
            this.ttlNanos = Math.max(1L, ttl.toNanos());
        }
    }
}
