package com.teamleader.sdk.auth;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * Persistence for {@link TokenPair}s, keyed by account.
 *
 * <p>A store is a passive backend: it never refreshes or validates tokens. Implementations
 * must be safe for concurrent use.</p>
 */
public interface TokenStore {

    Optional<TokenPair> load(String accountKey);

    /**
     * Replaces whatever is stored for the account. The entry disappears after {@code ttl}.
     */
    void save(String accountKey, TokenPair tokens, Duration ttl);

    void delete(String accountKey);

    /**
     * Lock that serializes token refreshes for one account.
     */
    Lock lockFor(String accountKey);
}
