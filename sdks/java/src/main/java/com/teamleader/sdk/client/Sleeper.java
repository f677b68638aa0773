package com.teamleader.sdk.client;

/**
 * Blocks the calling thread for rate-limit waits and retry backoff.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
