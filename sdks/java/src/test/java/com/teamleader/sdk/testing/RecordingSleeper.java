package com.teamleader.sdk.testing;

import com.teamleader.sdk.client.Sleeper;

import java.util.ArrayList;
import java.util.List;

/**
 * Sleeper that records requested delays and advances a {@link MutableClock} instead of blocking.
 */
public final class RecordingSleeper implements Sleeper {

    private final MutableClock clock;
    private final List<Long> sleeps = new ArrayList<>();

    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void sleep(long millis) {
        sleeps.add(millis);
        if (clock != null) {
            clock.advanceMillis(millis);
        }
    }

    public synchronized List<Long> getSleeps() {
        return List.copyOf(sleeps);
    }

    public synchronized long total() {
        return sleeps.stream().mapToLong(Long::longValue).sum();
    }
}
