package com.teamleader.sdk.client;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, thread-safe record of the HTTP attempts made by one client. The oldest entries are
 * dropped once the capacity is reached; the call count keeps counting.
 */
public class CallLog {

    private final int capacity;
    private final Deque<ApiCall> calls = new ArrayDeque<>();
    private long callCount;

    public CallLog(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative");
        }
        this.capacity = capacity;
    }

    public synchronized void record(ApiCall call) {
        callCount++;
        if (capacity == 0) {
            return;
        }
        if (calls.size() == capacity) {
            calls.removeFirst();
        }
        calls.addLast(call);
    }

    public synchronized List<ApiCall> getCalls() {
        return List.copyOf(calls);
    }

    public synchronized long getCallCount() {
        return callCount;
    }

    public synchronized void reset() {
        calls.clear();
        callCount = 0;
    }

    public int getCapacity() {
        return capacity;
    }
}
