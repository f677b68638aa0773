package com.teamleader.sdk.client;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CallLogTest {

    private static ApiCall call(String path) {
        return new ApiCall("POST", path, 200, 12, Instant.parse("2024-05-01T10:00:00Z"), 1, 0);
    }

    @Test
    void testDropsOldestBeyondCapacity() {
        CallLog log = new CallLog(2);
        log.record(call("contacts.list"));
        log.record(call("contacts.info"));
        log.record(call("deals.list"));

        assertEquals(3, log.getCallCount());
        assertEquals(2, log.getCalls().size());
        assertEquals("contacts.info", log.getCalls().get(0).getPath());
    }

    @Test
    void testInstancesAreIndependent() {
        CallLog first = new CallLog(10);
        CallLog second = new CallLog(10);
        first.record(call("users.me"));

        assertEquals(1, first.getCallCount());
        assertEquals(0, second.getCallCount());
    }

    @Test
    void testReset() {
        CallLog log = new CallLog(10);
        log.record(call("users.me"));

        log.reset();

        assertEquals(0, log.getCallCount());
        assertTrue(log.getCalls().isEmpty());
    }
}
