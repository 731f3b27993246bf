package com.stepflow.scheduler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ManualTimerServiceTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    private ManualTimerService time;
    private List<String> fired;

    @BeforeEach
    void setUp() {
        time = new ManualTimerService(START);
        fired = new ArrayList<>();
    }

    @Test
    void advance_shouldFireDueTimersInFireTimeOrder() {
        time.scheduleAfter(Duration.ofSeconds(3), () -> fired.add("three"));
        time.scheduleAfter(Duration.ofSeconds(1), () -> fired.add("one"));
        time.scheduleAfter(Duration.ofSeconds(10), () -> fired.add("ten"));

        time.advance(Duration.ofSeconds(5));

        assertEquals(List.of("one", "three"), fired);
        assertEquals(START.plusSeconds(5), time.now());
        assertEquals(1, time.pendingTimers());
        assertEquals(START.plusSeconds(10), time.nextFireTime().orElseThrow());
    }

    @Test
    void advance_shouldExposeFireTimeToCallbacks() {
        List<Instant> seen = new ArrayList<>();
        time.scheduleAfter(Duration.ofSeconds(2), () -> seen.add(time.now()));

        time.advance(Duration.ofSeconds(7));

        assertEquals(List.of(START.plusSeconds(2)), seen);
    }

    @Test
    void advance_shouldFireTimersScheduledByCallbacks() {
        time.scheduleAfter(Duration.ofSeconds(1), () -> {
            fired.add("first");
            time.scheduleAfter(Duration.ofSeconds(1), () -> fired.add("chained"));
        });

        time.advance(Duration.ofSeconds(2));

        assertEquals(List.of("first", "chained"), fired);
    }

    @Test
    void cancel_shouldPreventFiring() {
        TimerHandle handle = time.scheduleAfter(Duration.ofSeconds(1), () -> fired.add("cancelled"));

        assertTrue(handle.cancel());
        assertFalse(handle.cancel());
        time.advance(Duration.ofSeconds(2));

        assertTrue(fired.isEmpty());
        assertEquals(0, time.pendingTimers());
    }

    @Test
    void failingCallback_shouldNotStopOtherTimers() {
        time.scheduleAfter(Duration.ofSeconds(1), () -> {
            throw new IllegalStateException("boom");
        });
        time.scheduleAfter(Duration.ofSeconds(2), () -> fired.add("after"));

        time.advance(Duration.ofSeconds(3));

        assertEquals(List.of("after"), fired);
    }

    @Test
    void advanceToNextTimer_shouldJumpToEarliestTimer() {
        time.scheduleAfter(Duration.ofMinutes(5), () -> fired.add("later"));

        assertTrue(time.advanceToNextTimer());
        assertEquals(START.plus(Duration.ofMinutes(5)), time.now());
        assertEquals(List.of("later"), fired);
        assertFalse(time.advanceToNextTimer());
    }

    @Test
    void runDueTimers_shouldFireTimersInThePast() {
        time.schedule(START.minusSeconds(1), () -> fired.add("overdue"));

        time.runDueTimers();

        assertEquals(List.of("overdue"), fired);
        assertEquals(START, time.now());
    }
}
