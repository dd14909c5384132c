package com.di.etlcontrol.monitor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for EventLog.
 */
@DisplayName("EventLog Tests")
class EventLogTest {

    private static final Instant START = Instant.parse("2026-10-17T09:30:00Z");

    private MutableClock clock;
    private EventLog eventLog;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        eventLog = new EventLog(clock);
    }

    // ============================================================================
    // Elapsed Time
    // ============================================================================

    @Test
    @DisplayName("Should measure elapsed time from the previous event of the same target and step")
    void testElapsed_SameTargetAndStep() {
        EventRecord start = eventLog.append("public.orders", "extract", "start");
        clock.advance(Duration.ofMillis(2500));
        EventRecord finish = eventLog.append("public.orders", "extract", "finish");

        assertEquals(0.0, start.getElapsed());
        assertEquals(2.5, finish.getElapsed(), 1e-9);
        assertEquals(START.plusMillis(2500), finish.getTimestamp());
    }

    @Test
    @DisplayName("Should start at zero for the first event of another step")
    void testElapsed_OtherStep() {
        eventLog.append("public.orders", "extract", "start");
        clock.advance(Duration.ofSeconds(3));
        eventLog.append("public.orders", "extract", "finish");
        clock.advance(Duration.ofSeconds(1));

        assertEquals(0.0, eventLog.append("public.orders", "copy", "start").getElapsed());
        assertEquals(0.0, eventLog.append("public.users", "extract", "start").getElapsed());
    }

    @Test
    @DisplayName("Should keep timestamps non-decreasing when the clock steps back")
    void testClockStepsBack() {
        EventRecord first = eventLog.append("t", "extract", "start");
        clock.set(START.minusSeconds(30));
        EventRecord second = eventLog.append("t", "extract", "finish");

        assertEquals(first.getTimestamp(), second.getTimestamp());
        assertEquals(0.0, second.getElapsed());
    }

    @Test
    @DisplayName("Should keep elapsed bookkeeping for evicted records")
    void testElapsed_AfterEviction() {
        EventLog small = new EventLog(clock, 2);
        small.append("a", "extract", "start");
        clock.advance(Duration.ofSeconds(1));
        small.append("b", "extract", "start");
        small.append("c", "extract", "start");
        clock.advance(Duration.ofSeconds(4));

        EventRecord finish = small.append("a", "extract", "finish");
        assertEquals(5.0, finish.getElapsed(), 1e-9);
    }

    // ============================================================================
    // Retention and Reads
    // ============================================================================

    @Test
    @DisplayName("Should return recent records in append order")
    void testRecent_Order() {
        eventLog.append("t", "extract", "start");
        eventLog.append("t", "extract", "finish");
        eventLog.append("t", "copy", "start");

        List<EventRecord> recent = eventLog.recent(2);
        assertEquals(2, recent.size());
        assertEquals("finish", recent.get(0).getEvent());
        assertEquals("copy", recent.get(1).getStep());
        assertEquals(3, eventLog.recent(10).size());
        assertTrue(eventLog.recent(0).isEmpty());
    }

    @Test
    @DisplayName("Should drop the oldest records beyond capacity")
    void testCapacity() {
        EventLog small = new EventLog(clock, 3);
        for (int i = 0; i < 5; i++) {
            small.append("t" + i, "extract", "start");
        }
        assertEquals(3, small.size());
        assertEquals(List.of("t2", "t3", "t4"),
                small.recent(10).stream().map(EventRecord::getTarget).toList());
    }

    @Test
    @DisplayName("Should reject a negative limit")
    void testRecent_NegativeLimit() {
        assertThrows(IllegalArgumentException.class, () -> eventLog.recent(-1));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\t"})
    @DisplayName("Should reject blank names and record nothing")
    void testAppend_Blank(String blank) {
        assertThrows(IllegalArgumentException.class, () -> eventLog.append(blank, "extract", "start"));
        assertThrows(IllegalArgumentException.class, () -> eventLog.append("t", blank, "start"));
        assertThrows(IllegalArgumentException.class, () -> eventLog.append("t", "extract", blank));
        assertEquals(0, eventLog.size());
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new EventLog(clock, 0));
    }

    @Test
    @DisplayName("Should forget records and elapsed bookkeeping on clear")
    void testClear() {
        eventLog.append("t", "extract", "start");
        clock.advance(Duration.ofSeconds(2));
        eventLog.clear();
        assertEquals(0, eventLog.size());
        assertEquals(0.0, eventLog.append("t", "extract", "finish").getElapsed());
    }

    // ============================================================================
    // Concurrency
    // ============================================================================

    /** Appends {@code perWriter} events per writer while a reader keeps polling; returns the reader's poll count. */
    private static int appendConcurrently(EventLog log, int writers, int perWriter) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean writing = new AtomicBoolean(true);
        try {
            List<Future<?>> writerFutures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                String target = "writer-" + w;
                writerFutures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                        log.append(target, "copy", Integer.toString(i));
                    }
                    return null;
                }));
            }
            Future<Integer> reader = pool.submit(() -> {
                start.await();
                int polls = 0;
                do {
                    assertConsistent(log.recent(200));
                    polls++;
                } while (writing.get());
                return polls;
            });
            start.countDown();
            for (Future<?> future : writerFutures) {
                future.get(30, TimeUnit.SECONDS);
            }
            writing.set(false);
            return reader.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    /** Whole records, timestamps non-decreasing, and each writer's events in the order it appended them. */
    private static void assertConsistent(List<EventRecord> records) {
        Instant previous = Instant.MIN;
        Map<String, Integer> lastSequence = new HashMap<>();
        for (EventRecord record : records) {
            assertNotNull(record);
            assertNotNull(record.getTarget());
            assertEquals("copy", record.getStep());
            assertNotNull(record.getTimestamp());
            assertFalse(record.getTimestamp().isBefore(previous), "timestamps must not decrease");
            assertTrue(record.getElapsed() >= 0.0);
            int sequence = Integer.parseInt(record.getEvent());
            Integer last = lastSequence.put(record.getTarget(), sequence);
            if (last != null) {
                assertEquals(last + 1, sequence, "events of " + record.getTarget() + " out of order");
            }
            previous = record.getTimestamp();
        }
    }

    @Test
    @DisplayName("Should keep every event of concurrent writers while a reader polls")
    void testConcurrentAppends_NoLoss() throws Exception {
        EventLog log = new EventLog(Clock.systemUTC(), 10_000);

        int polls = appendConcurrently(log, 4, 500);

        assertTrue(polls > 0);
        assertEquals(2000, log.size());
        List<EventRecord> all = log.recent(10_000);
        assertEquals(2000, all.size());
        assertConsistent(all);
        for (int w = 0; w < 4; w++) {
            String target = "writer-" + w;
            assertEquals(500, all.stream().filter(r -> r.getTarget().equals(target)).count());
        }
    }

    @Test
    @DisplayName("Should retain exactly the newest records when concurrent writers overflow capacity")
    void testConcurrentAppends_Overflow() throws Exception {
        EventLog log = new EventLog(Clock.systemUTC(), 100);

        appendConcurrently(log, 4, 500);

        assertEquals(100, log.size());
        List<EventRecord> retained = log.recent(1000);
        assertEquals(100, retained.size());
        assertConsistent(retained);
    }
}
