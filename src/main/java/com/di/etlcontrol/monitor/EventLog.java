package com.di.etlcontrol.monitor;

import com.di.etlcontrol.util.InputValidator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Append-only log of pipeline events, most recent last.
 *
 * <p>Appends are serialized (they compute the elapsed time against the previous event of the same
 * target and step, and keep timestamps non-decreasing). Reads walk a lock-free deque of immutable
 * records and never block an append. Only the newest {@code capacity} records are retained; the
 * elapsed-time bookkeeping is kept for evicted records as well.
 */
public class EventLog {

    public static final int DEFAULT_CAPACITY = 1000;

    private final Clock clock;
    private final int capacity;
    private final ConcurrentLinkedDeque<EventRecord> records = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();

    // guarded by "this"
    private final Map<List<String>, Instant> lastEventByTargetStep = new HashMap<>();
    private Instant lastTimestamp;

    public EventLog(Clock clock) {
        this(clock, DEFAULT_CAPACITY);
    }

    public EventLog(Clock clock, int capacity) {
        if (clock == null) {
            throw new IllegalArgumentException("Clock is required");
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("Event log capacity must be positive: " + capacity);
        }
        this.clock = clock;
        this.capacity = capacity;
    }

    /**
     * Records an event at the current time.
     *
     * @throws IllegalArgumentException if target, step or event is blank; nothing is recorded then
     */
    public EventRecord append(String target, String step, String event) {
        String validTarget = InputValidator.validateMonitorName(target, "Target");
        String validStep = InputValidator.validateMonitorName(step, "Step");
        String validEvent = InputValidator.validateMonitorName(event, "Event");

        EventRecord record;
        synchronized (this) {
            Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
            if (lastTimestamp != null && now.isBefore(lastTimestamp)) {
                now = lastTimestamp;
            }
            List<String> key = List.of(validTarget, validStep);
            Instant previous = lastEventByTargetStep.put(key, now);
            double elapsed = previous != null ? Duration.between(previous, now).toMillis() / 1000.0 : 0.0;
            record = new EventRecord(validTarget, validStep, validEvent, now, elapsed);
            lastTimestamp = now;
            records.addLast(record);
            if (size.incrementAndGet() > capacity) {
                records.pollFirst();
                size.decrementAndGet();
            }
        }
        return record;
    }

    /**
     * The newest {@code limit} records in append order (oldest first).
     *
     * @throws IllegalArgumentException if limit is negative
     */
    public List<EventRecord> recent(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Limit must not be negative: " + limit);
        }
        List<EventRecord> newestFirst = new ArrayList<>(Math.min(limit, capacity));
        Iterator<EventRecord> it = records.descendingIterator();
        while (it.hasNext() && newestFirst.size() < limit) {
            newestFirst.add(it.next());
        }
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    /** Number of retained records. */
    public int size() {
        return Math.min(size.get(), capacity);
    }

    public int getCapacity() {
        return capacity;
    }

    public synchronized void clear() {
        records.clear();
        size.set(0);
        lastEventByTargetStep.clear();
        lastTimestamp = null;
    }
}
