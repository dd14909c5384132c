package com.di.etlcontrol.monitor;

import com.di.etlcontrol.util.InputValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Current/final counters per relation, written by the pipeline workers and read by the polling API.
 *
 * <p>Each relation's counter is an immutable value replaced atomically through
 * {@link ConcurrentHashMap#compute}, so concurrent writers to the same relation never lose an
 * increment and readers never see a half-written counter. Reads do not lock.
 *
 * <p>A relation that has never been reported is absent from {@link #snapshot()}; the dashboard
 * shows it as waiting.
 */
@Slf4j
public class ProgressTracker {

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    /**
     * Sets the total for a relation. If the relation already counted past the new total, the
     * current count is lowered to it.
     *
     * @throws IllegalArgumentException if the name is blank or the total is negative
     */
    public ProgressIndex setFinal(String name, long finalIndex) {
        String relation = InputValidator.validateMonitorName(name, "Relation name");
        if (finalIndex < 0) {
            throw new IllegalArgumentException("Final index for " + relation + " must not be negative: " + finalIndex);
        }
        Counter updated = counters.compute(relation, (key, existing) -> {
            if (existing == null) {
                return new Counter(0, finalIndex, true);
            }
            if (existing.current > finalIndex) {
                log.warn("[MONITOR] Final index {} for {} is below current index {}; clamping",
                        finalIndex, key, existing.current);
            }
            return new Counter(Math.min(existing.current, finalIndex), finalIndex, true);
        });
        return updated.toIndex(relation);
    }

    public ProgressIndex advance(String name) {
        return advance(name, 1);
    }

    /**
     * Adds {@code delta} units to a relation. Before a total is known the count grows freely;
     * afterwards it stops at the total.
     *
     * @throws IllegalArgumentException if the name is blank or delta is negative
     */
    public ProgressIndex advance(String name, long delta) {
        String relation = InputValidator.validateMonitorName(name, "Relation name");
        if (delta < 0) {
            throw new IllegalArgumentException("Progress of " + relation + " cannot move backwards: " + delta);
        }
        Counter updated = counters.compute(relation, (key, existing) -> {
            if (existing == null) {
                return new Counter(delta, 0, false);
            }
            long next = existing.current + Math.min(delta, Long.MAX_VALUE - existing.current);
            if (existing.finalKnown) {
                next = Math.min(next, existing.finalIndex);
            }
            return new Counter(next, existing.finalIndex, existing.finalKnown);
        });
        return updated.toIndex(relation);
    }

    public Optional<ProgressIndex> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Counter counter = counters.get(name.trim());
        return counter != null ? Optional.of(counter.toIndex(name.trim())) : Optional.empty();
    }

    /** All tracked relations ordered by name; empty while nothing has been reported. */
    public List<ProgressIndex> snapshot() {
        return counters.entrySet().stream()
                .map(e -> e.getValue().toIndex(e.getKey()))
                .sorted(Comparator.comparing(ProgressIndex::getName))
                .collect(Collectors.toList());
    }

    /** True once at least one relation is tracked and every tracked relation is complete. */
    public boolean allComplete() {
        List<ProgressIndex> indices = snapshot();
        return !indices.isEmpty() && indices.stream().allMatch(ProgressIndex::isComplete);
    }

    public void clear() {
        counters.clear();
    }

    private static final class Counter {
        private final long current;
        private final long finalIndex;
        private final boolean finalKnown;

        private Counter(long current, long finalIndex, boolean finalKnown) {
            this.current = current;
            this.finalIndex = finalIndex;
            this.finalKnown = finalKnown;
        }

        private ProgressIndex toIndex(String name) {
            return new ProgressIndex(name, current, finalIndex);
        }
    }
}
