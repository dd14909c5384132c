package com.di.etlcontrol.monitor;

import lombok.Getter;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * In-memory state of one pipeline run: its identifier, the progress counters and the event log.
 *
 * <p>Owned explicitly by whoever starts the run (a Spring bean in the service, a local object in
 * tests), so two runs never share counters. The state lives as long as the object; nothing is
 * persisted.
 */
@Getter
public class EtlRun {

    private static final DateTimeFormatter RUN_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);

    private final String etlId;
    private final Instant startedAt;
    private final ProgressTracker progressTracker;
    private final EventLog eventLog;

    public EtlRun(String etlId, Instant startedAt, ProgressTracker progressTracker, EventLog eventLog) {
        if (etlId == null || etlId.isBlank()) {
            throw new IllegalArgumentException("Run identifier is required");
        }
        this.etlId = etlId;
        this.startedAt = startedAt;
        this.progressTracker = progressTracker;
        this.eventLog = eventLog;
    }

    /** Starts a new run with a fresh identifier like {@code 20261017T093000-1a2b3c4d}. */
    public static EtlRun start(Clock clock, int eventCapacity) {
        Instant now = clock.instant();
        String etlId = RUN_ID_FORMAT.format(now) + "-" + UUID.randomUUID().toString().substring(0, 8);
        return new EtlRun(etlId, now, new ProgressTracker(), new EventLog(clock, eventCapacity));
    }
}
