package com.di.etlcontrol.monitor;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Monitoring settings.
 *
 * <pre>
 * etl:
 *   monitor:
 *     event-capacity: 1000
 *     default-event-limit: 100
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "etl.monitor")
public class MonitorProperties {

    /** Number of events retained in memory; older events are dropped. */
    private int eventCapacity = EventLog.DEFAULT_CAPACITY;

    /** Events returned by GET /api/events when no limit is given. */
    private int defaultEventLimit = 100;
}
