package com.di.etlcontrol.monitor;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.time.Instant;

/**
 * One lifecycle transition of a pipeline target, e.g. {@code (public.orders, extract, finish)}.
 * {@code elapsed} is the number of seconds since the previous event of the same target and step.
 */
@Value
@JsonPropertyOrder({"target", "step", "event", "timestamp", "elapsed"})
public class EventRecord {

    String target;
    String step;
    String event;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;

    double elapsed;
}
