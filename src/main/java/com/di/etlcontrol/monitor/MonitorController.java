package com.di.etlcontrol.monitor;

import com.di.etlcontrol.monitor.dto.AdvanceRequest;
import com.di.etlcontrol.monitor.dto.AppendEventRequest;
import com.di.etlcontrol.monitor.dto.EtlIdResponse;
import com.di.etlcontrol.monitor.dto.SetFinalRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Polling API for the run dashboard, plus the write side used by stage executors running in
 * other processes.
 *
 * <table border="1">
 * <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 * <tr><td>GET</td><td>/api/etl-id</td><td>Identifier of the current run</td></tr>
 * <tr><td>GET</td><td>/api/indices</td><td>Progress per relation; empty while waiting</td></tr>
 * <tr><td>GET</td><td>/api/events?limit=n</td><td>Most recent events, oldest first</td></tr>
 * <tr><td>PUT</td><td>/api/indices/{name}</td><td>Set the final index of a relation</td></tr>
 * <tr><td>POST</td><td>/api/indices/{name}/advance</td><td>Advance a relation (default by 1)</td></tr>
 * <tr><td>POST</td><td>/api/events</td><td>Append an event</td></tr>
 * </table>
 *
 * <p>The dashboard re-polls indices until every relation is complete and events indefinitely.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class MonitorController {

    private final EtlRun etlRun;
    private final MonitorProperties monitorProperties;

    @GetMapping("/etl-id")
    public EtlIdResponse getEtlId() {
        return new EtlIdResponse(etlRun.getEtlId());
    }

    @GetMapping("/indices")
    public List<ProgressIndex> getIndices() {
        return etlRun.getProgressTracker().snapshot();
    }

    @GetMapping("/events")
    public List<EventRecord> getEvents(@RequestParam(required = false) Integer limit) {
        int effective = limit != null ? limit : monitorProperties.getDefaultEventLimit();
        return etlRun.getEventLog().recent(effective);
    }

    @PutMapping("/indices/{name}")
    public ProgressIndex setFinal(@PathVariable String name, @Valid @RequestBody SetFinalRequest request) {
        ProgressIndex index = etlRun.getProgressTracker().setFinal(name, request.getFinalIndex());
        log.debug("[MONITOR] {} final index set to {}", index.getName(), index.getFinalIndex());
        return index;
    }

    @PostMapping("/indices/{name}/advance")
    public ProgressIndex advance(@PathVariable String name,
                                 @Valid @RequestBody(required = false) AdvanceRequest request) {
        long delta = (request != null && request.getDelta() != null) ? request.getDelta() : 1L;
        ProgressIndex index = etlRun.getProgressTracker().advance(name, delta);
        if (index.isComplete()) {
            log.info("[MONITOR] {} complete ({}/{})", index.getName(), index.getCurrent(), index.getFinalIndex());
        }
        return index;
    }

    @PostMapping("/events")
    public ResponseEntity<EventRecord> appendEvent(@Valid @RequestBody AppendEventRequest request) {
        EventRecord record = etlRun.getEventLog().append(request.getTarget(), request.getStep(), request.getEvent());
        return ResponseEntity.status(HttpStatus.CREATED).body(record);
    }
}
