package com.di.etlcontrol.monitor;

import com.di.etlcontrol.retry.EtlStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Brackets a unit of stage work for one target with events: {@code start} before, then
 * {@code finish} on success or {@code fail} on error. Failures are rethrown unchanged.
 */
@Slf4j
@RequiredArgsConstructor
public class StageMonitor {

    public static final String START = "start";
    public static final String FINISH = "finish";
    public static final String FAIL = "fail";

    private final EventLog eventLog;

    public <T> T monitor(String target, EtlStage stage, Supplier<T> work) {
        return monitor(target, stage.getStepName(), work);
    }

    public void monitor(String target, EtlStage stage, Runnable work) {
        monitor(target, stage.getStepName(), () -> {
            work.run();
            return null;
        });
    }

    public <T> T monitor(String target, String step, Supplier<T> work) {
        eventLog.append(target, step, START);
        T result;
        try {
            result = work.get();
        } catch (RuntimeException | Error e) {
            EventRecord failed = eventLog.append(target, step, FAIL);
            log.warn("[MONITOR] {} of {} failed after {}s: {}", step, target, failed.getElapsed(), e.toString());
            throw e;
        }
        EventRecord finished = eventLog.append(target, step, FINISH);
        log.info("[MONITOR] {} of {} finished in {}s", step, target, finished.getElapsed());
        return result;
    }
}
