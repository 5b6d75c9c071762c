package com.shortspilot.orchestrator.stage;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs stage executors with uniform failure classification and metrics.
 *
 * Every call is timed and counted:
 * <pre>
 *   shortspilot.stage.calls{stage, status="success|transient|permanent"}
 *   shortspilot.stage.duration{stage}
 * </pre>
 *
 * Anything an executor throws that is not a {@link StageException}, and a
 * null result, is reported as a TRANSIENT failure so the item gets retried
 * on a later invocation instead of crashing the run.
 */
public class StageInvoker {

    private static final Logger log = LoggerFactory.getLogger(StageInvoker.class);

    private final MeterRegistry meterRegistry;

    public StageInvoker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public <I, O> O invoke(StageExecutor<I, O> executor, I input) {
        String stageTag = executor.stage().name().toLowerCase();

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            O result = executor.execute(input);
            if (result == null) {
                throw new StageException(StageException.Kind.TRANSIENT,
                        executor.stage() + " returned no result");
            }
            return result;
        } catch (StageException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (RuntimeException e) {
            status = "transient";
            log.warn("Unexpected error in {} stage: {}", executor.stage(), e.getMessage(), e);
            throw new StageException(StageException.Kind.TRANSIENT,
                    "Unexpected error in " + executor.stage() + ": " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("shortspilot.stage.duration", "stage", stageTag));
            meterRegistry.counter("shortspilot.stage.calls",
                    "stage", stageTag, "status", status).increment();
        }
    }
}
