package com.mailrag.ingest;

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mailrag.runtime.AppConfig;

public class ContinuousIngestionLoop {
    private static final Logger log = LoggerFactory.getLogger(ContinuousIngestionLoop.class);
    private static final long MAX_SLEEP_SLICE_MS = 1000L;

    private final IngestionPipeline pipeline;
    private final AppConfig.ContinuousModeConfig config;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public ContinuousIngestionLoop(IngestionPipeline pipeline, AppConfig.ContinuousModeConfig config) {
        if (config.getIngestIntervalMs() < 0 || config.getMaxCycles() < 0 || config.getMaxRuntimeMs() < 0) {
            throw new IllegalArgumentException("continuous settings must be >= 0");
        }
        this.pipeline = pipeline;
        this.config = config;
    }

    public void requestStop() {
        stopRequested.set(true);
        pipeline.requestStop();
    }

    public LoopSummary runLoop() throws InterruptedException {
        long processStart = System.currentTimeMillis();
        long cycles = 0;
        long successful = 0;
        long failed = 0;
        IngestionReport lastReport = null;

        while (!stopRequested.get()) {
            if (shouldStop(cycles, processStart, System.currentTimeMillis())) {
                break;
            }
            cycles++;
            try {
                lastReport = pipeline.run();
                successful++;
                log.info("continuous.cycle.done cycle={} stored={} failed={} cancelled={}",
                        cycles, lastReport.stored(), lastReport.failed(), lastReport.cancelled());
            } catch (FetchException | RuntimeException e) {
                failed++;
                log.error("continuous.cycle.failed cycle={} reason={}", cycles, e.getMessage(), e);
            }

            if (stopRequested.get() || shouldStop(cycles, processStart, System.currentTimeMillis())) {
                break;
            }
            sleepUntilNextCycle();
        }

        String reason = stopRequested.get() ? "stopped" : "completed";
        log.info("continuous.exit reason={} cycles={} successful={} failed={}", reason, cycles, successful, failed);
        return new LoopSummary(cycles, successful, failed, lastReport);
    }

    private boolean shouldStop(long cycles, long processStart, long now) {
        if (config.getMaxCycles() > 0 && cycles >= config.getMaxCycles()) {
            log.info("continuous.stop reason=max-cycles cycles={}", cycles);
            return true;
        }
        if (config.getMaxRuntimeMs() > 0 && (now - processStart) >= config.getMaxRuntimeMs()) {
            log.info("continuous.stop reason=max-runtime runtimeMs={}", now - processStart);
            return true;
        }
        return false;
    }

    private void sleepUntilNextCycle() throws InterruptedException {
        long remaining = config.getIngestIntervalMs();
        while (remaining > 0 && !stopRequested.get()) {
            long slice = Math.min(remaining, MAX_SLEEP_SLICE_MS);
            Thread.sleep(slice);
            remaining -= slice;
        }
    }

    public record LoopSummary(long cycles, long successfulCycles, long failedCycles, IngestionReport lastReport) {
    }
}
