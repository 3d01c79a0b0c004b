package com.momentumquant.rebalancer.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for tracking engine run metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class EngineMetricsService {

    private final Counter backtestsCompletedCounter;
    private final Counter backtestsFailedCounter;
    private final Counter rebalancesSkippedCounter;
    private final Counter candidatesEvaluatedCounter;
    private final Timer executionTimer;

    public EngineMetricsService(MeterRegistry meterRegistry) {
        this.backtestsCompletedCounter = Counter.builder("momentum.backtests.completed")
                .description("Total number of simulator runs completed")
                .register(meterRegistry);

        this.backtestsFailedCounter = Counter.builder("momentum.backtests.failed")
                .description("Total number of simulator runs aborted")
                .register(meterRegistry);

        this.rebalancesSkippedCounter = Counter.builder("momentum.rebalances.skipped")
                .description("Total number of scheduled rebalance dates skipped")
                .register(meterRegistry);

        this.candidatesEvaluatedCounter = Counter.builder("momentum.optimizer.candidates")
                .description("Total number of weight candidates evaluated by the optimizer")
                .register(meterRegistry);

        this.executionTimer = Timer.builder("momentum.backtest.execution.time")
                .description("Simulator run execution time")
                .register(meterRegistry);

        log.info("EngineMetricsService initialized with Micrometer metrics");
    }

    /**
     * Record a completed run with its execution time and skipped rebalance dates.
     */
    public void recordBacktestCompleted(long executionTimeMs, long skippedRebalances) {
        backtestsCompletedCounter.increment();
        rebalancesSkippedCounter.increment(skippedRebalances);
        executionTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordBacktestFailed() {
        backtestsFailedCounter.increment();
    }

    public void recordCandidateEvaluated() {
        candidatesEvaluatedCounter.increment();
    }

    /**
     * Get current metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Completed=%d, Failed=%d, SkippedRebalances=%d, Candidates=%d, AvgExecTime=%.2fs",
                (long) backtestsCompletedCounter.count(),
                (long) backtestsFailedCounter.count(),
                (long) rebalancesSkippedCounter.count(),
                (long) candidatesEvaluatedCounter.count(),
                executionTimer.mean(TimeUnit.SECONDS));
    }
}
