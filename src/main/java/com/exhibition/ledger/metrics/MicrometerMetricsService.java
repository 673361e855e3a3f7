package com.exhibition.ledger.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code ledger.fusion.duration} (Timer, tag mode)</li>
 *   <li>{@code ledger.fusion.rows.in} and {@code ledger.fusion.rows.out} (DistributionSummary)</li>
 *   <li>{@code ledger.merge.groups} (Counter)</li>
 *   <li>{@code ledger.reconcile.columns} (Counter, tag pass)</li>
 *   <li>{@code ledger.sync.rows.appended} (Counter)</li>
 *   <li>{@code ledger.sync.outcome} (Counter, tag outcome)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary rowsInSummary;
    private final DistributionSummary rowsOutSummary;
    private final Counter mergedGroupsCounter;
    private final Counter appendedRowsCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.rowsInSummary = DistributionSummary.builder("ledger.fusion.rows.in")
                .description("Raw rows entering a fusion run")
                .register(registry);
        this.rowsOutSummary = DistributionSummary.builder("ledger.fusion.rows.out")
                .description("Rows in the fused output table")
                .register(registry);
        this.mergedGroupsCounter = Counter.builder("ledger.merge.groups")
                .description("Entities built from more than one raw row")
                .register(registry);
        this.appendedRowsCounter = Counter.builder("ledger.sync.rows.appended")
                .description("Rows appended to the remote sheet")
                .register(registry);
    }

    @Override
    public void recordFusionDuration(String mode, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(mode, k ->
                Timer.builder("ledger.fusion.duration")
                        .description("Duration of fusion runs")
                        .tag("mode", mode)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordFusionRows(int rowsIn, int rowsOut) {
        rowsInSummary.record(rowsIn);
        rowsOutSummary.record(rowsOut);
    }

    @Override
    public void incrementMergedGroups(int groups) {
        mergedGroupsCounter.increment(groups);
    }

    @Override
    public void incrementReconciledColumns(String pass, int columns) {
        counter("reconcile:" + pass, "ledger.reconcile.columns", "Columns removed by reconciliation",
                "pass", pass).increment(columns);
    }

    @Override
    public void incrementAppendedRows(int rows) {
        appendedRowsCounter.increment(rows);
    }

    @Override
    public void incrementSyncOutcome(String outcome) {
        counter("sync:" + outcome, "ledger.sync.outcome", "Synchronization calls by outcome",
                "outcome", outcome).increment();
    }

    private Counter counter(String key, String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
