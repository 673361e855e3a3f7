package com.exhibition.ledger.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}, used by the pipeline and synchronizer
 * when no meter registry is supplied.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordFusionDuration(String mode, Duration duration) {
    }

    @Override
    public void recordFusionRows(int rowsIn, int rowsOut) {
    }

    @Override
    public void incrementMergedGroups(int groups) {
    }

    @Override
    public void incrementReconciledColumns(String pass, int columns) {
    }

    @Override
    public void incrementAppendedRows(int rows) {
    }

    @Override
    public void incrementSyncOutcome(String outcome) {
    }
}
