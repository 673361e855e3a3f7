package com.exhibition.ledger.metrics;

import java.time.Duration;

/**
 * Records fusion and synchronization metrics.
 * {@link NoOpMetricsService} is the default, so nothing needs a metrics backend.
 */
public interface MetricsService {

    void recordFusionDuration(String mode, Duration duration);

    void recordFusionRows(int rowsIn, int rowsOut);

    void incrementMergedGroups(int groups);

    void incrementReconciledColumns(String pass, int columns);

    void incrementAppendedRows(int rows);

    /**
     * @param outcome {@code success} or the failure kind
     */
    void incrementSyncOutcome(String outcome);
}
