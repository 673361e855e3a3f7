package com.exhibition.ledger.cli;

import com.exhibition.ledger.bulk.ExcelTableWriter;
import com.exhibition.ledger.config.LedgerConfig;
import com.exhibition.ledger.metrics.MetricsService;
import com.exhibition.ledger.metrics.MicrometerMetricsService;
import com.exhibition.ledger.pipeline.FusionException;
import com.exhibition.ledger.pipeline.FusionResult;
import com.exhibition.ledger.pipeline.SourceFusionPipeline;
import com.exhibition.ledger.sheets.GoogleSheetsClient;
import com.exhibition.ledger.sheets.SheetClient;
import com.exhibition.ledger.sheets.SheetSynchronizer;
import com.exhibition.ledger.sheets.SyncResult;
import com.exhibition.ledger.sheets.SyncTarget;
import com.exhibition.ledger.tracing.OpenTelemetryTracingService;
import com.exhibition.ledger.tracing.TracingService;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Batch entry point: fuse the session's inputs, write the workbook, then optionally
 * append it to the configured sheet.
 *
 * <p>Exit codes: {@value #EXIT_OK} on success, {@value #EXIT_FUSION_FAILED} when no usable
 * source exists, the configuration is invalid or the workbook cannot be written,
 * {@value #EXIT_SYNC_FAILED} when synchronization fails.</p>
 */
public class LedgerApplication {
    private static final Logger log = LoggerFactory.getLogger(LedgerApplication.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FUSION_FAILED = 1;
    public static final int EXIT_SYNC_FAILED = 2;

    private final LedgerConfig config;
    private final SheetClient sheetClient;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public LedgerApplication(LedgerConfig config) {
        this(config,
                GoogleSheetsClient.builder()
                        .baseUrl(config.getSheetsBaseUrl())
                        .accessToken(config::getAccessToken)
                        .timeout(config.getTimeout())
                        .build(),
                new MicrometerMetricsService(Metrics.globalRegistry),
                new OpenTelemetryTracingService());
    }

    public LedgerApplication(LedgerConfig config, SheetClient sheetClient,
                             MetricsService metricsService, TracingService tracingService) {
        this.config = config;
        this.sheetClient = sheetClient;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    public static void main(String[] args) {
        System.exit(launch(LedgerConfig::load));
    }

    /**
     * Loads the configuration and runs. An invalid configuration exits with
     * {@value #EXIT_FUSION_FAILED} before any input is read.
     */
    static int launch(Supplier<LedgerConfig> configLoader) {
        LedgerConfig config;
        try {
            config = configLoader.get();
        } catch (IllegalArgumentException e) {
            log.error("app.configInvalid error=\"{}\"", e.getMessage());
            return EXIT_FUSION_FAILED;
        }
        return new LedgerApplication(config).run();
    }

    public int run() {
        FusionResult fused;
        try {
            SourceFusionPipeline pipeline = new SourceFusionPipeline(config.toFusionOptions(), metricsService,
                    event -> log.info("fusion.progress stage={} processed={} total={} message=\"{}\"",
                            event.stage(), event.processed(), event.total(), event.message()));
            fused = pipeline.run(config.toFusionInputs());
        } catch (FusionException e) {
            log.error("app.fusionFailed kind={} error={}", e.getKind(), e.getMessage());
            return EXIT_FUSION_FAILED;
        }
        fused.report().warnings().forEach(w -> log.warn("app.warning {}", w));

        Path output = config.outputWorkbook();
        try {
            new ExcelTableWriter().write(fused.table(), output);
        } catch (IOException e) {
            log.error("app.writeFailed path={} error={}", output, e.getMessage(), e);
            return EXIT_FUSION_FAILED;
        }

        Optional<SyncTarget> target = config.toSyncTarget();
        if (target.isEmpty()) {
            log.info("app.completed output={} rows={} sync=disabled", output, fused.table().rowCount());
            return EXIT_OK;
        }

        SheetSynchronizer synchronizer = new SheetSynchronizer(sheetClient, config.toSyncOptions(),
                metricsService, tracingService);
        SyncResult synced = synchronizer.synchronize(fused.table(), target.get());
        if (synced.isFailure()) {
            log.error("app.syncFailed kind={} reason=\"{}\"", synced.errorKind(), synced.reason());
            return EXIT_SYNC_FAILED;
        }
        log.info("app.completed output={} rows={} appended={} totalRows={}",
                output, fused.table().rowCount(), synced.appendedRows(), synced.totalRows());
        return EXIT_OK;
    }
}
