package com.exhibition.ledger.pipeline;

import com.exhibition.ledger.bulk.CsvTableReader;
import com.exhibition.ledger.bulk.ExcelTableReader;
import com.exhibition.ledger.bulk.OcrQrJsonReader;
import com.exhibition.ledger.bulk.ReadResult;
import com.exhibition.ledger.bulk.RecordReader;
import com.exhibition.ledger.bulk.ScrapeJsonReader;
import com.exhibition.ledger.core.model.Table;
import com.exhibition.ledger.identity.IdentityKeyResolver;
import com.exhibition.ledger.logging.LogContext;
import com.exhibition.ledger.merge.MergeResult;
import com.exhibition.ledger.merge.RecordMerger;
import com.exhibition.ledger.metrics.MetricsService;
import com.exhibition.ledger.metrics.NoOpMetricsService;
import com.exhibition.ledger.reconcile.ColumnReconciler;
import com.exhibition.ledger.reconcile.ReconciliationResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns one batch of raw extractor output into a single fused table.
 *
 * <p>Stages:</p>
 * <ol>
 *   <li>ingest: OCR/QR mode reads the document JSON and links scraped sites to their
 *       documents; Excel mode reads one operator workbook; combined mode does both and
 *       appends the workbook rows to the documents</li>
 *   <li>assign {@code CompanyID}: per document for OCR/QR rows, per row for workbook rows</li>
 *   <li>reconcile column variants with {@link ColumnReconciler}</li>
 *   <li>fold rows sharing a {@code CompanyID} with {@link RecordMerger}</li>
 * </ol>
 *
 * <p>Only the absence of any usable primary source is fatal ({@link FusionException}).
 * A primary source that exists but yields nothing, while the other one does, and an
 * unavailable scrape file are recorded as warnings in the {@link FusionReport}.</p>
 */
public class SourceFusionPipeline {
    private static final Logger log = LoggerFactory.getLogger(SourceFusionPipeline.class);

    private final FusionOptions options;
    private final MetricsService metricsService;
    private final PipelineEventListener listener;
    private final IdentityKeyResolver resolver;
    private final ColumnReconciler reconciler;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SourceFusionPipeline() {
        this(FusionOptions.defaults());
    }

    public SourceFusionPipeline(FusionOptions options) {
        this(options, new NoOpMetricsService(), PipelineEventListener.NOOP);
    }

    public SourceFusionPipeline(FusionOptions options, MetricsService metricsService,
                                PipelineEventListener listener) {
        this.options = options;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.listener = listener != null ? listener : PipelineEventListener.NOOP;
        this.resolver = new IdentityKeyResolver(options.getIdentityFields());
        this.reconciler = new ColumnReconciler();
    }

    /**
     * Runs the pipeline over the given inputs.
     *
     * @throws FusionException when no primary source exists or none yields a usable record
     */
    public FusionResult run(FusionInputs inputs) {
        long start = System.nanoTime();
        FusionMode planned = inputs.detectMode().orElseThrow(() -> {
            log.error("fusion.failed kind={} ocrQrJson={} workbook={}",
                    FusionErrorKind.MISSING_SOURCE_FILE, inputs.ocrQrJson(), inputs.workbook());
            return new FusionException(FusionErrorKind.MISSING_SOURCE_FILE,
                    "No primary source found: expected " + inputs.ocrQrJson() + " or " + inputs.workbook());
        });

        try (LogContext ctx = LogContext.forFusion(LogContext.generateRunId(), planned.name())) {
            log.info("fusion.started mode={}", planned);
            FusionReport.Accumulator report = FusionReport.accumulate(planned);

            PrimarySource documents = FusionInputs.exists(inputs.ocrQrJson())
                    ? readPrimary(new OcrQrJsonReader(objectMapper), inputs.ocrQrJson())
                    : PrimarySource.ABSENT;
            PrimarySource workbook = FusionInputs.exists(inputs.workbook())
                    ? readPrimary(workbookReader(inputs.workbook()), inputs.workbook())
                    : PrimarySource.ABSENT;
            FusionMode mode = resolveMode(planned, documents, workbook, report);
            if (mode != planned) {
                ctx.with("fusionMode", mode.name());
            }
            report.mode(mode);

            Table table;
            if (mode == FusionMode.EXCEL) {
                table = ingestWorkbook(workbook.rows(), report);
            } else {
                table = ingestDocuments(documents.rows(), inputs.scrapeJson(), report);
                if (mode == FusionMode.COMBINED) {
                    table.appendAll(ingestWorkbook(workbook.rows(), report));
                }
            }
            int inputRows = table.rowCount();

            if (options.isReconcileColumns()) {
                ReconciliationResult reconciled = reconciler.reconcile(table);
                table = reconciled.table();
                report.removedColumns(reconciled.removedColumnsByPass());
                reconciled.removedColumnsByPass().forEach(metricsService::incrementReconciledColumns);
                emit(PipelineEvent.Stage.RECONCILE, "Reconciled columns",
                        reconciled.removedColumnCount(), -1);
            }

            if (options.isMergeRows()) {
                MergeResult merged = new RecordMerger(resolver, options.getRepeatThreshold()).merge(table);
                table = merged.table();
                report.mergedGroups(merged.mergedGroups());
                metricsService.incrementMergedGroups(merged.mergedGroups());
                emit(PipelineEvent.Stage.MERGE, "Merged rows", merged.outputRows(), inputRows);
            }
            table.moveColumn(Table.COMPANY_ID, 0);

            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            FusionReport result = report.build(table.rowCount(), table.columnCount(), duration);
            metricsService.recordFusionDuration(mode.name(), duration);
            metricsService.recordFusionRows(inputRows, table.rowCount());
            emit(PipelineEvent.Stage.COMPLETE, "Fusion completed", table.rowCount(), table.rowCount());
            log.info("fusion.completed mode={} inputRows={} outputRows={} columns={} warnings={} durationMs={}",
                    mode, inputRows, table.rowCount(), table.columnCount(),
                    result.warnings().size(), duration.toMillis());
            return new FusionResult(table, result);
        }
    }

    /**
     * Picks the mode from the sources that actually yielded records. A source that exists but is
     * unusable is a warning while another one still is; with none usable the run fails.
     */
    private FusionMode resolveMode(FusionMode planned, PrimarySource documents, PrimarySource workbook,
                                   FusionReport.Accumulator report) {
        if (documents.isUsable() && workbook.isUsable()) {
            return FusionMode.COMBINED;
        }
        if (documents.isUsable() || workbook.isUsable()) {
            for (PrimarySource unusable : List.of(documents, workbook)) {
                if (unusable.failure() != null) {
                    log.warn("fusion.fallback planned={} reason=\"{}\"", planned, unusable.failure().getMessage());
                    report.warn("Primary source skipped: " + unusable.failure().getMessage());
                }
            }
            return documents.isUsable() ? FusionMode.OCR_QR : FusionMode.EXCEL;
        }

        FusionException failure = documents.failure() != null ? documents.failure() : workbook.failure();
        if (documents.failure() != null && workbook.failure() != null) {
            failure.addSuppressed(workbook.failure());
        }
        log.error("fusion.failed kind={} planned={} error={}", failure.getKind(), planned, failure.getMessage());
        throw failure;
    }

    private Table ingestDocuments(ReadResult documents, Path scrapeJson, FusionReport.Accumulator report) {
        report.primaryRows(documents.size()).warnAll(documents.warnings());
        Table table = Table.fromRecords(documents.records());
        emit(PipelineEvent.Stage.INGEST, "Read document pages", documents.size(), documents.size());

        ReadResult scraped = readScrape(scrapeJson, report);
        if (!scraped.isEmpty()) {
            ScrapeLinker.LinkResult linked = new ScrapeLinker(options.getUnmatchedScrapePolicy())
                    .link(table, scraped.records());
            report.scrapeRows(scraped.size()).unmatchedScrapeRows(linked.unmatched());
            for (Map<String, String> row : linked.rows()) {
                table.addRow(row);
            }
            emit(PipelineEvent.Stage.LINK, "Linked scraped sites",
                    scraped.size() - linked.unmatched(), scraped.size());
        }

        new CompanyIdAssigner(resolver).assignPerDocument(table);
        emit(PipelineEvent.Stage.ASSIGN_IDS, "Assigned company IDs", table.rowCount(), table.rowCount());
        return table;
    }

    private Table ingestWorkbook(ReadResult rows, FusionReport.Accumulator report) {
        report.addPrimaryRows(rows.size()).warnAll(rows.warnings());
        Table table = Table.fromRecords(rows.records());
        emit(PipelineEvent.Stage.INGEST, "Read workbook rows", rows.size(), rows.size());

        new CompanyIdAssigner(resolver).assignPerRow(table);
        emit(PipelineEvent.Stage.ASSIGN_IDS, "Assigned company IDs", table.rowCount(), table.rowCount());
        return table;
    }

    private static RecordReader workbookReader(Path workbook) {
        return workbook.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv")
                ? new CsvTableReader() : new ExcelTableReader();
    }

    private PrimarySource readPrimary(RecordReader reader, Path path) {
        ReadResult result;
        try {
            result = reader.read(path);
        } catch (IOException e) {
            log.warn("fusion.sourceUnusable path={} error={}", path, e.getMessage());
            return PrimarySource.failed(new FusionException(FusionErrorKind.EMPTY_SOURCE_DATASET,
                    "Unreadable source " + path + ": " + e.getMessage(), e));
        }
        if (result.isEmpty()) {
            log.warn("fusion.sourceUnusable path={} skipped={}", path, result.skipped());
            return PrimarySource.failed(new FusionException(FusionErrorKind.EMPTY_SOURCE_DATASET,
                    "No usable records in " + path));
        }
        return new PrimarySource(result, null);
    }

    private ReadResult readScrape(Path path, FusionReport.Accumulator report) {
        if (path == null) {
            log.debug("fusion.scrape.notConfigured");
            return ReadResult.empty();
        }
        if (!FusionInputs.exists(path)) {
            return partialSourceUnavailable(report, "Scrape file not found: " + path);
        }
        try {
            ReadResult scraped = new ScrapeJsonReader(objectMapper).read(path);
            if (scraped.isEmpty()) {
                return partialSourceUnavailable(report, "Scrape file has no successful records: " + path);
            }
            return scraped;
        } catch (IOException e) {
            return partialSourceUnavailable(report, "Scrape file unreadable: " + path + " (" + e.getMessage() + ")");
        }
    }

    private ReadResult partialSourceUnavailable(FusionReport.Accumulator report, String reason) {
        log.warn("fusion.partialSourceUnavailable reason=\"{}\"", reason);
        report.warn(reason);
        return ReadResult.empty();
    }

    private void emit(PipelineEvent.Stage stage, String message, long processed, long total) {
        listener.onEvent(PipelineEvent.of(stage, message, processed, total));
    }

    public FusionOptions getOptions() {
        return options;
    }

    /**
     * Outcome of reading one primary input: its records, or why it cannot be used.
     */
    private record PrimarySource(ReadResult rows, FusionException failure) {
        static final PrimarySource ABSENT = new PrimarySource(ReadResult.empty(), null);

        static PrimarySource failed(FusionException failure) {
            return new PrimarySource(ReadResult.empty(), failure);
        }

        boolean isUsable() {
            return failure == null && !rows.isEmpty();
        }
    }
}
