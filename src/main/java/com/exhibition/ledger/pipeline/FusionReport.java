package com.exhibition.ledger.pipeline;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Summary of a fusion run.
 *
 * @param mode               ingestion mode used
 * @param primaryRows        rows read from the primary sources
 * @param scrapeRows         successful scraped rows read (0 in Excel mode)
 * @param unmatchedScrapeRows scraped rows whose domain matched no document
 * @param removedColumns     columns removed by reconciliation, per pass
 * @param mergedGroups       entities built from more than one row
 * @param outputRows         rows in the fused table
 * @param outputColumns      columns in the fused table
 * @param warnings           non-fatal problems, such as an unavailable secondary source
 * @param duration           wall-clock time of the run
 */
public record FusionReport(
        FusionMode mode,
        int primaryRows,
        int scrapeRows,
        int unmatchedScrapeRows,
        Map<String, Integer> removedColumns,
        int mergedGroups,
        int outputRows,
        int outputColumns,
        List<String> warnings,
        Duration duration
) {
    public FusionReport {
        removedColumns = removedColumns != null ? Map.copyOf(removedColumns) : Map.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public int inputRows() {
        return primaryRows + scrapeRows;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    static Accumulator accumulate(FusionMode mode) {
        return new Accumulator(mode);
    }

    /**
     * Mutable counterpart threaded through the stages of one run.
     */
    static final class Accumulator {
        private FusionMode mode;
        private int primaryRows;
        private int scrapeRows;
        private int unmatchedScrapeRows;
        private Map<String, Integer> removedColumns = Map.of();
        private int mergedGroups;
        private final List<String> warnings = new ArrayList<>();

        private Accumulator(FusionMode mode) {
            this.mode = mode;
        }

        Accumulator mode(FusionMode mode) {
            this.mode = mode;
            return this;
        }

        Accumulator primaryRows(int rows) {
            this.primaryRows = rows;
            return this;
        }

        Accumulator addPrimaryRows(int rows) {
            this.primaryRows += rows;
            return this;
        }

        Accumulator scrapeRows(int rows) {
            this.scrapeRows = rows;
            return this;
        }

        Accumulator unmatchedScrapeRows(int rows) {
            this.unmatchedScrapeRows = rows;
            return this;
        }

        Accumulator removedColumns(Map<String, Integer> removed) {
            this.removedColumns = removed;
            return this;
        }

        Accumulator mergedGroups(int groups) {
            this.mergedGroups = groups;
            return this;
        }

        Accumulator warn(String warning) {
            warnings.add(warning);
            return this;
        }

        Accumulator warnAll(List<String> more) {
            warnings.addAll(more);
            return this;
        }

        FusionReport build(int outputRows, int outputColumns, Duration duration) {
            return new FusionReport(mode, primaryRows, scrapeRows, unmatchedScrapeRows, removedColumns,
                    mergedGroups, outputRows, outputColumns, warnings, duration);
        }
    }
}
