package com.exhibition.ledger.pipeline;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Input files of a fusion run. Any path may be null or point to a missing file.
 *
 * @param ocrQrJson  combined OCR + QR extraction JSON
 * @param scrapeJson web-enrichment JSON (optional secondary source)
 * @param workbook   operator workbook ({@code .xlsx}) or CSV export
 */
public record FusionInputs(Path ocrQrJson, Path scrapeJson, Path workbook) {

    public static FusionInputs ocrQr(Path ocrQrJson, Path scrapeJson) {
        return new FusionInputs(ocrQrJson, scrapeJson, null);
    }

    public static FusionInputs workbook(Path workbook) {
        return new FusionInputs(null, null, workbook);
    }

    /**
     * Mode implied by which files exist: combined when both primary sources do, else the one
     * present. The pipeline narrows it when an existing source turns out to be unusable.
     */
    public Optional<FusionMode> detectMode() {
        if (exists(ocrQrJson) && exists(workbook)) {
            return Optional.of(FusionMode.COMBINED);
        }
        if (exists(ocrQrJson)) {
            return Optional.of(FusionMode.OCR_QR);
        }
        if (exists(workbook)) {
            return Optional.of(FusionMode.EXCEL);
        }
        return Optional.empty();
    }

    static boolean exists(Path path) {
        return path != null && Files.isRegularFile(path);
    }
}
