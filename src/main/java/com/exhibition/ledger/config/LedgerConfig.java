package com.exhibition.ledger.config;

import com.exhibition.ledger.identity.IdentityFields;
import com.exhibition.ledger.pipeline.FusionInputs;
import com.exhibition.ledger.pipeline.FusionOptions;
import com.exhibition.ledger.pipeline.UnmatchedScrapePolicy;
import com.exhibition.ledger.sheets.SyncOptions;
import com.exhibition.ledger.sheets.SyncTarget;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

/**
 * Deployment settings read through MicroProfile Config: {@code META-INF/microprofile-config.properties},
 * then system properties and environment variables ({@code LEDGER_SHEETS_ACCESS_TOKEN} for
 * {@code ledger.sheets.access-token}, and so on).
 *
 * <pre>
 * ledger.session-dir=/data/expo-2024
 * ledger.fusion.unmatched-scrape-policy=UNASSIGNED
 * ledger.sheets.enabled=true
 * ledger.sheets.spreadsheet-id=1AbC...
 * </pre>
 *
 * Relative input and output paths resolve against {@code ledger.session-dir}.
 */
public class LedgerConfig {

    static final String UNMATCHED_SCRAPE_POLICY = "ledger.fusion.unmatched-scrape-policy";

    // ── Files ─────────────────────────────────────────────────

    private final Path sessionDir;
    private final String ocrQrJson;
    private final String scrapeJson;
    private final String workbook;
    private final String outputWorkbook;

    // ── Fusion ────────────────────────────────────────────────

    private final UnmatchedScrapePolicy unmatchedScrapePolicy;
    private final boolean mergeRows;
    private final int repeatThreshold;
    private final String defaultCountryCode;
    private final int minPhoneDigits;

    // ── Remote sheet ──────────────────────────────────────────

    private final boolean sheetsEnabled;
    private final String spreadsheetId;
    private final String sheetName;
    private final String sheetsBaseUrl;
    private final String accessToken;
    private final int timeoutSeconds;
    private final long cellLimit;

    private LedgerConfig(Config config) {
        this.sessionDir = Path.of(string(config, "ledger.session-dir", "."));
        this.ocrQrJson = string(config, "ledger.input.ocr-qr-json", "mix_ocr_qr.json");
        this.scrapeJson = string(config, "ledger.input.scrape-json", "gemini_scrap_output.json");
        this.workbook = string(config, "ledger.input.excel", "web_analysis.xlsx");
        this.outputWorkbook = string(config, "ledger.output.excel", "merged_final.xlsx");

        this.unmatchedScrapePolicy = policy(string(config, UNMATCHED_SCRAPE_POLICY, "MOST_COMMON_FILE_NAME"));
        this.mergeRows = config.getOptionalValue("ledger.fusion.merge-rows", Boolean.class).orElse(true);
        this.repeatThreshold = config.getOptionalValue("ledger.fusion.repeat-threshold", Integer.class).orElse(3);
        this.defaultCountryCode = string(config, "ledger.identity.default-country-code", "98");
        this.minPhoneDigits = config.getOptionalValue("ledger.identity.min-phone-digits", Integer.class).orElse(8);

        this.sheetsEnabled = config.getOptionalValue("ledger.sheets.enabled", Boolean.class).orElse(false);
        this.spreadsheetId = string(config, "ledger.sheets.spreadsheet-id", "");
        this.sheetName = string(config, "ledger.sheets.sheet-name", "Sheet1");
        this.sheetsBaseUrl = string(config, "ledger.sheets.base-url", "https://sheets.googleapis.com");
        this.accessToken = string(config, "ledger.sheets.access-token", "");
        this.timeoutSeconds = config.getOptionalValue("ledger.sheets.timeout-seconds", Integer.class).orElse(30);
        this.cellLimit = config.getOptionalValue("ledger.sheets.cell-limit", Long.class)
                .orElse(SyncOptions.DEFAULT_CELL_LIMIT);
    }

    /**
     * Loads the configuration visible to the current class loader.
     *
     * @throws IllegalArgumentException when a value cannot be converted, naming the key
     */
    public static LedgerConfig load() {
        return from(ConfigProvider.getConfig());
    }

    public static LedgerConfig from(Config config) {
        return new LedgerConfig(config);
    }

    public FusionInputs toFusionInputs() {
        return new FusionInputs(resolve(ocrQrJson), resolve(scrapeJson), resolve(workbook));
    }

    public FusionOptions toFusionOptions() {
        return FusionOptions.builder()
                .unmatchedScrapePolicy(unmatchedScrapePolicy)
                .mergeRows(mergeRows)
                .repeatThreshold(repeatThreshold)
                .identityFields(IdentityFields.builder()
                        .defaultCountryCode(defaultCountryCode)
                        .minPhoneDigits(minPhoneDigits)
                        .build())
                .build();
    }

    /**
     * The configured sheet, or empty when synchronization is disabled or no spreadsheet is named.
     */
    public Optional<SyncTarget> toSyncTarget() {
        if (!sheetsEnabled || spreadsheetId.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new SyncTarget(spreadsheetId, sheetName));
    }

    public SyncOptions toSyncOptions() {
        return SyncOptions.builder().cellLimit(cellLimit).build();
    }

    public Path outputWorkbook() {
        return resolve(outputWorkbook);
    }

    public Path getSessionDir() {
        return sessionDir;
    }

    public boolean isSheetsEnabled() {
        return sheetsEnabled;
    }

    public String getSheetsBaseUrl() {
        return sheetsBaseUrl;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public Duration getTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    private Path resolve(String file) {
        Path path = Path.of(file);
        return path.isAbsolute() ? path : sessionDir.resolve(path);
    }

    private static UnmatchedScrapePolicy policy(String value) {
        try {
            return UnmatchedScrapePolicy.valueOf(value.strip());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + UNMATCHED_SCRAPE_POLICY + "=" + value
                    + ", expected one of " + Arrays.toString(UnmatchedScrapePolicy.values()), e);
        }
    }

    private static String string(Config config, String name, String defaultValue) {
        return config.getOptionalValue(name, String.class).orElse(defaultValue);
    }
}
