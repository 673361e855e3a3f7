package com.exhibition.ledger.pipeline;

import com.exhibition.ledger.core.model.RawRecord;
import com.exhibition.ledger.core.model.Table;
import com.exhibition.ledger.identity.DomainNormalizer;
import com.exhibition.ledger.reconcile.ValueJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Attaches scraped website records to the OCR/QR document they came from, by domain.
 *
 * <p>Every website-like value of every document row (website, URL and QR-link columns,
 * numbered variants included) is reduced to its domain; the first document seen for a
 * domain wins. A scraped record matches on its {@code url}, falling back to its
 * {@code Website} columns. Unmatched records follow the configured
 * {@link UnmatchedScrapePolicy}.</p>
 */
public class ScrapeLinker {
    private static final Logger log = LoggerFactory.getLogger(ScrapeLinker.class);

    private static final Pattern LINK_COLUMN =
            Pattern.compile("^(website|url|urls|qrlink|qr_link|qr_links)[_\\s-]?\\d*$");
    private static final Pattern SCRAPE_URL_COLUMN = Pattern.compile("^(url|website)[_\\s-]?\\d*$");

    /**
     * Scraped rows ready to append, each carrying a {@code file_name}.
     *
     * @param rows      linked rows in input order
     * @param unmatched number of rows that fell back to the policy
     */
    public record LinkResult(List<Map<String, String>> rows, int unmatched) {
        public LinkResult {
            rows = List.copyOf(rows);
        }
    }

    private final UnmatchedScrapePolicy policy;

    public ScrapeLinker(UnmatchedScrapePolicy policy) {
        this.policy = policy;
    }

    public LinkResult link(Table documents, List<RawRecord> scraped) {
        Map<String, String> fileByDomain = indexDomains(documents);
        Optional<String> fallback = policy == UnmatchedScrapePolicy.MOST_COMMON_FILE_NAME
                ? mostCommonFileName(documents) : Optional.empty();

        List<Map<String, String>> rows = new ArrayList<>(scraped.size());
        int unmatched = 0;
        for (RawRecord record : scraped) {
            Map<String, String> row = new LinkedHashMap<>(record.fields());
            String fileName = domainsOf(record.fields(), SCRAPE_URL_COLUMN).stream()
                    .map(fileByDomain::get)
                    .filter(f -> f != null)
                    .findFirst()
                    .orElse(null);
            if (fileName == null) {
                unmatched++;
                fileName = fallback.orElse("");
                log.debug("link.unmatched url={} fallback={}", record.get("url"), fileName);
            }
            row.put(Table.FILE_NAME, fileName);
            rows.add(row);
        }

        log.info("link.completed scraped={} matched={} unmatched={} policy={}",
                scraped.size(), scraped.size() - unmatched, unmatched, policy);
        return new LinkResult(rows, unmatched);
    }

    static Map<String, String> indexDomains(Table documents) {
        Map<String, String> fileByDomain = new HashMap<>();
        for (Map<String, String> row : documents.rows()) {
            String fileName = row.getOrDefault(Table.FILE_NAME, "");
            if (fileName.isEmpty()) {
                continue;
            }
            for (String domain : domainsOf(row, LINK_COLUMN)) {
                fileByDomain.putIfAbsent(domain, fileName);
            }
        }
        return fileByDomain;
    }

    /**
     * Most frequent {@code file_name}; the earliest one wins a tie.
     */
    static Optional<String> mostCommonFileName(Table documents) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Map<String, String> row : documents.rows()) {
            String fileName = row.getOrDefault(Table.FILE_NAME, "");
            if (!fileName.isEmpty()) {
                counts.merge(fileName, 1, Integer::sum);
            }
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    private static List<String> domainsOf(Map<String, String> row, Pattern columns) {
        List<String> domains = new ArrayList<>();
        for (Map.Entry<String, String> entry : row.entrySet()) {
            if (!columns.matcher(entry.getKey().toLowerCase(Locale.ROOT)).matches()) {
                continue;
            }
            for (String segment : ValueJoiner.segments(entry.getValue())) {
                String domain = DomainNormalizer.normalize(segment);
                if (!domain.isEmpty()) {
                    domains.add(domain);
                }
            }
        }
        return domains;
    }
}
