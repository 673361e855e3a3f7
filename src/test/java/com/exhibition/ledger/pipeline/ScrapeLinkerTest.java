package com.exhibition.ledger.pipeline;

import com.exhibition.ledger.core.model.RawRecord;
import com.exhibition.ledger.core.model.RecordSource;
import com.exhibition.ledger.core.model.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScrapeLinkerTest {

    private Table documents;

    @BeforeEach
    void setUp() {
        documents = Table.fromRows(List.of(
                Map.of("file_name", "card1.pdf", "QRLink", "https://www.acme.com/vcard"),
                Map.of("file_name", "card1.pdf", "Phone1", "021-1"),
                Map.of("file_name", "flyer.jpg", "Website2", "apex.ir | https://beta.ir"),
                Map.of("file_name", "flyer.jpg", "urls", "acme.com")));
    }

    private static RawRecord scraped(String url) {
        return new RawRecord(RecordSource.SCRAPE, "scrape.json", Map.of("url", url, "Email", "x@" + url));
    }

    @Test
    @DisplayName("Should index every website-like column, first document winning")
    void testIndexDomains() {
        Map<String, String> index = ScrapeLinker.indexDomains(documents);

        assertEquals("card1.pdf", index.get("acme.com"));
        assertEquals("flyer.jpg", index.get("apex.ir"));
        assertEquals("flyer.jpg", index.get("beta.ir"));
        assertEquals(3, index.size());
    }

    @Test
    @DisplayName("Matched rows should take the document's file_name")
    void testMatched() {
        ScrapeLinker.LinkResult result = new ScrapeLinker(UnmatchedScrapePolicy.UNASSIGNED)
                .link(documents, List.of(scraped("beta.ir"), scraped("acme.com")));

        assertEquals(0, result.unmatched());
        assertEquals("flyer.jpg", result.rows().get(0).get("file_name"));
        assertEquals("card1.pdf", result.rows().get(1).get("file_name"));
        assertEquals("x@beta.ir", result.rows().get(0).get("Email"));
    }

    @Test
    @DisplayName("Unmatched rows should fall back to the most common file_name")
    void testMostCommonFallback() {
        ScrapeLinker.LinkResult result = new ScrapeLinker(UnmatchedScrapePolicy.MOST_COMMON_FILE_NAME)
                .link(documents, List.of(scraped("unknown.ir")));

        assertEquals(1, result.unmatched());
        assertEquals("card1.pdf", result.rows().get(0).get("file_name"));
    }

    @Test
    @DisplayName("Unmatched rows should stay unassigned under the UNASSIGNED policy")
    void testUnassigned() {
        ScrapeLinker.LinkResult result = new ScrapeLinker(UnmatchedScrapePolicy.UNASSIGNED)
                .link(documents, List.of(scraped("unknown.ir")));

        assertEquals("", result.rows().get(0).get("file_name"));
    }

    @Test
    @DisplayName("Most common file_name tie should go to the earliest")
    void testMostCommonTie() {
        Table tie = Table.fromRows(List.of(
                Map.of("file_name", "b.pdf"),
                Map.of("file_name", "a.pdf"),
                Map.of("file_name", "a.pdf"),
                Map.of("file_name", "b.pdf")));

        assertEquals("b.pdf", ScrapeLinker.mostCommonFileName(tie).orElseThrow());
        assertTrue(ScrapeLinker.mostCommonFileName(new Table()).isEmpty());
    }
}
