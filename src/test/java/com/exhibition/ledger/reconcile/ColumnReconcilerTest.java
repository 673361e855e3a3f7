package com.exhibition.ledger.reconcile;

import com.exhibition.ledger.core.model.ColumnGroup;
import com.exhibition.ledger.core.model.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ColumnReconciler Tests")
class ColumnReconcilerTest {

    private ColumnReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new ColumnReconciler();
    }

    private static Table mixedExtractorTable() {
        Map<String, String> first = new LinkedHashMap<>();
        first.put("CompanyID", "COMP_A");
        first.put("CompanyNameEN", "Acme");
        first.put("CompanyNameFA", "آکمه");
        first.put("Phone1", "021-1");
        first.put("Phone2", "021-2");
        first.put("phones", "021-1");
        first.put("email", "sales@acme.com");
        first.put("Email", "");
        first.put("urls", "acme.com");
        first.put("file_name", "card_1.pdf");

        Map<String, String> second = new LinkedHashMap<>();
        second.put("CompanyID", "COMP_B");
        second.put("CompanyNameEN", "");
        second.put("CompanyNameFA", "آپکس");
        second.put("Phone1", "");
        second.put("Phone2", "");
        second.put("phones", "021-9");
        second.put("email", "info@apex.ir");
        second.put("Email", "sales@apex.ir");
        second.put("urls", "");
        second.put("file_name", "card_2.pdf");

        return Table.fromRows(List.of(first, second));
    }

    @Test
    @DisplayName("Should collapse extractor variants into the canonical schema")
    void testCanonicalSchema() {
        ReconciliationResult result = reconciler.reconcile(mixedExtractorTable());
        Table table = result.table();

        assertEquals(List.of("CompanyID", "CompanyNameEN", "Phone1", "Email", "Website", "file_name"),
                table.columns());
        assertEquals("Acme | آکمه", table.get(0, "CompanyNameEN"));
        assertEquals("021-1 | 021-2", table.get(0, "Phone1"));
        assertEquals("sales@acme.com", table.get(0, "Email"));
        assertEquals("acme.com", table.get(0, "Website"));
        assertEquals("آپکس", table.get(1, "CompanyNameEN"));
        assertEquals("021-9", table.get(1, "Phone1"));
        assertEquals("sales@apex.ir | info@apex.ir", table.get(1, "Email"));
        assertTrue(result.changed());
    }

    @Test
    @DisplayName("Protected columns should pass through untouched")
    void testProtectedColumns() {
        Table table = reconciler.reconcile(mixedExtractorTable()).table();
        assertEquals("COMP_B", table.get(1, "CompanyID"));
        assertEquals("card_2.pdf", table.get(1, "file_name"));
    }

    @Test
    @DisplayName("Every non-empty input value should survive in its row")
    void testNoDataLoss() {
        Table input = mixedExtractorTable();
        Table output = reconciler.reconcile(input).table();

        for (int i = 0; i < input.rowCount(); i++) {
            String merged = String.join("\n", output.row(i).values());
            for (String value : input.row(i).values()) {
                if (!value.isEmpty()) {
                    assertTrue(merged.contains(value), "lost value " + value + " in row " + i);
                }
            }
        }
    }

    @Test
    @DisplayName("Reconciling a reconciled table should change nothing")
    void testIdempotent() {
        Table once = reconciler.reconcile(mixedExtractorTable()).table();
        ReconciliationResult twice = reconciler.reconcile(once);

        assertFalse(twice.changed());
        assertEquals(once, twice.table());
        assertEquals(1, twice.rounds());
    }

    @Test
    @DisplayName("Input table should not be modified")
    void testInputUntouched() {
        Table input = mixedExtractorTable();
        Table snapshot = input.copy();
        reconciler.reconcile(input);
        assertEquals(snapshot, input);
    }

    @Test
    @DisplayName("Should report removed columns per pass")
    void testRemovedColumnsByPass() {
        ReconciliationResult result = reconciler.reconcile(mixedExtractorTable());
        Map<String, Integer> byPass = result.removedColumnsByPass();

        // numbered: Phone2 and email; bilingual: CompanyNameFA; alias: phones and urls (renamed)
        assertEquals(2, byPass.get("numbered"));
        assertEquals(1, byPass.get("bilingual"));
        assertEquals(2, byPass.get("alias"));
        assertEquals(5, result.removedColumnCount());
        assertEquals(2, result.rounds());
    }

    @Test
    @DisplayName("Alias merge should fold values into the canonical column position")
    void testAliasPosition() {
        Table input = Table.fromRows(List.of(Map.of("faxes", "021-5")));
        input.addColumn(0, "Notes");
        input.addColumn("Fax");
        input.set(0, "Fax", "021-6");

        Table table = new ColumnReconciler(List.of(new AliasGroupPass(AliasGroupPass.defaultAliases())), Set.of())
                .reconcile(input).table();

        assertEquals(List.of("Notes", "Fax"), table.columns());
        assertEquals("021-6 | 021-5", table.get(0, "Fax"));
    }

    @Test
    @DisplayName("apply should skip groups whose members are gone")
    void testApplySkipsMissing() {
        Table table = Table.fromRows(List.of(Map.of("Fax", "1")));
        assertFalse(ColumnReconciler.apply(table, ColumnGroup.of("Fax", "Fax", "faxes")));
        assertFalse(ColumnReconciler.apply(table, ColumnGroup.of("Phone1", "phones")));
    }
}
