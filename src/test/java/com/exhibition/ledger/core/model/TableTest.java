package com.exhibition.ledger.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TableTest {

    @Test
    @DisplayName("fromRows should take the union of columns in first-seen order")
    void testFromRows() {
        Table table = Table.fromRows(List.of(
                Map.of("A", "1"),
                Map.of("B", "2")));

        assertEquals(List.of("A", "B"), table.columns());
        assertEquals("", table.get(0, "B"));
        assertEquals("", table.get(1, "A"));
    }

    @Test
    @DisplayName("addColumn at a position should fill existing rows")
    void testAddColumnAtPosition() {
        Table table = new Table(List.of("A", "B"));
        table.addRow(Map.of("A", "1", "B", "2"));
        table.addColumn(0, "CompanyID");

        assertEquals(List.of("CompanyID", "A", "B"), table.columns());
        assertEquals("", table.get(0, "CompanyID"));
    }

    @Test
    @DisplayName("reindex should project onto the given order")
    void testReindex() {
        Table table = new Table(List.of("A", "B"));
        table.addRow(Map.of("A", "1", "B", "2"));

        Table projected = table.reindex(List.of("B", "C"));

        assertEquals(List.of("B", "C"), projected.columns());
        assertEquals("2", projected.get(0, "B"));
        assertEquals("", projected.get(0, "C"));
    }

    @Test
    @DisplayName("rows() should not allow modification")
    void testRowsUnmodifiable() {
        Table table = Table.fromRows(List.of(Map.of("A", "1")));
        assertThrows(UnsupportedOperationException.class, () -> table.rows().get(0).put("A", "2"));
    }

    @Test
    @DisplayName("copy should be independent of the original")
    void testCopy() {
        Table table = Table.fromRows(List.of(Map.of("A", "1")));
        Table copy = table.copy();
        copy.set(0, "A", "2");

        assertEquals("1", table.get(0, "A"));
        assertNotEquals(table, copy);
    }

    @Test
    @DisplayName("appendAll should widen the columns and keep both tables' rows")
    void testAppendAll() {
        Table table = Table.fromRows(List.of(Map.of("A", "1")));
        table.appendAll(Table.fromRows(List.of(Map.of("B", "x"), Map.of("A", "2"))));

        assertEquals(List.of("A", "B"), table.columns());
        assertEquals(3, table.rowCount());
        assertEquals("", table.get(0, "B"));
        assertEquals("x", table.get(1, "B"));
        assertEquals("", table.get(1, "A"));
        assertEquals("2", table.get(2, "A"));
    }
}
