package com.exhibition.ledger.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory working table: an ordered, duplicate-free list of column names and a list of rows.
 * Every row holds a (possibly empty) string for every column; values are never null.
 *
 * <p>Tables are mutable so that a single fusion stage can reshape them in place.
 * Stages that must not affect their input work on {@link #copy()}.</p>
 */
public class Table {

    /** Name of the identity column that leads every output table. */
    public static final String COMPANY_ID = "CompanyID";

    /** Back-reference to the originating document in OCR/QR mode. */
    public static final String FILE_NAME = "file_name";

    private final List<String> columns;
    private final List<Map<String, String>> rows;

    public Table() {
        this.columns = new ArrayList<>();
        this.rows = new ArrayList<>();
    }

    public Table(List<String> columns) {
        this();
        for (String column : columns) {
            addColumn(column);
        }
    }

    /**
     * Builds a table whose columns are the union of the given rows' keys, in first-seen order.
     */
    public static Table fromRows(List<? extends Map<String, String>> rows) {
        Table table = new Table();
        for (Map<String, String> row : rows) {
            table.addRow(row);
        }
        return table;
    }

    /**
     * Builds a table from raw records, one row per record.
     */
    public static Table fromRecords(Collection<RawRecord> records) {
        Table table = new Table();
        for (RawRecord record : records) {
            table.addRow(record.fields());
        }
        return table;
    }

    public List<String> columns() {
        return Collections.unmodifiableList(columns);
    }

    /**
     * Returns an unmodifiable view of the rows. Use {@link #set} to change values.
     */
    public List<Map<String, String>> rows() {
        List<Map<String, String>> view = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            view.add(Collections.unmodifiableMap(row));
        }
        return Collections.unmodifiableList(view);
    }

    public Map<String, String> row(int index) {
        return Collections.unmodifiableMap(rows.get(index));
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int indexOf(String column) {
        return columns.indexOf(column);
    }

    /**
     * Returns the value at the given row and column, or an empty string.
     */
    public String get(int rowIndex, String column) {
        String value = rows.get(rowIndex).get(column);
        return value != null ? value : "";
    }

    public void set(int rowIndex, String column, String value) {
        if (!columns.contains(column)) {
            addColumn(column);
        }
        rows.get(rowIndex).put(column, value != null ? value : "");
    }

    /**
     * Appends a column at the end, filling existing rows with empty strings.
     * Adding an existing column is a no-op.
     */
    public void addColumn(String column) {
        addColumn(columns.size(), column);
    }

    /**
     * Inserts a column at the given position, filling existing rows with empty strings.
     * Adding an existing column is a no-op.
     */
    public void addColumn(int position, String column) {
        Objects.requireNonNull(column, "column is required");
        if (columns.contains(column)) {
            return;
        }
        columns.add(position, column);
        for (Map<String, String> row : rows) {
            row.putIfAbsent(column, "");
        }
    }

    public void removeColumn(String column) {
        if (columns.remove(column)) {
            for (Map<String, String> row : rows) {
                row.remove(column);
            }
        }
    }

    /**
     * Moves the column to the given position if present.
     */
    public void moveColumn(String column, int position) {
        if (columns.remove(column)) {
            columns.add(position, column);
        }
    }

    /**
     * Appends a row. Columns not yet in the table are added at the end;
     * columns missing from the row are filled with empty strings.
     */
    public void addRow(Map<String, String> values) {
        for (String column : values.keySet()) {
            if (column != null && !columns.contains(column)) {
                addColumn(column);
            }
        }
        Map<String, String> row = new LinkedHashMap<>();
        for (String column : columns) {
            String value = values.get(column);
            row.put(column, value != null ? value : "");
        }
        rows.add(row);
    }

    /**
     * Appends all rows of another table, widening this table's columns as needed.
     */
    public void appendAll(Table other) {
        for (String column : other.columns) {
            addColumn(column);
        }
        for (Map<String, String> row : other.rows) {
            addRow(row);
        }
    }

    /**
     * Returns a copy of this table laid out in the given column order.
     * Columns absent from this table are filled with empty strings;
     * columns not named are dropped.
     */
    public Table reindex(List<String> order) {
        Table result = new Table(new ArrayList<>(new LinkedHashSet<>(order)));
        for (Map<String, String> row : rows) {
            Map<String, String> projected = new LinkedHashMap<>();
            for (String column : result.columns) {
                projected.put(column, row.getOrDefault(column, ""));
            }
            result.rows.add(projected);
        }
        return result;
    }

    /**
     * Stable sort of the rows.
     */
    public void sortRows(Comparator<Map<String, String>> comparator) {
        rows.sort(comparator);
    }

    public Table copy() {
        Table copy = new Table(columns);
        for (Map<String, String> row : rows) {
            copy.rows.add(new LinkedHashMap<>(row));
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Table table = (Table) o;
        return columns.equals(table.columns) && rows.equals(table.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "Table{columns=" + columns.size() + ", rows=" + rows.size() + '}';
    }
}
