package com.exhibition.ledger.sheets;

/**
 * A rectangular block of cells. Rows are 1-based like the sheet UI; columns are 0-based indexes.
 */
public record CellRange(int firstRow, int firstColumn, int lastRow, int lastColumn) {

    public CellRange {
        if (firstRow < 1 || firstColumn < 0 || lastRow < firstRow || lastColumn < firstColumn) {
            throw new IllegalArgumentException("invalid range: rows " + firstRow + ".." + lastRow
                    + ", columns " + firstColumn + ".." + lastColumn);
        }
    }

    /**
     * The header row spanning the given number of columns.
     */
    public static CellRange headerRow(int columns) {
        return new CellRange(1, 0, 1, columns - 1);
    }

    public int rowCount() {
        return lastRow - firstRow + 1;
    }

    public int columnCount() {
        return lastColumn - firstColumn + 1;
    }

    /**
     * A1 notation without the sheet name, e.g. {@code C2:D41}.
     */
    public String toA1() {
        return ColumnLetters.toLetters(firstColumn) + firstRow + ":" + ColumnLetters.toLetters(lastColumn) + lastRow;
    }
}
