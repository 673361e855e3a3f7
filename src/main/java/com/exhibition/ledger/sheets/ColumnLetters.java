package com.exhibition.ledger.sheets;

/**
 * Spreadsheet column letters: bijective base 26 with no zero digit.
 * {@code 0 -> A}, {@code 25 -> Z}, {@code 26 -> AA}, {@code 701 -> ZZ}, {@code 702 -> AAA}.
 */
public final class ColumnLetters {

    private ColumnLetters() {
        // Utility class
    }

    public static String toLetters(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("column index must be >= 0: " + index);
        }
        StringBuilder sb = new StringBuilder();
        int n = index + 1;
        while (n > 0) {
            int rem = (n - 1) % 26;
            sb.append((char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }

    public static int toIndex(String letters) {
        if (letters == null || letters.isEmpty()) {
            throw new IllegalArgumentException("column letters are required");
        }
        int n = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = Character.toUpperCase(letters.charAt(i));
            if (c < 'A' || c > 'Z') {
                throw new IllegalArgumentException("not a column letter: " + letters);
            }
            n = n * 26 + (c - 'A' + 1);
        }
        return n - 1;
    }
}
