package com.hcltech.cpm.common.csv;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal CSV line parser.
 * - Supports quoted fields and doubled quotes inside quoted fields.
 * - Configurable delimiter (default comma).
 * - Fields are returned untrimmed; {@link #splitItems} is for list-valued cells.
 */
public record CsvLineParser(char delimiter) {
    private static final char BOM = '\uFEFF';

    public CsvLineParser() {
        this(',');
    }

    public List<String> parse(String line) {
        List<String> out = new ArrayList<>();
        if (line == null) {
            out.add("");
            return out;
        }
        StringBuilder cur = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '"') {
                // Escaped quote inside quoted field ("")
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    cur.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (ch == delimiter && !inQuotes) {
                out.add(cur.toString());
                cur.setLength(0);
            } else {
                cur.append(ch);
            }
        }
        out.add(cur.toString());
        return out;
    }

    /**
     * Splits a single cell holding a list ("b;c") into trimmed, non-empty items.
     * A null or blank cell is the empty list.
     */
    public static List<String> splitItems(String cell, char separator) {
        List<String> out = new ArrayList<>();
        if (cell == null || cell.isBlank()) return out;
        int start = 0;
        for (int i = 0; i <= cell.length(); i++) {
            if (i == cell.length() || cell.charAt(i) == separator) {
                String item = cell.substring(start, i).trim();
                if (!item.isEmpty()) out.add(item);
                start = i + 1;
            }
        }
        return out;
    }

    public static String stripBom(String s) {
        return (s != null && !s.isEmpty() && s.charAt(0) == BOM) ? s.substring(1) : s;
    }
}
