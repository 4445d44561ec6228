package com.hcltech.cpm.common.csv;

import java.util.List;

/**
 * Inverse of {@link CsvLineParser}: joins fields with the delimiter, quoting a field
 * only when it contains the delimiter, a quote or a line break.
 */
public record CsvLineFormatter(char delimiter) {
    public CsvLineFormatter() {
        this(',');
    }

    public String format(List<?> fields) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) sb.append(delimiter);
            appendField(sb, fields.get(i));
        }
        return sb.toString();
    }

    private void appendField(StringBuilder sb, Object field) {
        String s = field == null ? "" : String.valueOf(field);
        if (!needsQuotes(s)) {
            sb.append(s);
            return;
        }
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch == '"') sb.append('"');
            sb.append(ch);
        }
        sb.append('"');
    }

    private boolean needsQuotes(String s) {
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch == delimiter || ch == '"' || ch == '\n' || ch == '\r') return true;
        }
        return false;
    }
}
