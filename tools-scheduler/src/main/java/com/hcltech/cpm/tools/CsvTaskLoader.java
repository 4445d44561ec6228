package com.hcltech.cpm.tools;

import com.hcltech.cpm.common.csv.CsvLineParser;
import com.hcltech.cpm.common.errorsor.ErrorsOr;
import com.hcltech.cpm.dag.TaskRecord;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code task,duration,dependencies} rows. The first non-blank line is the header
 * and is skipped; blank lines are ignored. Every bad row is reported, with its line number.
 */
public final class CsvTaskLoader {
    private final CsvLineParser lineParser = new CsvLineParser(',');
    private final char dependencySeparator;

    public CsvTaskLoader(char dependencySeparator) {
        this.dependencySeparator = dependencySeparator;
    }

    public ErrorsOr<List<TaskRecord>> load(Path file) {
        return ErrorsOr.<List<String>>trying(() -> Files.readAllLines(file, StandardCharsets.UTF_8),
                        e -> "Cannot read task file " + file + ": " + e.getClass().getSimpleName() + " " + e.getMessage())
                .flatMap(lines -> parse(lines).addPrefixIfError(file + ": "));
    }

    public ErrorsOr<List<TaskRecord>> parse(List<String> lines) {
        int i = 0;
        while (i < lines.size() && CsvLineParser.stripBom(lines.get(i)).isBlank()) i++;
        if (i == lines.size()) return ErrorsOr.error("no header row");

        List<ErrorsOr<TaskRecord>> rows = new ArrayList<>();
        for (int n = i + 1; n < lines.size(); n++) {
            String line = lines.get(n);
            if (line.isBlank()) continue;
            rows.add(parseRow(n + 1, lineParser.parse(line)));
        }
        return ErrorsOr.sequence(rows);
    }

    ErrorsOr<TaskRecord> parseRow(int lineNo, List<String> cells) {
        if (cells.size() < 2) {
            return ErrorsOr.error("line " + lineNo + ": expected task,duration[,dependencies] but got "
                    + cells.size() + " column(s)");
        }
        String id = cells.get(0).trim();
        if (id.isEmpty()) return ErrorsOr.error("line " + lineNo + ": task identifier is blank");

        String rawDuration = cells.get(1).trim();
        int duration;
        try {
            duration = Integer.parseInt(rawDuration);
        } catch (NumberFormatException e) {
            return ErrorsOr.error("line " + lineNo + ": duration '" + rawDuration + "' of task " + id + " is not an integer");
        }
        if (duration < 0) {
            return ErrorsOr.error("line " + lineNo + ": duration " + duration + " of task " + id + " is negative");
        }

        List<String> deps = cells.size() > 2 ? CsvLineParser.splitItems(cells.get(2), dependencySeparator) : List.of();
        return ErrorsOr.lift(new TaskRecord(id, duration, deps));
    }
}
