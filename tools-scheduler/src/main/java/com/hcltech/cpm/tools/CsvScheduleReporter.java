package com.hcltech.cpm.tools;

import com.hcltech.cpm.common.csv.CsvLineFormatter;
import com.hcltech.cpm.schedule.Schedule;
import com.hcltech.cpm.schedule.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** One row per task: {@code task,duration,ES,EF,LS,LF,slack}. */
public final class CsvScheduleReporter implements ScheduleReporter {
    private static final Logger log = LoggerFactory.getLogger(CsvScheduleReporter.class);
    static final List<String> HEADER = List.of("task", "duration", "ES", "EF", "LS", "LF", "slack");

    private final Path file;
    private final CsvLineFormatter formatter = new CsvLineFormatter();

    public CsvScheduleReporter(Path file) {
        this.file = file;
    }

    @Override
    public void report(Schedule schedule) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            w.write(formatter.format(HEADER));
            w.newLine();
            for (ScheduledTask t : schedule.tasks()) {
                w.write(formatter.format(List.of(t.id(), t.duration(),
                        t.earlyStart(), t.earlyFinish(), t.lateStart(), t.lateFinish(), t.slack())));
                w.newLine();
            }
        }
        log.info("Task details written to {}", file);
    }
}
