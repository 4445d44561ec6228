package com.hcltech.cpm.tools;

import com.hcltech.cpm.common.csv.CsvLineFormatter;
import com.hcltech.cpm.schedule.Schedule;
import com.hcltech.cpm.schedule.Timeline;
import com.hcltech.cpm.schedule.TimelineCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Simplified Gantt chart: a {@code Task,0,1,...} header, then one row per task with a
 * symbol per time unit: C critical and active, X active with slack, O inactive.
 */
public final class CsvTimelineReporter implements ScheduleReporter {
    private static final Logger log = LoggerFactory.getLogger(CsvTimelineReporter.class);

    private final Path file;
    private final CsvLineFormatter formatter = new CsvLineFormatter();

    public CsvTimelineReporter(Path file) {
        this.file = file;
    }

    @Override
    public void report(Schedule schedule) throws IOException {
        Timeline timeline = Timeline.of(schedule);
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            List<Object> header = new ArrayList<>(timeline.horizon() + 1);
            header.add("Task");
            for (int t = 0; t < timeline.horizon(); t++) header.add(t);
            w.write(formatter.format(header));
            w.newLine();

            for (String id : timeline.taskIds()) {
                List<Object> row = new ArrayList<>(timeline.horizon() + 1);
                row.add(id);
                for (TimelineCell cell : timeline.cells(id)) row.add(cell.symbol());
                w.write(formatter.format(row));
                w.newLine();
            }
        }
        log.info("Timeline written to {}", file);
    }
}
