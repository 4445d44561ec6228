package com.hcltech.cpm.tools;

import com.hcltech.cpm.common.codec.Codec;
import com.hcltech.cpm.schedule.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class JsonScheduleReporter implements ScheduleReporter {
    private static final Logger log = LoggerFactory.getLogger(JsonScheduleReporter.class);

    private final Path file;
    private final Codec<ScheduleReport, String> codec = Codec.prettyJson(ScheduleReport.class);

    public JsonScheduleReporter(Path file) {
        this.file = file;
    }

    @Override
    public void report(Schedule schedule) throws IOException {
        String json = codec.encode(ScheduleReport.from(schedule)).valueOrThrow();
        Files.writeString(file, json, StandardCharsets.UTF_8);
        log.info("JSON report written to {}", file);
    }
}
