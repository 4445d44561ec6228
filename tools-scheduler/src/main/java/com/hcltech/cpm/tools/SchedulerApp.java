package com.hcltech.cpm.tools;

import com.hcltech.cpm.common.async.ExecutorServiceFactory;
import com.hcltech.cpm.schedule.CriticalPathScheduler;
import com.hcltech.cpm.schedule.GenerationRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Reads a task CSV, computes the critical path schedule and writes the result CSV,
 * the timeline CSV and, if configured, a JSON report.
 * <p>
 * Usage: {@code SchedulerApp [tasks.csv]}. Everything else comes from {@link SchedulerConfig}.
 */
public class SchedulerApp {
    private static final Logger log = LoggerFactory.getLogger(SchedulerApp.class);

    public static void main(String[] args) {
        SchedulerConfig config = SchedulerConfig.fromEnvironment();
        if (args.length > 0) config = config.withInputFile(Path.of(args[0]));
        int code = run(config);
        if (code != SchedulerRunner.OK) System.exit(code);
    }

    static int run(SchedulerConfig config) {
        log.debug("Config: {}", config);
        ExecutorService executor = config.parallelism() > 1
                ? ExecutorServiceFactory.fixed().create(config.parallelism(), "cpm-pass")
                : null;
        try {
            GenerationRunner runner = executor == null ? GenerationRunner.sequential() : GenerationRunner.parallel(executor);
            SchedulerRunner schedulerRunner = new SchedulerRunner(
                    new CsvTaskLoader(config.dependencySeparator()),
                    new CriticalPathScheduler(runner, config.sinkAnchor()),
                    reporters(config));
            return schedulerRunner.run(config.inputFile());
        } finally {
            if (executor != null) executor.shutdownNow();
        }
    }

    static List<ScheduleReporter> reporters(SchedulerConfig config) {
        List<ScheduleReporter> reporters = new ArrayList<>();
        reporters.add(new CsvScheduleReporter(config.outputFile()));
        reporters.add(new CsvTimelineReporter(config.timelineFile()));
        config.jsonReport().ifPresent(path -> reporters.add(new JsonScheduleReporter(path)));
        return reporters;
    }
}
