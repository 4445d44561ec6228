package com.hcltech.cpm.tools;

import com.hcltech.cpm.common.errorsor.ErrorsOr;
import com.hcltech.cpm.dag.CpmException;
import com.hcltech.cpm.dag.TaskGraphBuilder;
import com.hcltech.cpm.dag.TaskRecord;
import com.hcltech.cpm.schedule.CriticalPathScheduler;
import com.hcltech.cpm.schedule.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * One batch: load, validate, schedule, report. Reporters run only once the whole
 * schedule exists, so a failed run writes nothing.
 */
public final class SchedulerRunner {
    private static final Logger log = LoggerFactory.getLogger(SchedulerRunner.class);

    public static final int OK = 0;
    public static final int FAILED = 1;

    private final CsvTaskLoader loader;
    private final CriticalPathScheduler scheduler;
    private final List<ScheduleReporter> reporters;

    public SchedulerRunner(CsvTaskLoader loader, CriticalPathScheduler scheduler, List<ScheduleReporter> reporters) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.reporters = List.copyOf(reporters);
    }

    public int run(Path input) {
        ErrorsOr<List<TaskRecord>> records = loader.load(input).flatMap(TaskGraphBuilder::validate);
        if (records.isError()) {
            records.getErrors().forEach(e -> log.error("{}", e));
            return FAILED;
        }

        Schedule schedule;
        try {
            schedule = scheduler.schedule(records.valueOrThrow());
        } catch (CpmException e) {
            log.error("Cannot schedule {} [{} at task '{}']: {}", input, e.kind(), e.identifier(), e.getMessage());
            return FAILED;
        } catch (ArithmeticException e) {
            log.error("Cannot schedule {}: a finish time exceeds {} ({})", input, Integer.MAX_VALUE, e.getMessage());
            return FAILED;
        } catch (IllegalStateException e) {
            log.error("Cannot schedule {}: {}", input, e.getMessage(), e);
            return FAILED;
        }

        try {
            for (ScheduleReporter reporter : reporters) reporter.report(schedule);
        } catch (IOException e) {
            log.error("Failed to write schedule report: {}", e.getMessage(), e);
            return FAILED;
        }
        return OK;
    }
}
