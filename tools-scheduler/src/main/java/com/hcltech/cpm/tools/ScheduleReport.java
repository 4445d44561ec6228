package com.hcltech.cpm.tools;

import com.hcltech.cpm.schedule.Schedule;
import com.hcltech.cpm.schedule.ScheduledTask;

import java.util.List;

/** JSON shape of a schedule. */
public record ScheduleReport(int horizon, List<String> criticalPath, List<Row> tasks) {

    public record Row(String task, int duration, int es, int ef, int ls, int lf, int slack, boolean critical) {}

    public static ScheduleReport from(Schedule schedule) {
        List<Row> rows = schedule.tasks().stream().map(ScheduleReport::row).toList();
        return new ScheduleReport(schedule.horizon(), schedule.criticalPath(), rows);
    }

    private static Row row(ScheduledTask t) {
        return new Row(t.id(), t.duration(), t.earlyStart(), t.earlyFinish(),
                t.lateStart(), t.lateFinish(), t.slack(), t.critical());
    }
}
