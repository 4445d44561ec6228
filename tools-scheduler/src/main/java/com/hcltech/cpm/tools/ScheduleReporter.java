package com.hcltech.cpm.tools;

import com.hcltech.cpm.schedule.Schedule;

import java.io.IOException;

/** Renders a complete schedule somewhere. Only ever handed a successful result. */
@FunctionalInterface
public interface ScheduleReporter {
    void report(Schedule schedule) throws IOException;
}
