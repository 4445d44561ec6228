package com.hcltech.cpm.schedule;

/** One computed row: identifier, duration, ES, EF, LS, LF and slack. */
public record ScheduledTask(String id, int duration,
                            int earlyStart, int earlyFinish,
                            int lateStart, int lateFinish,
                            int slack) {

    /** Zero slack: any delay moves the project end. */
    public boolean critical() {
        return slack == 0;
    }

    /** True while {@code time} is inside [ES, EF). */
    public boolean activeAt(int time) {
        return time >= earlyStart && time < earlyFinish;
    }
}
