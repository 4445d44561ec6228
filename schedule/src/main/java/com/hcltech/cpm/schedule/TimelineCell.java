package com.hcltech.cpm.schedule;

public enum TimelineCell {
    INACTIVE('O'),
    CRITICAL_ACTIVE('C'),
    NON_CRITICAL_ACTIVE('X');

    private final char symbol;

    TimelineCell(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() { return symbol; }

    public static TimelineCell at(ScheduledTask task, int time) {
        if (!task.activeAt(time)) return INACTIVE;
        return task.critical() ? CRITICAL_ACTIVE : NON_CRITICAL_ACTIVE;
    }
}
