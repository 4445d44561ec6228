package com.hcltech.cpm.schedule;

import com.hcltech.cpm.dag.TaskNotFoundException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Gantt-like view: one cell per time unit in [0, horizon) for every task. */
public final class Timeline {
    private final int horizon;
    private final Map<String, List<TimelineCell>> rows;

    private Timeline(int horizon, Map<String, List<TimelineCell>> rows) {
        this.horizon = horizon;
        this.rows = rows;
    }

    public static Timeline of(Schedule schedule) {
        Map<String, List<TimelineCell>> rows = new LinkedHashMap<>();
        for (ScheduledTask task : schedule.tasks()) {
            List<TimelineCell> cells = new ArrayList<>(schedule.horizon());
            for (int t = 0; t < schedule.horizon(); t++) cells.add(TimelineCell.at(task, t));
            rows.put(task.id(), List.copyOf(cells));
        }
        return new Timeline(schedule.horizon(), rows);
    }

    public int horizon() { return horizon; }

    /** Task identifiers in schedule order. */
    public List<String> taskIds() {
        return List.copyOf(rows.keySet());
    }

    public List<TimelineCell> cells(String id) {
        List<TimelineCell> cells = rows.get(id);
        if (cells == null) throw new TaskNotFoundException(id);
        return cells;
    }

    /** Cells as their symbols, e.g. "OOXXOOOOOO". */
    public String symbols(String id) {
        StringBuilder sb = new StringBuilder(horizon);
        for (TimelineCell c : cells(id)) sb.append(c.symbol());
        return sb.toString();
    }
}
