package com.hcltech.cpm.dag;

import java.util.ArrayList;
import java.util.List;

import static java.util.Arrays.asList;

/**
 * Reusable task sets for graph and schedule tests.
 */
public final class TestTaskFixture {

    public static TaskRecord task(String id, int duration, String... deps) {
        return TaskRecord.of(id, duration, deps);
    }

    public static List<TaskRecord> list(TaskRecord... records) {
        return new ArrayList<>(asList(records));
    }

    /** a(2); b(3) after a; c(2) after a; d(5) after b and c. Horizon 10, critical a-b-d. */
    public static List<TaskRecord> diamond() {
        return list(
                task("a", 2),
                task("b", 3, "a"),
                task("c", 2, "a"),
                task("d", 5, "b", "c"));
    }

    /** Two independent chains of different length: s1(4) -> s2(4) and t1(1) -> t2(2). */
    public static List<TaskRecord> twoChains() {
        return list(
                task("s1", 4),
                task("s2", 4, "s1"),
                task("t1", 1),
                task("t2", 2, "t1"));
    }

    /** Straight chain of {@code n} unit tasks n0 -> n1 -> ... */
    public static List<TaskRecord> chain(int n) {
        List<TaskRecord> out = new ArrayList<>(n);
        out.add(task("n0", 1));
        for (int i = 1; i < n; i++) out.add(task("n" + i, 1, "n" + (i - 1)));
        return out;
    }

    /**
     * {@code layers} stacked diamonds: each layer has two tasks that both depend on both
     * tasks of the previous layer. Path count doubles per layer.
     */
    public static List<TaskRecord> stackedDiamonds(int layers) {
        List<TaskRecord> out = new ArrayList<>();
        out.add(task("l0a", 1));
        out.add(task("l0b", 2));
        for (int i = 1; i < layers; i++) {
            String pa = "l" + (i - 1) + "a", pb = "l" + (i - 1) + "b";
            out.add(task("l" + i + "a", 1, pa, pb));
            out.add(task("l" + i + "b", 2, pa, pb));
        }
        return out;
    }

    private TestTaskFixture() {}
}
