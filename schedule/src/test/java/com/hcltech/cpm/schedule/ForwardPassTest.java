package com.hcltech.cpm.schedule;

import com.hcltech.cpm.dag.TaskGraph;
import com.hcltech.cpm.dag.TaskGraphBuilder;
import com.hcltech.cpm.dag.TopologicalOrder;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.hcltech.cpm.schedule.ScheduleFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class ForwardPassTest {

    @Test
    void diamond_earlyStartsAndFinishes() {
        ForwardPassResult f = forward(diamond());

        assertEquals(0, f.earlyStart("a"));
        assertEquals(2, f.earlyFinish("a"));
        assertEquals(2, f.earlyStart("b"));
        assertEquals(5, f.earlyFinish("b"));
        assertEquals(2, f.earlyStart("c"));
        assertEquals(4, f.earlyFinish("c"));
        assertEquals(5, f.earlyStart("d"), "d waits for the later of b and c");
        assertEquals(10, f.earlyFinish("d"));
        assertEquals(10, f.horizon());
    }

    @Test
    void everySourceStartsAtZero() {
        ForwardPassResult f = forward(randomDag(7, 60));
        TaskGraph g = f.graph();
        for (int h = 0; h < g.size(); h++) {
            if (g.isSource(h)) assertEquals(0, f.earlyStart(h), g.id(h));
            assertEquals(g.duration(h), f.earlyFinish(h) - f.earlyStart(h), g.id(h));
        }
    }

    @Test
    void startsNoEarlierThanAnyDependencyFinishes() {
        ForwardPassResult f = forward(randomDag(11, 80));
        TaskGraph g = f.graph();
        for (int h = 0; h < g.size(); h++) {
            int latest = 0;
            for (int d : g.dependencies(h)) latest = Math.max(latest, f.earlyFinish(d));
            assertEquals(latest, f.earlyStart(h), g.id(h));
        }
    }

    @Test
    void emptyProject_hasZeroHorizon() {
        assertEquals(0, forward(List.of()).horizon());
    }

    @Test
    void zeroDurationMilestone_takesNoTime() {
        ForwardPassResult f = forward(list(task("a", 3), task("m", 0, "a"), task("b", 2, "m")));
        assertEquals(3, f.earlyStart("m"));
        assertEquals(3, f.earlyFinish("m"));
        assertEquals(5, f.horizon());
    }

    @Test
    void wideDiamonds_areLinear() {
        // 2^200 paths; recomputing per path would never finish
        ForwardPassResult f = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> forward(stackedDiamonds(200)));
        assertEquals(2 * 199, f.earlyStart("l199a"));
        assertEquals(2 * 200, f.horizon());
    }

    @Test
    void sinkFinishPastIntRange_throwsInsteadOfWrapping() {
        assertThrows(ArithmeticException.class,
                () -> forward(list(task("a", Integer.MAX_VALUE - 1), task("b", 5, "a"))));
    }

    @Test
    void incompleteOrder_isRejected() {
        TaskGraph g = TaskGraphBuilder.build(diamond());
        TopologicalOrder partial = new TopologicalOrder(List.of(List.of(g.handleOf("a"))));
        assertThrows(IllegalArgumentException.class,
                () -> ForwardPass.compute(g, partial, GenerationRunner.sequential()));
    }
}
