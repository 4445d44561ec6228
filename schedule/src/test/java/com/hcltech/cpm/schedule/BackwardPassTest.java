package com.hcltech.cpm.schedule;

import com.hcltech.cpm.dag.ErrorKind;
import com.hcltech.cpm.dag.TaskGraph;
import com.hcltech.cpm.dag.TaskGraphBuilder;
import com.hcltech.cpm.dag.Topo;
import com.hcltech.cpm.dag.TopologicalOrder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hcltech.cpm.schedule.ScheduleFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class BackwardPassTest {

    @Test
    void diamond_lateStartsAndFinishes() {
        BackwardPassResult b = backward(diamond(), SinkAnchor.OWN_EARLY_FINISH);

        assertEquals(0, b.lateStart("a"));
        assertEquals(2, b.lateFinish("a"));
        assertEquals(2, b.lateStart("b"));
        assertEquals(5, b.lateFinish("b"));
        assertEquals(3, b.lateStart("c"), "c may start one unit late");
        assertEquals(5, b.lateFinish("c"));
        assertEquals(5, b.lateStart("d"));
        assertEquals(10, b.lateFinish("d"));
    }

    @Test
    void sinksFinishAtTheirOwnEarlyFinishByDefault() {
        BackwardPassResult b = backward(twoChains(), SinkAnchor.OWN_EARLY_FINISH);
        assertEquals(8, b.lateFinish("s2"));
        assertEquals(3, b.lateFinish("t2"));
        assertEquals(0, b.lateStart("t1"));
    }

    @Test
    void sinksFinishAtHorizonWhenAnchoredThere() {
        BackwardPassResult b = backward(twoChains(), SinkAnchor.PROJECT_HORIZON);
        assertEquals(8, b.lateFinish("s2"));
        assertEquals(8, b.lateFinish("t2"));
        assertEquals(6, b.lateStart("t2"));
        assertEquals(5, b.lateStart("t1"));
    }

    @Test
    void lateFinishIsEarliestSuccessorLateStart() {
        BackwardPassResult b = backward(randomDag(3, 70), SinkAnchor.OWN_EARLY_FINISH);
        TaskGraph g = b.graph();
        for (int h = 0; h < g.size(); h++) {
            assertEquals(g.duration(h), b.lateFinish(h) - b.lateStart(h), g.id(h));
            if (g.isSink(h)) {
                assertEquals(b.forward().earlyFinish(h), b.lateFinish(h), g.id(h));
            } else {
                int min = Integer.MAX_VALUE;
                for (int s : g.successors(h)) min = Math.min(min, b.lateStart(s));
                assertEquals(min, b.lateFinish(h), g.id(h));
            }
        }
    }

    @Test
    void successorNotYetComputed_isUnderdetermined() {
        TaskGraph g = TaskGraphBuilder.build(diamond());
        TopologicalOrder good = Topo.generations(g);
        ForwardPassResult fwd = ForwardPass.compute(g, good, GenerationRunner.sequential());

        // reversed() of this runs a before d has a late finish
        TopologicalOrder wrong = new TopologicalOrder(List.of(
                List.of(g.handleOf("d")), List.of(g.handleOf("b"), g.handleOf("c")), List.of(g.handleOf("a"))));

        var ex = assertThrows(BackwardPassUnderdeterminedException.class,
                () -> BackwardPass.compute(fwd, wrong, GenerationRunner.sequential(), SinkAnchor.OWN_EARLY_FINISH));
        assertEquals(ErrorKind.BACKWARD_PASS_UNDERDETERMINED, ex.kind());
        assertEquals("a", ex.identifier());
        assertTrue(ex.getMessage().contains("successor b"), ex.getMessage());
    }

    @Test
    void lateFinishNeverPassesHorizon() {
        BackwardPassResult b = backward(randomDag(5, 50), SinkAnchor.OWN_EARLY_FINISH);
        for (int h = 0; h < b.graph().size(); h++) {
            assertTrue(b.lateFinish(h) <= b.forward().horizon());
        }
    }

    @Test
    void sinkFinishingAtIntMaxStillResolvesItsDependencies() {
        BackwardPassResult b = backward(list(task("a", 0), task("b", Integer.MAX_VALUE, "a")), SinkAnchor.OWN_EARLY_FINISH);
        assertEquals(Integer.MAX_VALUE, b.lateFinish("b"));
        assertEquals(0, b.lateStart("b"));
        assertEquals(0, b.lateFinish("a"));
        assertEquals(0, b.lateStart("a"));
    }
}
