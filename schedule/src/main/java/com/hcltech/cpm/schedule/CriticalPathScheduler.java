package com.hcltech.cpm.schedule;

import com.hcltech.cpm.dag.TaskGraph;
import com.hcltech.cpm.dag.TaskGraphBuilder;
import com.hcltech.cpm.dag.TaskRecord;
import com.hcltech.cpm.dag.Topo;
import com.hcltech.cpm.dag.TopologicalOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs the whole CPM pipeline on one record set:
 * graph, generations, forward pass, backward pass, slack.
 * Each stage consumes the complete output of the previous one. A failure at any
 * stage propagates and no schedule is returned.
 */
public final class CriticalPathScheduler {
    private static final Logger log = LoggerFactory.getLogger(CriticalPathScheduler.class);

    private final GenerationRunner runner;
    private final SinkAnchor sinkAnchor;

    public CriticalPathScheduler() {
        this(GenerationRunner.sequential(), SinkAnchor.OWN_EARLY_FINISH);
    }

    public CriticalPathScheduler(GenerationRunner runner, SinkAnchor sinkAnchor) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.sinkAnchor = Objects.requireNonNull(sinkAnchor, "sinkAnchor");
    }

    public Schedule schedule(List<TaskRecord> records) {
        TaskGraph graph = TaskGraphBuilder.build(records);
        log.debug("Loaded {} tasks with {} dependency edges", graph.size(), graph.edgeCount());

        TopologicalOrder order = Topo.generations(graph);
        log.debug("Graph is acyclic: {} generations", order.generations().size());

        ForwardPassResult forward = ForwardPass.compute(graph, order, runner);
        log.debug("Forward pass done ({}), horizon {}", runner.name(), forward.horizon());

        BackwardPassResult backward = BackwardPass.compute(forward, order, runner, sinkAnchor);
        log.debug("Backward pass done ({}), sinks anchored at {}", runner.name(), sinkAnchor);

        Schedule schedule = SlackClassifier.classify(backward);
        log.info("Scheduled {} tasks: horizon {}, critical path {}",
                schedule.size(), schedule.horizon(), String.join(" -> ", schedule.criticalPath()));
        return schedule;
    }
}
