package com.hcltech.cpm.dag;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hcltech.cpm.dag.TestTaskFixture.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * TaskGraphBuilder tests:
 * - successors are the exact inverse of dependencies
 * - sources and sinks
 * - unknown references and duplicates fail with their kind
 * - validate() reports every problem at once
 */
class TaskGraphBuilderTest {

    @Test
    void diamond_successorsAreInverseOfDependencies() {
        TaskGraph g = TaskGraphBuilder.build(diamond());
        int a = g.handleOf("a"), b = g.handleOf("b"), c = g.handleOf("c"), d = g.handleOf("d");

        assertEquals(List.of(b, c), g.successors(a));
        assertEquals(List.of(d), g.successors(b));
        assertEquals(List.of(d), g.successors(c));
        assertEquals(List.of(), g.successors(d));
        assertEquals(List.of(b, c), g.dependencies(d));
        assertEquals(4, g.edgeCount());

        for (int x = 0; x < g.size(); x++) {
            for (int y = 0; y < g.size(); y++) {
                assertEquals(g.successors(x).contains(y), g.dependencies(y).contains(x),
                        g.id(x) + " / " + g.id(y));
            }
        }
    }

    @Test
    void sourcesAndSinks() {
        TaskGraph g = TaskGraphBuilder.build(diamond());
        assertTrue(g.isSource(g.handleOf("a")));
        assertFalse(g.isSource(g.handleOf("d")));
        assertTrue(g.isSink(g.handleOf("d")));
        assertFalse(g.isSink(g.handleOf("b")));
    }

    @Test
    void unknownDependency_isNotFound_namingBothTasks() {
        var ex = assertThrows(TaskNotFoundException.class,
                () -> TaskGraphBuilder.build(list(task("a", 1), task("b", 1, "a", "ghost"))));
        assertEquals(ErrorKind.NOT_FOUND, ex.kind());
        assertEquals("ghost", ex.identifier());
        assertTrue(ex.getMessage().contains("dependency of b"), ex.getMessage());
    }

    @Test
    void duplicateIdentifier_isRejected() {
        var ex = assertThrows(DuplicateTaskException.class,
                () -> TaskGraphBuilder.build(list(task("a", 1), task("a", 2))));
        assertEquals("a", ex.identifier());
    }

    @Test
    void emptyInput_buildsEmptyGraph() {
        TaskGraph g = TaskGraphBuilder.build(List.of());
        assertEquals(0, g.size());
        assertEquals(0, g.edgeCount());
    }

    @Test
    void forwardReferencesAreResolved() {
        // d is declared before the tasks it depends on
        TaskGraph g = TaskGraphBuilder.build(list(task("d", 1, "a"), task("a", 1)));
        assertEquals(List.of(g.handleOf("d")), g.successors(g.handleOf("a")));
    }

    @Test
    void validate_acceptsGoodInput() {
        assertEquals(diamond(), TaskGraphBuilder.validate(diamond()).valueOrThrow());
    }

    @Test
    void validate_reportsEveryProblem() {
        var errs = TaskGraphBuilder.validate(list(
                task("a", 1),
                task("a", 2),
                task("b", 1, "b"),
                task("c", 1, "x", "y"))).errorsOrThrow();

        assertEquals(List.of(
                "Duplicate task identifier: a",
                "Task b depends on itself",
                "Task not found: x (dependency of c)",
                "Task not found: y (dependency of c)"), errs);
    }
}
