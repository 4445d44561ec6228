package com.hcltech.cpm.schedule;

import com.hcltech.cpm.common.async.ExecutorServiceFactory;
import com.hcltech.cpm.dag.ErrorKind;
import com.hcltech.cpm.dag.TaskRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;

import static com.hcltech.cpm.schedule.ScheduleFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class GenerationRunnerTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = ExecutorServiceFactory.fixed().create(4, "cpm-test");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void sequentialVisitsGenerationsInOrder() {
        var seen = new ConcurrentLinkedQueue<Integer>();
        GenerationRunner.sequential().run(List.of(List.of(0, 1), List.of(2), List.of(3, 4)), seen::add);
        assertEquals(List.of(0, 1, 2, 3, 4), List.copyOf(seen));
    }

    @Test
    void parallelFinishesEachGenerationBeforeTheNext() {
        var seen = new ConcurrentLinkedQueue<Integer>();
        GenerationRunner.parallel(executor).run(List.of(List.of(0, 1, 2), List.of(3, 4), List.of(5)), seen::add);

        List<Integer> order = List.copyOf(seen);
        assertEquals(6, order.size());
        assertTrue(order.subList(0, 3).containsAll(List.of(0, 1, 2)), order.toString());
        assertTrue(order.subList(3, 5).containsAll(List.of(3, 4)), order.toString());
        assertEquals(5, order.get(5));
    }

    @Test
    void parallelScheduleEqualsSequentialSchedule() {
        for (long seed = 1; seed <= 10; seed++) {
            List<TaskRecord> records = randomDag(seed, 120);
            Schedule seq = new CriticalPathScheduler().schedule(records);
            Schedule par = new CriticalPathScheduler(GenerationRunner.parallel(executor), SinkAnchor.OWN_EARLY_FINISH)
                    .schedule(records);
            assertEquals(seq.tasks(), par.tasks(), "seed " + seed);
            assertEquals(seq.criticalPath(), par.criticalPath(), "seed " + seed);
        }
    }

    @Test
    void parallelRethrowsWorkerFailureUnwrapped() {
        GenerationRunner runner = GenerationRunner.parallel(executor);
        var ex = assertThrows(BackwardPassUnderdeterminedException.class, () -> runner.run(List.of(List.of(0, 1)), h -> {
            throw new BackwardPassUnderdeterminedException("t" + h, "x");
        }));
        assertEquals(ErrorKind.BACKWARD_PASS_UNDERDETERMINED, ex.kind());
    }
}
