package com.hcltech.cpm.schedule;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.IntConsumer;

/**
 * Applies per-task work generation by generation. A generation is never started
 * before every task of the previous one has finished.
 *
 * Use the static helpers:
 *   - GenerationRunner.sequential()
 *   - GenerationRunner.parallel(executor)
 */
public interface GenerationRunner {

    void run(List<List<Integer>> generations, IntConsumer work);

    default String name() { return getClass().getSimpleName(); }

    static GenerationRunner sequential() {
        return new Sequential();
    }

    /**
     * Tasks inside one generation run concurrently on {@code executor}. Joining every
     * future before the next generation publishes their writes to later readers.
     * The executor is not shut down.
     */
    static GenerationRunner parallel(ExecutorService executor) {
        return new Parallel(executor);
    }

    final class Sequential implements GenerationRunner {
        @Override
        public void run(List<List<Integer>> generations, IntConsumer work) {
            for (List<Integer> generation : generations) {
                for (int handle : generation) work.accept(handle);
            }
        }

        @Override public String name() { return "sequential"; }
    }

    final class Parallel implements GenerationRunner {
        private final ExecutorService executor;

        Parallel(ExecutorService executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
        }

        @Override
        public void run(List<List<Integer>> generations, IntConsumer work) {
            for (List<Integer> generation : generations) {
                if (generation.size() == 1) {
                    work.accept(generation.get(0));
                    continue;
                }
                List<Callable<Void>> jobs = new ArrayList<>(generation.size());
                for (int handle : generation) {
                    jobs.add(() -> {
                        work.accept(handle);
                        return null;
                    });
                }
                joinAll(invokeAll(jobs));
            }
        }

        @Override public String name() { return "parallel"; }

        private List<Future<Void>> invokeAll(List<Callable<Void>> jobs) {
            try {
                return executor.invokeAll(jobs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while computing a generation", e);
            }
        }

        private static void joinAll(List<Future<Void>> futures) {
            for (Future<Void> f : futures) {
                try {
                    f.get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while computing a generation", e);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException re) throw re;
                    if (cause instanceof Error err) throw err;
                    throw new IllegalStateException("Generation work failed", cause);
                }
            }
        }
    }
}
