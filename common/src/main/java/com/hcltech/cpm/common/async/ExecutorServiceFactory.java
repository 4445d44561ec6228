package com.hcltech.cpm.common.async;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pluggable factory for creating ExecutorService instances.
 *
 * Example:
 *   ExecutorServiceFactory f = ExecutorServiceFactory.fixed();
 *   ExecutorService pass = f.create(4, "cpm-pass");
 */
public interface ExecutorServiceFactory {

    /**
     * Create an executor appropriate for the given level of concurrency.
     * @param threads             desired concurrency; values below 1 are treated as 1
     * @param threadNamePrefix    prefix for thread names
     */
    ExecutorService create(int threads, String threadNamePrefix);

    /** Human-friendly name, e.g. "fixed". */
    default String name() { return getClass().getSimpleName(); }

    /** Always create a fixed thread pool (daemon threads). */
    static ExecutorServiceFactory fixed() {
        return new FixedImpl();
    }

    final class FixedImpl implements ExecutorServiceFactory {
        @Override
        public ExecutorService create(int threads, String prefix) {
            int n = Math.max(1, threads);
            return Executors.newFixedThreadPool(n, namedDaemon(Objects.requireNonNullElse(prefix, "pool")));
        }

        @Override public String name() { return "fixed"; }

        private static ThreadFactory namedDaemon(String prefix) {
            AtomicInteger seq = new AtomicInteger(1);
            return r -> {
                Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            };
        }
    }
}
