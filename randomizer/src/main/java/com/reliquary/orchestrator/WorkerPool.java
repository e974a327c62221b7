package com.reliquary.orchestrator;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of daemon threads running placement workers, one thread per worker.
 */
@Slf4j
public class WorkerPool {

    private static final AtomicInteger POOL_IDS = new AtomicInteger();

    private final ExecutorService executor;

    public WorkerPool(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Worker pool needs at least one thread: " + size);
        }
        int poolId = POOL_IDS.incrementAndGet();
        AtomicInteger threadIds = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "Reliquary-Worker-" + poolId + "-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.executor = Executors.newFixedThreadPool(size, tf);
        log.debug("WorkerPool initialized with {} threads", size);
    }

    public void execute(Runnable task) {
        executor.execute(task);
    }

    /**
     * Stop accepting work. Running workers exit on their own once cancelled.
     */
    public void shutdown() {
        executor.shutdown();
    }
}
