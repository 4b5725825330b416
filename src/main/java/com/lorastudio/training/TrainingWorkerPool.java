package com.lorastudio.training;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TrainingWorkerPool {
    private static final Logger log = LoggerFactory.getLogger(TrainingWorkerPool.class);

    private final TrainingOrchestrator orchestrator;
    private final int threads;
    private final long pollIntervalMs;
    private final int maxRunsPerCycle;
    private final int maxCycles;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicLong processedRuns = new AtomicLong();
    private final AtomicLong failedCycles = new AtomicLong();

    public TrainingWorkerPool(
            TrainingOrchestrator orchestrator,
            int threads,
            long pollIntervalMs,
            int maxRunsPerCycle,
            int maxCycles) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        if (threads < 1 || maxRunsPerCycle < 1) {
            throw new IllegalArgumentException("worker.threads and worker.maxRunsPerCycle must be positive");
        }
        if (pollIntervalMs < 0 || maxCycles < 0) {
            throw new IllegalArgumentException("worker.pollIntervalMs and worker.maxCycles must not be negative");
        }
        this.threads = threads;
        this.pollIntervalMs = pollIntervalMs;
        this.maxRunsPerCycle = maxRunsPerCycle;
        this.maxCycles = maxCycles;
    }

    public void requestStop() {
        stopRequested.set(true);
    }

    public long processedRuns() {
        return processedRuns.get();
    }

    public long failedCycles() {
        return failedCycles.get();
    }

    public void runLoop() throws InterruptedException {
        List<Thread> workers = new ArrayList<>();
        for (int i = 1; i <= threads; i++) {
            int workerId = i;
            Thread worker = new Thread(() -> workerLoop(workerId), "training-worker-" + workerId);
            workers.add(worker);
            worker.start();
        }
        try {
            for (Thread worker : workers) {
                worker.join();
            }
        } catch (InterruptedException e) {
            requestStop();
            workers.forEach(Thread::interrupt);
            throw e;
        }
        log.info("worker.pool.stopped processed={} failedCycles={}", processedRuns.get(), failedCycles.get());
    }

    public int drainQueue() {
        int processed = 0;
        while (!stopRequested.get()) {
            Optional<TrainingRun> run = orchestrator.processNext();
            if (run.isEmpty()) {
                break;
            }
            processed++;
            processedRuns.incrementAndGet();
        }
        return processed;
    }

    int runCycle() {
        int processed = 0;
        while (processed < maxRunsPerCycle && !stopRequested.get()) {
            Optional<TrainingRun> run = orchestrator.processNext();
            if (run.isEmpty()) {
                break;
            }
            processed++;
            processedRuns.incrementAndGet();
            log.info("worker.run.finished runId={} state={}", run.get().id(), run.get().state());
        }
        return processed;
    }

    private void workerLoop(int workerId) {
        int cycle = 0;
        while (!stopRequested.get() && (maxCycles == 0 || cycle < maxCycles)) {
            cycle++;
            try {
                int processed = runCycle();
                log.debug("worker.cycle.completed worker={} cycle={} processed={}", workerId, cycle, processed);
            } catch (RuntimeException e) {
                failedCycles.incrementAndGet();
                log.error("worker.cycle.failed worker={} cycle={} reason={}", workerId, cycle, e.getMessage(), e);
            }
            if (stopRequested.get() || (maxCycles > 0 && cycle >= maxCycles)) {
                break;
            }
            try {
                Thread.sleep(pollIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }
}
