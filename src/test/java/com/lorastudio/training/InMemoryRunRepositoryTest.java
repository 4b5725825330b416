package com.lorastudio.training;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryRunRepositoryTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final InMemoryRunRepository repository = new InMemoryRunRepository();

    @Test
    void shouldApplyUpdateOnlyFromExpectedState() {
        repository.insert(run("run-1", NOW));

        Optional<TrainingRun> stale = repository.compareAndSet("run-1", RunState.TRAINING,
                run -> run.withState(RunState.EVALUATING, "skip", NOW));
        Optional<TrainingRun> claimed = repository.compareAndSet("run-1", RunState.QUEUED,
                run -> run.withState(RunState.PREFLIGHT, "claimed", NOW), Map.of("worker", "w1"));

        assertTrue(stale.isEmpty());
        assertEquals(RunState.PREFLIGHT, claimed.orElseThrow().state());
        List<RunEvent> events = repository.events("run-1");
        assertEquals(2, events.size());
        assertNull(events.get(0).fromState());
        assertEquals(2L, events.get(1).sequence());
        assertEquals("w1", events.get(1).details().get("worker"));
    }

    @Test
    void shouldRejectIllegalTransitionWithoutWriting() {
        repository.insert(run("run-1", NOW));

        assertThrows(InvalidStateTransitionException.class, () -> repository.compareAndSet("run-1", RunState.QUEUED,
                run -> run.withState(RunState.READY, "jump", NOW)));

        assertEquals(RunState.QUEUED, repository.find("run-1").orElseThrow().state());
        assertEquals(1, repository.events("run-1").size());
    }

    @Test
    void shouldNotRecordEventForSameStateUpdate() {
        repository.insert(run("run-1", NOW));

        repository.compareAndSet("run-1", RunState.QUEUED, run -> run.withVramEstimate(3.1));

        assertEquals(3.1, repository.find("run-1").orElseThrow().vramEstimateGb());
        assertEquals(1, repository.events("run-1").size());
    }

    @Test
    void shouldListQueuedRunsOldestFirst() {
        repository.insert(run("run-late", NOW.plusSeconds(60)));
        repository.insert(run("run-early", NOW));

        assertEquals(List.of("run-early", "run-late"),
                repository.findByState(RunState.QUEUED).stream().map(TrainingRun::id).toList());
        assertThrows(IllegalStateException.class, () -> repository.insert(run("run-early", NOW)));
    }

    @Test
    void shouldLetOnlyOneConcurrentWriterWinTheSameTransition() throws Exception {
        repository.insert(run("run-1", NOW));
        int writers = 16;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return repository.compareAndSet("run-1", RunState.QUEUED,
                            run -> run.withState(RunState.PREFLIGHT, "claimed", NOW)).isPresent();
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            executor.shutdownNow();
        }
        assertEquals(2, repository.events("run-1").size());
    }

    static TrainingRun run(String id, Instant createdAt) {
        return TrainingRun.queued(id, "tenant-a", "project-1", "ds-1", "alice", "base-7b",
                TrainingConfig.defaults(), createdAt);
    }
}
