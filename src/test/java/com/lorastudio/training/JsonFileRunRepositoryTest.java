package com.lorastudio.training;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileRunRepositoryTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void shouldReloadRunsAndEventsAfterRestart() throws Exception {
        Path runsPath = tempDir.resolve("registry/runs.json");
        Path eventsPath = tempDir.resolve("registry/run-events.jsonl");

        JsonFileRunRepository first = new JsonFileRunRepository(runsPath, eventsPath);
        first.insert(InMemoryRunRepositoryTest.run("run-1", NOW));
        first.compareAndSet("run-1", RunState.QUEUED, run -> run.withState(RunState.PREFLIGHT, "claimed", NOW));
        first.compareAndSet("run-1", RunState.PREFLIGHT, run -> run.withVramEstimate(2.36));

        assertTrue(Files.exists(runsPath));
        JsonFileRunRepository reloaded = new JsonFileRunRepository(runsPath, eventsPath);

        TrainingRun run = reloaded.find("run-1").orElseThrow();
        assertEquals(RunState.PREFLIGHT, run.state());
        assertEquals(2.36, run.vramEstimateGb());
        assertEquals(TrainingConfig.defaults(), run.config());
        assertEquals(2, reloaded.events("run-1").size());
        assertEquals(RunState.PREFLIGHT, reloaded.events("run-1").get(1).toState());
    }

    @Test
    void shouldSeeRunsSubmittedThroughAnotherInstanceAndKeepThemOnWrite() {
        JsonFileRunRepository worker = repository();
        worker.insert(InMemoryRunRepositoryTest.run("run-old", NOW));
        JsonFileRunRepository submitter = repository();

        submitter.insert(InMemoryRunRepositoryTest.run("run-new", NOW.plusSeconds(60)));
        worker.compareAndSet("run-old", RunState.QUEUED, run -> run.withState(RunState.PREFLIGHT, "claimed", NOW));

        assertEquals(List.of("run-new"), worker.findByState(RunState.QUEUED).stream().map(TrainingRun::id).toList());
        assertEquals(RunState.QUEUED, submitter.find("run-new").orElseThrow().state());
        assertEquals(RunState.PREFLIGHT, submitter.find("run-old").orElseThrow().state());
        assertEquals(2, repository().findByProject("project-1").size());
    }

    @Test
    void shouldRejectConditionalWriteAfterCancelFromAnotherInstance() {
        JsonFileRunRepository worker = repository();
        worker.insert(InMemoryRunRepositoryTest.run("run-1", NOW));
        worker.compareAndSet("run-1", RunState.QUEUED, run -> run.withState(RunState.PREFLIGHT, "claimed", NOW));
        JsonFileRunRepository operator = repository();

        assertTrue(operator.compareAndSet("run-1", RunState.PREFLIGHT,
                run -> run.withState(RunState.CANCELLED, "cancelled", NOW)).isPresent());
        Optional<TrainingRun> staging = worker.compareAndSet("run-1", RunState.PREFLIGHT,
                run -> run.withState(RunState.STAGING, "staging", NOW));

        assertFalse(staging.isPresent());
        assertEquals(RunState.CANCELLED, repository().find("run-1").orElseThrow().state());
        assertEquals(List.of(1L, 2L, 3L), worker.events("run-1").stream().map(RunEvent::sequence).toList());
    }

    @Test
    void shouldLeaveRunAndTimelineUntouchedWhenEventAppendFails() {
        FailingEventsRepository failing = new FailingEventsRepository(
                tempDir.resolve("runs.json"), tempDir.resolve("run-events.jsonl"));
        failing.insert(InMemoryRunRepositoryTest.run("run-1", NOW));
        failing.failAppends = true;

        assertThrows(UncheckedIOException.class, () -> failing.compareAndSet("run-1", RunState.QUEUED,
                run -> run.withState(RunState.PREFLIGHT, "claimed", NOW)));

        JsonFileRunRepository reloaded = repository();
        assertEquals(RunState.QUEUED, reloaded.find("run-1").orElseThrow().state());
        assertEquals(1, reloaded.events("run-1").size());
        assertEquals(RunState.QUEUED, failing.find("run-1").orElseThrow().state());
    }

    private JsonFileRunRepository repository() {
        return new JsonFileRunRepository(tempDir.resolve("runs.json"), tempDir.resolve("run-events.jsonl"));
    }

    private static final class FailingEventsRepository extends JsonFileRunRepository {
        private boolean failAppends;

        FailingEventsRepository(Path runsPath, Path eventsPath) {
            super(runsPath, eventsPath);
        }

        @Override
        protected void appendEvent(RunEvent event) throws IOException {
            if (failAppends) {
                throw new IOException("disk full");
            }
            super.appendEvent(event);
        }
    }
}
