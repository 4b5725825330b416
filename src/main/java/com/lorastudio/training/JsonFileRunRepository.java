package com.lorastudio.training;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.lorastudio.store.JsonFileStore;

public class JsonFileRunRepository implements RunRepository {
    private static final Logger log = LoggerFactory.getLogger(JsonFileRunRepository.class);
    private static final TypeReference<List<TrainingRun>> RUN_LIST = new TypeReference<>() {
    };
    private static final Comparator<TrainingRun> OLDEST_FIRST =
            Comparator.comparing(TrainingRun::createdAt).thenComparing(TrainingRun::id);

    private final JsonFileStore<List<TrainingRun>> registry;
    private final Path eventsPath;
    private final ObjectMapper objectMapper;

    public JsonFileRunRepository(Path runsPath, Path eventsPath) {
        this.eventsPath = Objects.requireNonNull(eventsPath, "eventsPath");
        this.objectMapper = JsonMapper.builder().findAndAddModules().build();
        this.registry = new JsonFileStore<>(Objects.requireNonNull(runsPath, "runsPath"), RUN_LIST, List::of, objectMapper);
        log.info("runs.opened path={} count={}", registry.path(), registry.read().size());
    }

    @Override
    public void insert(TrainingRun run) {
        Objects.requireNonNull(run, "run");
        if (run.state() != RunState.QUEUED) {
            throw new IllegalArgumentException("New runs must start QUEUED, got " + run.state());
        }
        registry.locked(() -> {
            List<TrainingRun> runs = registry.load();
            if (runs.stream().anyMatch(existing -> existing.id().equals(run.id()))) {
                throw new IllegalStateException("Run already exists: " + run.id());
            }
            List<TrainingRun> updated = new ArrayList<>(runs);
            updated.add(run);
            commit(runs, updated, new RunEvent(run.id(), 1, null, RunState.QUEUED, run.createdAt(),
                    run.stateMessage(), Map.of()));
            return run;
        });
    }

    @Override
    public Optional<TrainingRun> find(String runId) {
        return registry.read().stream().filter(run -> run.id().equals(runId)).findFirst();
    }

    @Override
    public List<TrainingRun> findByState(RunState state) {
        return select(run -> run.state() == state);
    }

    @Override
    public List<TrainingRun> findByProject(String projectId) {
        return select(run -> Objects.equals(run.projectId(), projectId));
    }

    @Override
    public Optional<TrainingRun> compareAndSet(
            String runId,
            RunState expectedState,
            UnaryOperator<TrainingRun> update,
            Map<String, String> eventDetails) {
        return registry.locked(() -> {
            List<TrainingRun> runs = registry.load();
            int index = indexOf(runs, runId);
            if (index < 0 || runs.get(index).state() != expectedState) {
                return Optional.empty();
            }
            TrainingRun current = runs.get(index);
            TrainingRun updated = Objects.requireNonNull(update.apply(current), "updated run");
            RunEvent event = null;
            if (updated.state() != current.state()) {
                if (!current.state().canTransitionTo(updated.state())) {
                    throw new InvalidStateTransitionException(runId, current.state(), "move to " + updated.state());
                }
                event = new RunEvent(runId, readEvents(runId).size() + 1L, current.state(), updated.state(),
                        updated.updatedAt(), updated.stateMessage(), eventDetails);
            }
            List<TrainingRun> next = new ArrayList<>(runs);
            next.set(index, updated);
            commit(runs, next, event);
            return Optional.of(updated);
        });
    }

    @Override
    public List<RunEvent> events(String runId) {
        return registry.locked(() -> readEvents(runId));
    }

    protected void appendEvent(RunEvent event) throws IOException {
        if (eventsPath.getParent() != null) {
            Files.createDirectories(eventsPath.getParent());
        }
        Files.writeString(
                eventsPath,
                objectMapper.writeValueAsString(event) + System.lineSeparator(),
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND);
    }

    // the snapshot is put back if the event cannot be appended, so the log never disagrees with the registry
    private void commit(List<TrainingRun> before, List<TrainingRun> after, RunEvent event) throws IOException {
        registry.store(after);
        if (event == null) {
            return;
        }
        try {
            appendEvent(event);
        } catch (IOException | RuntimeException e) {
            try {
                registry.store(before);
            } catch (IOException restoreFailure) {
                e.addSuppressed(restoreFailure);
            }
            log.error("runs.event_append_failed runId={} toState={}", event.runId(), event.toState(), e);
            throw e;
        }
    }

    private List<TrainingRun> select(Predicate<TrainingRun> filter) {
        return registry.read().stream().filter(filter).sorted(OLDEST_FIRST).toList();
    }

    private List<RunEvent> readEvents(String runId) throws IOException {
        if (!Files.exists(eventsPath)) {
            return List.of();
        }
        List<RunEvent> history = new ArrayList<>();
        for (String line : Files.readAllLines(eventsPath, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                RunEvent event = objectMapper.readValue(line, RunEvent.class);
                if (event.runId().equals(runId)) {
                    history.add(event);
                }
            }
        }
        return history;
    }

    private static int indexOf(List<TrainingRun> runs, String runId) {
        for (int i = 0; i < runs.size(); i++) {
            if (runs.get(i).id().equals(runId)) {
                return i;
            }
        }
        return -1;
    }
}
