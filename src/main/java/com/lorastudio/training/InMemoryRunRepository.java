package com.lorastudio.training;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

public class InMemoryRunRepository implements RunRepository {
    private final Map<String, TrainingRun> runs = new ConcurrentHashMap<>();
    private final Map<String, List<RunEvent>> events = new ConcurrentHashMap<>();

    @Override
    public void insert(TrainingRun run) {
        Objects.requireNonNull(run, "run");
        if (run.state() != RunState.QUEUED) {
            throw new IllegalArgumentException("New runs must start QUEUED, got " + run.state());
        }
        TrainingRun existing = runs.putIfAbsent(run.id(), run);
        if (existing != null) {
            throw new IllegalStateException("Run already exists: " + run.id());
        }
        record(new RunEvent(run.id(), 0, null, RunState.QUEUED, run.createdAt(), run.stateMessage(), Map.of()));
    }

    @Override
    public Optional<TrainingRun> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public List<TrainingRun> findByState(RunState state) {
        return runs.values().stream()
                .filter(run -> run.state() == state)
                .sorted(Comparator.comparing(TrainingRun::createdAt).thenComparing(TrainingRun::id))
                .toList();
    }

    @Override
    public List<TrainingRun> findByProject(String projectId) {
        return runs.values().stream()
                .filter(run -> Objects.equals(run.projectId(), projectId))
                .sorted(Comparator.comparing(TrainingRun::createdAt).thenComparing(TrainingRun::id))
                .toList();
    }

    @Override
    public Optional<TrainingRun> compareAndSet(
            String runId,
            RunState expectedState,
            UnaryOperator<TrainingRun> update,
            Map<String, String> eventDetails) {
        TrainingRun[] applied = new TrainingRun[1];
        // compute holds the entry lock, so the state check, the write and the event append are one step
        runs.computeIfPresent(runId, (id, current) -> {
            if (current.state() != expectedState) {
                return current;
            }
            TrainingRun updated = Objects.requireNonNull(update.apply(current), "updated run");
            if (updated.state() != current.state()) {
                if (!current.state().canTransitionTo(updated.state())) {
                    throw new InvalidStateTransitionException(id, current.state(), "move to " + updated.state());
                }
                record(new RunEvent(id, 0, current.state(), updated.state(), updated.updatedAt(),
                        updated.stateMessage(), eventDetails));
            }
            applied[0] = updated;
            return updated;
        });
        return Optional.ofNullable(applied[0]);
    }

    @Override
    public List<RunEvent> events(String runId) {
        List<RunEvent> history = events.get(runId);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    private void record(RunEvent event) {
        List<RunEvent> list = events.computeIfAbsent(event.runId(), id -> new ArrayList<>());
        synchronized (list) {
            RunEvent sequenced = new RunEvent(event.runId(), list.size() + 1L, event.fromState(), event.toState(),
                    event.timestamp(), event.message(), event.details());
            list.add(sequenced);
        }
    }
}
