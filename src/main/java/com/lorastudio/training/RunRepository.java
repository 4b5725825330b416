package com.lorastudio.training;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface RunRepository {
    void insert(TrainingRun run);

    Optional<TrainingRun> find(String runId);

    List<TrainingRun> findByState(RunState state);

    List<TrainingRun> findByProject(String projectId);

    /**
     * Applies {@code update} only if the stored run is still in {@code expectedState}.
     *
     * @return the stored result, or empty if the run is missing or its state moved on
     */
    Optional<TrainingRun> compareAndSet(
            String runId,
            RunState expectedState,
            UnaryOperator<TrainingRun> update,
            Map<String, String> eventDetails);

    default Optional<TrainingRun> compareAndSet(String runId, RunState expectedState, UnaryOperator<TrainingRun> update) {
        return compareAndSet(runId, expectedState, update, Map.of());
    }

    List<RunEvent> events(String runId);
}
