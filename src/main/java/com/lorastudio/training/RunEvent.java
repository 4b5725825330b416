package com.lorastudio.training;

import java.time.Instant;
import java.util.Map;

public record RunEvent(
        String runId,
        long sequence,
        RunState fromState,
        RunState toState,
        Instant timestamp,
        String message,
        Map<String, String> details) {

    public RunEvent {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
