package com.lorastudio.training;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TrainingConfig(
        int loraRank,
        int loraAlpha,
        double loraDropout,
        int sequenceLength,
        int perDeviceBatchSize,
        int gradientAccumulationSteps,
        String precision,
        int epochs,
        int maxSteps,
        int saveEverySteps,
        boolean use4bit) {

    private static final Set<String> PRECISIONS = Set.of("bf16", "fp16", "fp32");

    public TrainingConfig {
        precision = precision == null ? "bf16" : precision.toLowerCase(Locale.ROOT);
    }

    public static TrainingConfig defaults() {
        return new TrainingConfig(16, 32, 0.05, 1024, 1, 8, "bf16", 2, 0, 100, true);
    }

    public boolean halfPrecision() {
        return "bf16".equals(precision) || "fp16".equals(precision);
    }

    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (loraRank < 1 || loraRank > 256) {
            problems.add("loraRank must be between 1 and 256");
        }
        if (loraAlpha < 1) {
            problems.add("loraAlpha must be positive");
        }
        if (loraDropout < 0.0 || loraDropout >= 1.0) {
            problems.add("loraDropout must be in [0, 1)");
        }
        if (sequenceLength < 128 || sequenceLength > 32768) {
            problems.add("sequenceLength must be between 128 and 32768");
        }
        if (perDeviceBatchSize < 1) {
            problems.add("perDeviceBatchSize must be positive");
        }
        if (gradientAccumulationSteps < 1) {
            problems.add("gradientAccumulationSteps must be positive");
        }
        if (!PRECISIONS.contains(precision)) {
            problems.add("precision must be one of " + PRECISIONS);
        }
        if (epochs < 1) {
            problems.add("epochs must be positive");
        }
        if (maxSteps < 0) {
            problems.add("maxSteps must not be negative");
        }
        if (saveEverySteps < 1) {
            problems.add("saveEverySteps must be positive");
        }
        return problems;
    }
}
