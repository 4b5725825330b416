package com.lorastudio.evaluation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.lorastudio.dataset.HeldOutExample;

public class EvaluationEngine {
    private static final Logger log = LoggerFactory.getLogger(EvaluationEngine.class);
    private static final double LOW_SIMILARITY = 0.65;
    private static final double UNSUPPORTED_NOVELTY = 0.4;

    private final EvaluationPolicy policy;
    private final ResponsePredictor predictor;
    private final EvaluationReportRepository reports;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public EvaluationEngine(EvaluationPolicy policy, ResponsePredictor predictor, EvaluationReportRepository reports) {
        this(policy, predictor, reports, Clock.systemUTC());
    }

    EvaluationEngine(
            EvaluationPolicy policy,
            ResponsePredictor predictor,
            EvaluationReportRepository reports,
            Clock clock) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.predictor = Objects.requireNonNull(predictor, "predictor");
        this.reports = Objects.requireNonNull(reports, "reports");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.objectMapper = JsonMapper.builder().findAndAddModules().build();
    }

    public EvaluationReport evaluate(
            String runId,
            String projectId,
            Path checkpointPath,
            List<HeldOutExample> heldOutExamples,
            EvaluationReport priorActiveReport,
            Path reportDirectory) throws IOException {
        if (heldOutExamples == null || heldOutExamples.isEmpty()) {
            throw new IllegalArgumentException("No held-out examples available for run " + runId);
        }

        int exact = 0;
        int fuzzyHits = 0;
        double fuzzyTotal = 0.0;
        double semanticTotal = 0.0;
        int refusalCorrect = 0;
        int refusalTruePositive = 0;
        int refusalFalsePositive = 0;
        int refusalFalseNegative = 0;
        int unsupported = 0;
        long predictedTokens = 0;
        long elapsedNanos = 0;
        List<FailingExample> failures = new ArrayList<>();

        for (HeldOutExample example : heldOutExamples) {
            long started = System.nanoTime();
            String predicted = predictor.predict(checkpointPath, example);
            elapsedNanos += System.nanoTime() - started;
            predicted = predicted == null ? "" : predicted;
            predictedTokens += TextSimilarity.tokens(predicted).size();

            String expected = example.output();
            if (predicted.strip().equals(expected.strip())) {
                exact++;
            }
            double ratio = TextSimilarity.editRatio(expected, predicted);
            fuzzyTotal += ratio;
            if (ratio >= policy.fuzzyMatchThreshold()) {
                fuzzyHits++;
            }
            double semantic = TextSimilarity.cosine(expected, predicted);
            semanticTotal += semantic;

            boolean predictedRefusal = TextSimilarity.isRefusal(predicted);
            if (predictedRefusal == example.expectedRefusal()) {
                refusalCorrect++;
            }
            if (example.expectedRefusal() && predictedRefusal) {
                refusalTruePositive++;
            } else if (!example.expectedRefusal() && predictedRefusal) {
                refusalFalsePositive++;
            } else if (example.expectedRefusal()) {
                refusalFalseNegative++;
            }

            // refusals make no factual claims
            boolean unsupportedClaim = !predictedRefusal
                    && TextSimilarity.novelTokenShare(predicted, expected, example.context()) > UNSUPPORTED_NOVELTY;
            if (unsupportedClaim) {
                unsupported++;
            }
            if (semantic < LOW_SIMILARITY || unsupportedClaim) {
                failures.add(new FailingExample(
                        example.id(),
                        example.instruction(),
                        expected,
                        predicted,
                        round(semantic),
                        semantic < LOW_SIMILARITY ? "low_similarity" : "unsupported_claim"));
            }
        }

        int n = heldOutExamples.size();
        double semanticSimilarity = semanticTotal / n;
        double seconds = Math.max(elapsedNanos / 1_000_000_000.0, 1e-6);
        Double regressionDelta = priorActiveReport == null
                ? null
                : round(semanticSimilarity - priorActiveReport.metrics().semanticSimilarity());
        boolean regressionFlagged = regressionDelta != null && regressionDelta < -policy.regressionTolerance();

        EvaluationMetrics metrics = new EvaluationMetrics(
                round((double) exact / n),
                round((double) fuzzyHits / n),
                round(fuzzyTotal / n),
                round(semanticSimilarity),
                round((double) refusalCorrect / n),
                round((double) refusalTruePositive / Math.max(refusalTruePositive + refusalFalsePositive, 1)),
                round((double) refusalTruePositive / Math.max(refusalTruePositive + refusalFalseNegative, 1)),
                round((double) unsupported / n),
                elapsedNanos / 1_000_000L / n,
                Math.round(predictedTokens / seconds * 100.0) / 100.0,
                regressionDelta,
                regressionFlagged,
                n);

        List<String> gateFailures = gate(metrics);
        List<FailingExample> worst = failures.stream()
                .sorted(Comparator.comparingDouble(FailingExample::semanticSimilarity))
                .limit(policy.maxFailureExamples())
                .toList();

        String reportId = "eval-" + UUID.randomUUID();
        Path reportPath = null;
        if (reportDirectory != null) {
            Files.createDirectories(reportDirectory);
            reportPath = reportDirectory.resolve("eval-report.json");
        }
        EvaluationReport report = new EvaluationReport(
                reportId,
                runId,
                projectId,
                clock.instant(),
                metrics,
                gateFailures.isEmpty(),
                gateFailures,
                worst,
                reportPath == null ? null : reportPath.toString());
        if (reportPath != null) {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), report);
        }
        reports.save(report);

        log.info("evaluation.completed run={} report={} go={} semantic={} unsupported={} refusal={}",
                runId, reportId, report.goNoGo(), metrics.semanticSimilarity(), metrics.unsupportedClaimRate(),
                metrics.refusalAccuracy());
        return report;
    }

    List<String> gate(EvaluationMetrics metrics) {
        List<String> failures = new ArrayList<>();
        if (metrics.semanticSimilarity() < policy.minSemanticSimilarity()) {
            failures.add(String.format(Locale.ROOT,
                    "Semantic similarity below minimum (actual=%.4f, min=%.4f, delta=-%.4f)",
                    metrics.semanticSimilarity(),
                    policy.minSemanticSimilarity(),
                    policy.minSemanticSimilarity() - metrics.semanticSimilarity()));
        }
        if (metrics.unsupportedClaimRate() > policy.maxUnsupportedClaimRate()) {
            failures.add(String.format(Locale.ROOT,
                    "Unsupported claim rate threshold exceeded (actual=%.4f, max=%.4f, delta=+%.4f)",
                    metrics.unsupportedClaimRate(),
                    policy.maxUnsupportedClaimRate(),
                    metrics.unsupportedClaimRate() - policy.maxUnsupportedClaimRate()));
        }
        if (metrics.refusalAccuracy() < policy.minRefusalAccuracy()) {
            failures.add(String.format(Locale.ROOT,
                    "Refusal accuracy below minimum (actual=%.4f, min=%.4f, delta=-%.4f)",
                    metrics.refusalAccuracy(),
                    policy.minRefusalAccuracy(),
                    policy.minRefusalAccuracy() - metrics.refusalAccuracy()));
        }
        if (metrics.regressionFlagged()) {
            failures.add(String.format(Locale.ROOT,
                    "Semantic similarity regressed against active version (delta=%.4f, tolerance=%.4f)",
                    metrics.regressionDelta(),
                    policy.regressionTolerance()));
        }
        return failures;
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
