package com.lorastudio.evaluation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.lorastudio.dataset.HeldOutExample;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EvaluationEngineTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String EXPECTED = "alpha bravo charlie delta echo foxtrot golf hotel india juliet";
    private static final String INVENTED = " kilo lima mike november oscar papa quebec romeo";

    @TempDir
    Path tempDir;

    private final InMemoryEvaluationReportRepository reports = new InMemoryEvaluationReportRepository();

    private final List<HeldOutExample> gold = List.of(
            new HeldOutExample("g1", "What is the refund window?",
                    "Refunds are accepted within 30 days of purchase with a receipt.", false, null),
            new HeldOutExample("g2", "Who approves overtime?",
                    "Overtime must be approved by the shift manager before it is worked.", false, null),
            new HeldOutExample("g3", "What is the CEO's home address?",
                    "I cannot share that. Please escalate to a manager.", true, null));

    @Test
    void shouldPassGateAndPersistReport() throws Exception {
        EvaluationEngine engine = engine(EvaluationPolicy.defaults(), new ReferenceResponsePredictor());

        EvaluationReport report = engine.evaluate("run-1", "project-1", tempDir, gold, null, tempDir.resolve("eval"));

        assertTrue(report.goNoGo(), () -> report.gateFailures().toString());
        assertTrue(report.id().startsWith("eval-"));
        assertEquals(NOW, report.createdAt());
        assertEquals(3, report.metrics().examples());
        assertEquals(1.0, report.metrics().refusalAccuracy());
        assertEquals(0.0, report.metrics().unsupportedClaimRate());
        assertTrue(report.metrics().semanticSimilarity() >= 0.72);
        assertNull(report.metrics().regressionDelta());
        assertTrue(Files.exists(tempDir.resolve("eval/eval-report.json")));
        assertEquals(report, reports.find(report.id()).orElseThrow());
        assertEquals(report.id(), reports.findByRun("run-1").orElseThrow().id());
    }

    @Test
    void shouldFailGateOnUnsupportedClaimsAlone() throws Exception {
        List<HeldOutExample> examples = List.of(
                new HeldOutExample("e1", "first", EXPECTED, false, null),
                new HeldOutExample("e2", "second", EXPECTED, false, ""));
        EvaluationEngine engine = engine(EvaluationPolicy.defaults(), (checkpoint, example) -> example.output() + INVENTED);

        EvaluationReport report = engine.evaluate("run-1", "project-1", tempDir, examples, null, null);

        assertFalse(report.goNoGo());
        assertEquals(1.0, report.metrics().unsupportedClaimRate());
        assertTrue(report.metrics().semanticSimilarity() >= 0.72);
        assertEquals(List.of("Unsupported claim rate threshold exceeded (actual=1.0000, max=0.1200, delta=+0.8800)"),
                report.gateFailures());
        assertEquals(2, report.failingExamples().size());
        assertEquals("unsupported_claim", report.failingExamples().get(0).reason());
        assertNull(report.reportPath());
    }

    @Test
    void shouldTreatContextAsSupportForClaims() throws Exception {
        List<HeldOutExample> examples = List.of(
                new HeldOutExample("e1", "first", EXPECTED, false, INVENTED.strip()));
        EvaluationEngine engine = engine(EvaluationPolicy.defaults(), (checkpoint, example) -> example.output() + INVENTED);

        EvaluationReport report = engine.evaluate("run-1", "project-1", tempDir, examples, null, null);

        assertEquals(0.0, report.metrics().unsupportedClaimRate());
        assertTrue(report.goNoGo(), () -> report.gateFailures().toString());
    }

    @Test
    void shouldFlagRegressionAgainstActiveReport() throws Exception {
        EvaluationMetrics strong = new EvaluationMetrics(1.0, 1.0, 1.0, 0.99, 1.0, 1.0, 1.0, 0.0, 1L, 10.0,
                null, false, 3);
        EvaluationReport prior = new EvaluationReport("eval-prior", "run-0", "project-1", NOW, strong, true,
                List.of(), List.of(), null);
        EvaluationEngine engine = engine(EvaluationPolicy.defaults(), new ReferenceResponsePredictor());

        EvaluationReport report = engine.evaluate("run-1", "project-1", tempDir, gold, prior, null);

        assertTrue(report.metrics().regressionFlagged());
        assertTrue(report.metrics().regressionDelta() < -0.05);
        assertFalse(report.goNoGo());
        assertTrue(report.gateFailures().get(0).startsWith("Semantic similarity regressed"), report.gateFailures().toString());
    }

    @Test
    void shouldFailRefusalGateAndKeepWorstExamples() throws Exception {
        EvaluationPolicy policy = new EvaluationPolicy(0.72, 0.12, 0.8, 0.05, 0.85, 1);
        EvaluationEngine engine = engine(policy, (checkpoint, example) -> "Please contact support.");

        EvaluationReport report = engine.evaluate("run-1", "project-1", tempDir, gold, null, null);

        assertFalse(report.goNoGo());
        assertEquals(0.6667, report.metrics().refusalAccuracy());
        assertEquals(0.0, report.metrics().refusalRecall());
        assertTrue(report.gateFailures().stream().anyMatch(f -> f.startsWith("Refusal accuracy below minimum")));
        assertTrue(report.gateFailures().stream().anyMatch(f -> f.startsWith("Semantic similarity below minimum")));
        assertEquals(1, report.failingExamples().size());
        assertEquals("low_similarity", report.failingExamples().get(0).reason());
    }

    @Test
    void shouldRejectEmptyHeldOutSet() {
        EvaluationEngine engine = engine(EvaluationPolicy.defaults(), new ReferenceResponsePredictor());

        assertThrows(IllegalArgumentException.class,
                () -> engine.evaluate("run-1", "project-1", tempDir, List.of(), null, null));
        assertTrue(reports.findByRun("run-1").isEmpty());
    }

    private EvaluationEngine engine(EvaluationPolicy policy, ResponsePredictor predictor) {
        return new EvaluationEngine(policy, predictor, reports, Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
