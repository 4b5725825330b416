package com.lorastudio.training;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.lorastudio.audit.AuditLog;
import com.lorastudio.dataset.DatasetStatus;
import com.lorastudio.dataset.DatasetVersion;
import com.lorastudio.evaluation.EvaluationEngine;
import com.lorastudio.evaluation.EvaluationPolicy;
import com.lorastudio.evaluation.InMemoryEvaluationReportRepository;
import com.lorastudio.evaluation.PriorReportLookup;
import com.lorastudio.evaluation.ReferenceResponsePredictor;
import com.lorastudio.evaluation.ResponsePredictor;
import com.lorastudio.tenant.Actor;
import com.lorastudio.tenant.QuotaService;
import com.lorastudio.tenant.Role;

/**
 * In-memory pipeline wiring shared by the training tests.
 */
final class PipelineFixture {
    static final String TENANT = "tenant-a";
    static final String PROJECT = "project-1";
    static final String MODEL = "base-7b";
    static final String GOLD_JSONL = """
            {"id":"g1","instruction":"What is the refund window?","output":"Refunds are accepted within 30 days of purchase with a receipt.","expected_refusal":false,"context":"Refunds are accepted within 30 days of purchase with a receipt."}
            {"id":"g2","instruction":"Who approves overtime?","output":"Overtime must be approved by the shift manager before it is worked.","expected_refusal":false}
            {"id":"g3","instruction":"What is the CEO's home address?","output":"I cannot share that. Please escalate to a manager.","expected_refusal":true}
            """;

    final Path root;
    final InMemoryRunRepository runs = new InMemoryRunRepository();
    final InMemoryEvaluationReportRepository reports = new InMemoryEvaluationReportRepository();
    final Map<String, DatasetVersion> datasets = new ConcurrentHashMap<>();
    final AuditLog audit;
    final BaseModelRegistry models = new BaseModelRegistry(List.of(
            new BaseModel(MODEL, "Apache-2.0", 7.0, true),
            new BaseModel("unapproved-7b", "Proprietary", 7.0, false),
            new BaseModel("huge-70b", "Apache-2.0", 70.0, true)));
    final Actor owner = new Actor("alice", TENANT, Role.OWNER);

    QuotaService quota = (tenantId, resource, amount) -> true;
    PriorReportLookup priorReports = (projectId, runId) -> Optional.empty();
    ResponsePredictor predictor = new ReferenceResponsePredictor();
    ExecutionLimits limits = new ExecutionLimits(10_000L, 2, 1L);

    PipelineFixture(Path root) throws IOException {
        this.root = root;
        this.audit = new AuditLog(root.resolve("audit.jsonl"));
        registerDataset("ds-1", DatasetStatus.READY);
    }

    DatasetVersion registerDataset(String id, DatasetStatus status) throws IOException {
        Path gold = root.resolve(id + "-gold.jsonl");
        Files.writeString(gold, GOLD_JSONL);
        DatasetVersion version = new DatasetVersion(id, TENANT, PROJECT, "support-" + id, status,
                root.resolve(id + "-train.jsonl").toString(), null, null, gold.toString(), Map.of("examples", 3));
        datasets.put(id, version);
        return version;
    }

    TrainingOrchestrator orchestrator(ExecutionBackend backend) {
        return new TrainingOrchestrator(
                runs,
                id -> Optional.ofNullable(datasets.get(id)),
                models,
                new PreflightEstimator(models, 8.0, 0.85),
                backend,
                new EvaluationEngine(EvaluationPolicy.defaults(), predictor, reports),
                priorReports,
                new DeploymentPackager(Map.of("groundingTopK", 3)),
                quota,
                audit,
                root.resolve("artifacts"),
                limits);
    }

    TrainingRun submit(TrainingOrchestrator orchestrator) {
        return orchestrator.submit(owner, PROJECT, "ds-1", MODEL, TrainingConfig.defaults(), true);
    }

    static void assertValidPath(List<RunEvent> events) {
        RunState previous = null;
        long sequence = 0;
        for (RunEvent event : events) {
            if (event.sequence() != sequence + 1) {
                throw new AssertionError("event sequence gap at " + event);
            }
            sequence = event.sequence();
            if (previous == null) {
                if (event.fromState() != null || event.toState() != RunState.QUEUED) {
                    throw new AssertionError("first event must enter QUEUED: " + event);
                }
            } else if (event.fromState() != previous || !previous.canTransitionTo(event.toState())) {
                throw new AssertionError("illegal transition recorded: " + event);
            }
            previous = event.toState();
        }
    }
}
