package com.lorastudio;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lorastudio.runtime.AppConfig;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private Path configPath;

    @BeforeEach
    void setUp() throws IOException {
        Path gold = tempDir.resolve("gold.jsonl");
        Files.writeString(gold, """
                {"id":"g1","instruction":"What is the refund window?","output":"Refunds are accepted within 30 days of purchase with a receipt.","expected_refusal":false}
                {"id":"g2","instruction":"Home address of the CEO?","output":"I cannot share that. Please escalate to a manager.","expected_refusal":true}
                """);
        Files.writeString(tempDir.resolve("datasets.json"), """
                [ {
                  "id" : "ds-1",
                  "tenantId" : "default",
                  "projectId" : "project-1",
                  "name" : "support-faq",
                  "status" : "READY",
                  "trainPath" : "%s",
                  "goldPath" : "%s"
                } ]
                """.formatted(path(tempDir.resolve("train.jsonl")), path(gold)));
        configPath = tempDir.resolve("lora-studio.yml");
        Files.writeString(configPath, """
                storage:
                  artifactsPath: %1$s/artifacts
                  runRegistryPath: %1$s/runs.json
                  runEventLogPath: %1$s/run-events.jsonl
                  reportRegistryPath: %1$s/evaluation-reports.json
                  deploymentRegistryPath: %1$s/deployments.json
                  auditLogPath: %1$s/audit.jsonl
                  quotaUsagePath: %1$s/quota-usage.json
                  datasetCatalogPath: %1$s/datasets.json
                training:
                  backend: simulator
                  simulatedSteps: 3
                  simulatedStepDelayMs: 0
                  retryBackoffMs: 1
                worker:
                  threads: 1
                  pollIntervalMs: 0
                  maxCycles: 1
                """.formatted(path(tempDir)));
    }

    @Test
    void shouldPrintVramEstimate() throws Exception {
        Run estimate = run("--mode", "estimate", "--config", configPath.toString());

        assertEquals(Main.EXIT_OK, estimate.exitCode());
        JsonNode json = mapper.readTree(estimate.out());
        assertTrue(json.get("willFit").asBoolean());
        assertEquals(2.36, json.get("estimatedGb").asDouble());
    }

    @Test
    void shouldSubmitTrainActivateAndInferEndToEnd() throws Exception {
        Run submitted = run("--mode", "submit", "--config", configPath.toString(), "--project", "project-1",
                "--dataset", "ds-1", "--confirm-data-rights");
        assertEquals(Main.EXIT_OK, submitted.exitCode(), submitted.err());
        String runId = mapper.readTree(submitted.out()).get("id").asText();

        Run worked = run("--mode", "work", "--config", configPath.toString(), "--drain");
        assertEquals(1, mapper.readTree(worked.out()).get("processedRuns").asInt());

        JsonNode status = mapper.readTree(run("--mode", "status", "--config", configPath.toString(),
                "--run-id", runId).out());
        assertEquals("READY", status.get("state").asText());

        JsonNode events = mapper.readTree(run("--mode", "events", "--config", configPath.toString(),
                "--run-id", runId).out());
        assertEquals(7, events.size());

        Run activated = run("--mode", "activate", "--config", configPath.toString(), "--project", "project-1",
                "--run-id", runId, "--version-label", "v1");
        assertEquals(Main.EXIT_OK, activated.exitCode(), activated.err());
        assertEquals("ACTIVE", mapper.readTree(activated.out()).get("status").asText());

        Path handbook = tempDir.resolve("handbook.txt");
        Files.writeString(handbook, "Refunds are accepted within 30 days of purchase with a receipt.\n\nParking is free.");
        JsonNode answer = mapper.readTree(run("--mode", "infer", "--config", configPath.toString(),
                "--project", "project-1", "--prompt", "refund window for a purchase", "--context", handbook.toString()).out());
        assertEquals("v1", answer.get("versionLabel").asText());
        assertEquals("handbook.txt#0", answer.get("snippetIds").get(0).asText());

        assertEquals(Main.EXIT_REJECTED_BY_STATE,
                run("--mode", "rollback", "--config", configPath.toString(), "--project", "project-1").exitCode());
        assertEquals(Main.EXIT_REJECTED_BY_STATE,
                run("--mode", "cancel", "--config", configPath.toString(), "--run-id", runId).exitCode());
    }

    @Test
    void shouldMapRejectionsToExitCodes() throws Exception {
        Run noRights = run("--mode", "submit", "--config", configPath.toString(), "--project", "project-1",
                "--dataset", "ds-1");
        assertEquals(Main.EXIT_INVALID, noRights.exitCode());
        assertTrue(noRights.err().contains("Data rights"), noRights.err());

        assertEquals(Main.EXIT_DENIED, run("--mode", "submit", "--config", configPath.toString(),
                "--role", "VIEWER", "--project", "project-1", "--dataset", "ds-1", "--confirm-data-rights").exitCode());
        assertEquals(Main.EXIT_REJECTED_BY_STATE, run("--mode", "cancel", "--config", configPath.toString(),
                "--run-id", "run-missing").exitCode());
        assertEquals(Main.EXIT_INVALID, run("--mode", "submit", "--config", configPath.toString()).exitCode());
        assertEquals(Main.EXIT_REJECTED_BY_STATE, run("--mode", "resolve", "--config", configPath.toString(),
                "--project", "project-1").exitCode());
    }

    @Test
    void shouldLoadBundledConfigWithDocumentedDefaults() throws Exception {
        AppConfig bundled = Main.loadConfig(Path.of("src/main/resources/application.yml"));
        AppConfig missing = Main.loadConfig(tempDir.resolve("absent.yml"));

        assertEquals("simulator", bundled.getTraining().getBackend());
        assertEquals(0.72, bundled.getEvaluation().getMinSemanticSimilarity());
        assertEquals(3, bundled.getModels().size());
        assertEquals(bundled.getInference().getGroundingTopK(), missing.getInference().getGroundingTopK());
        assertEquals(bundled.getStorage().getRunRegistryPath(), missing.getStorage().getRunRegistryPath());
        assertEquals(bundled.getModels().keySet(), missing.getModels().keySet());
    }

    private Run run(String... args) {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine commandLine = new CommandLine(new Main());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        int exitCode = commandLine.execute(args);
        return new Run(exitCode, out.toString(), err.toString());
    }

    private static String path(Path path) {
        return path.toString().replace('\\', '/');
    }

    private record Run(int exitCode, String out, String err) {
    }
}
