package com.lorastudio;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.lorastudio.deployment.ContextDocument;
import com.lorastudio.deployment.DuplicateVersionException;
import com.lorastudio.deployment.NoActiveDeploymentException;
import com.lorastudio.deployment.RunNotReadyException;
import com.lorastudio.runtime.AppConfig;
import com.lorastudio.runtime.PipelineComponents;
import com.lorastudio.tenant.AccessDeniedException;
import com.lorastudio.tenant.Actor;
import com.lorastudio.tenant.QuotaExceededException;
import com.lorastudio.tenant.Role;
import com.lorastudio.training.InvalidStateTransitionException;
import com.lorastudio.training.RunNotFoundException;
import com.lorastudio.training.TrainingConfig;
import com.lorastudio.training.TrainingWorkerPool;
import com.lorastudio.training.ValidationException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "lora-studio",
        mixinStandardHelpOptions = true,
        version = "lora-studio 0.1.0",
        description = "Training pipeline orchestrator for LoRA adapters: submit, work, evaluate, deploy, infer.")
public class Main implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 2;
    static final int EXIT_REJECTED_BY_STATE = 3;
    static final int EXIT_DENIED = 4;

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Spec
    CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", required = true)
    Mode mode;

    @Option(names = "--user", description = "Acting user id", defaultValue = "cli")
    String userId;

    @Option(names = "--tenant", description = "Acting tenant id", defaultValue = "default")
    String tenantId;

    @Option(names = "--role", description = "Acting role: ${COMPLETION-CANDIDATES}", defaultValue = "OWNER")
    Role role;

    @Option(names = "--project", description = "Project id")
    String projectId;

    @Option(names = "--dataset", description = "Dataset version id for submit")
    String datasetVersionId;

    @Option(names = "--base-model", description = "Base model id", defaultValue = "mistralai/Mistral-7B-Instruct-v0.3")
    String baseModelId;

    @Option(names = "--confirm-data-rights", description = "Confirm the tenant holds training rights to the dataset", defaultValue = "false")
    boolean dataRightsConfirmed;

    @Option(names = "--run-id", description = "Training run id")
    String runId;

    @Option(names = "--version-label", description = "Deployment version label for activate")
    String versionLabel;

    @Option(names = "--endpoint", description = "Endpoint reference recorded on the deployment")
    String endpointRef;

    @Option(names = "--prompt", description = "Prompt for infer mode")
    String prompt;

    @Option(names = "--context", description = "Context document file(s) used for grounding", split = ",")
    List<Path> contextFiles = new ArrayList<>();

    @Option(names = "--drain", description = "In work mode, process the queue until empty and exit", defaultValue = "false")
    boolean drain;

    @Option(names = "--lora-rank", defaultValue = "16")
    int loraRank;

    @Option(names = "--lora-alpha", defaultValue = "32")
    int loraAlpha;

    @Option(names = "--lora-dropout", defaultValue = "0.05")
    double loraDropout;

    @Option(names = "--sequence-length", defaultValue = "1024")
    int sequenceLength;

    @Option(names = "--batch-size", defaultValue = "1")
    int perDeviceBatchSize;

    @Option(names = "--grad-accum", defaultValue = "8")
    int gradientAccumulationSteps;

    @Option(names = "--precision", defaultValue = "bf16")
    String precision;

    @Option(names = "--epochs", defaultValue = "2")
    int epochs;

    @Option(names = "--max-steps", defaultValue = "0")
    int maxSteps;

    @Option(names = "--save-every-steps", defaultValue = "100")
    int saveEverySteps;

    @Option(names = "--use-4bit", arity = "1", defaultValue = "true")
    boolean use4bit;

    private final ObjectMapper jsonMapper = JsonMapper.builder().findAndAddModules().build();

    enum Mode {
        estimate,
        submit,
        work,
        status,
        events,
        cancel,
        activate,
        rollback,
        resolve,
        infer
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        log.info("Starting lora-studio in {} mode", mode);
        log.info("Using config file: {}", configPath);
        try {
            return execute(PipelineComponents.fromConfig(config));
        } catch (ValidationException | IllegalArgumentException e) {
            return reject(EXIT_INVALID, e);
        } catch (RunNotFoundException | InvalidStateTransitionException | RunNotReadyException
                | NoActiveDeploymentException | DuplicateVersionException e) {
            return reject(EXIT_REJECTED_BY_STATE, e);
        } catch (AccessDeniedException | QuotaExceededException e) {
            return reject(EXIT_DENIED, e);
        }
    }

    private int execute(PipelineComponents components) throws IOException, InterruptedException {
        Actor actor = new Actor(userId, tenantId, role);
        switch (mode) {
            case estimate -> print(components.orchestrator().estimate(baseModelId, trainingConfig()));
            case submit -> print(components.orchestrator().submit(
                    actor, require(projectId, "--project"), require(datasetVersionId, "--dataset"), baseModelId,
                    trainingConfig(), dataRightsConfirmed));
            case work -> runWorkers(components);
            case status -> {
                if (runId != null) {
                    print(components.orchestrator().getRun(actor, runId));
                } else {
                    print(components.orchestrator().listRuns(actor, require(projectId, "--project")));
                }
            }
            case events -> print(components.orchestrator().events(actor, require(runId, "--run-id")));
            case cancel -> print(components.orchestrator().cancel(actor, require(runId, "--run-id")));
            case activate -> print(components.router().activate(
                    actor, require(projectId, "--project"), require(runId, "--run-id"),
                    require(versionLabel, "--version-label"), endpointRef));
            case rollback -> print(components.router().rollback(actor, require(projectId, "--project")));
            case resolve -> print(components.router().resolveActive(require(projectId, "--project")));
            case infer -> print(components.router().infer(
                    require(projectId, "--project"), require(prompt, "--prompt"), contextDocuments()));
            default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
        }
        return EXIT_OK;
    }

    private void runWorkers(PipelineComponents components) throws IOException, InterruptedException {
        TrainingWorkerPool pool = components.workerPool();
        if (drain) {
            int processed = pool.drainQueue();
            print(Map.of("processedRuns", processed));
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(pool::requestStop, "worker-pool-shutdown"));
        pool.runLoop();
        print(Map.of("processedRuns", pool.processedRuns(), "failedCycles", pool.failedCycles()));
    }

    TrainingConfig trainingConfig() {
        return new TrainingConfig(loraRank, loraAlpha, loraDropout, sequenceLength, perDeviceBatchSize,
                gradientAccumulationSteps, precision, epochs, maxSteps, saveEverySteps, use4bit);
    }

    private List<ContextDocument> contextDocuments() throws IOException {
        List<ContextDocument> documents = new ArrayList<>();
        for (Path file : contextFiles) {
            documents.add(new ContextDocument(file.getFileName().toString(), Files.readString(file, StandardCharsets.UTF_8)));
        }
        return documents;
    }

    private void print(Object value) throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        out.println(jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
        out.flush();
    }

    private int reject(int exitCode, RuntimeException e) {
        log.warn("command.rejected mode={} exitCode={} reason={}", mode, exitCode, e.getMessage());
        PrintWriter err = spec.commandLine().getErr();
        err.println(e.getMessage());
        err.flush();
        return exitCode;
    }

    private static String require(String value, String option) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(option + " is required for this mode");
        }
        return value;
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
