package com.lorastudio.training;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

// stdout lines "PROGRESS <0..1>" are reported as progress; exit 75 (EX_TEMPFAIL) is retryable
public class ExternalProcessExecutionBackend implements ExecutionBackend {
    static final int RETRYABLE_EXIT_CODE = 75;
    static final String ADAPTER_WEIGHTS = "adapter_model.safetensors";

    private static final Logger log = LoggerFactory.getLogger(ExternalProcessExecutionBackend.class);
    private static final int TAIL_LINES = 40;

    private final String commandTemplate;
    private final ProcessStarter processStarter;
    private final ObjectMapper objectMapper;

    public ExternalProcessExecutionBackend(String commandTemplate) {
        this(commandTemplate, new DefaultProcessStarter());
    }

    ExternalProcessExecutionBackend(String commandTemplate, ProcessStarter processStarter) {
        if (commandTemplate == null || commandTemplate.isBlank()) {
            throw new IllegalArgumentException("training.commandTemplate is required for the command backend");
        }
        this.commandTemplate = commandTemplate;
        this.processStarter = Objects.requireNonNull(processStarter, "processStarter");
        this.objectMapper = JsonMapper.builder().findAndAddModules().build();
    }

    @Override
    public String name() {
        return "command";
    }

    @Override
    public Result execute(ExecutionRequest request, ProgressSink progress) throws IOException, InterruptedException {
        Path runDir = request.runDirectory();
        Path adapterDir = runDir.resolve("adapter");
        Path checkpointDir = runDir.resolve("checkpoints");
        Files.createDirectories(adapterDir);
        Files.createDirectories(checkpointDir);

        Map<String, String> values = new LinkedHashMap<>();
        values.put("output_dir", runDir.toString());
        values.put("adapter_dir", adapterDir.toString());
        values.put("checkpoint_dir", checkpointDir.toString());
        values.put("train_path", nullToEmpty(request.dataset().trainPath()));
        values.put("val_path", nullToEmpty(request.dataset().valPath()));
        values.put("test_path", nullToEmpty(request.dataset().testPath()));
        values.put("base_model_id", request.baseModelId());
        String command = render(commandTemplate, values);

        Map<String, String> env = new LinkedHashMap<>();
        env.put("LORA_BASE_MODEL_ID", request.baseModelId());
        env.put("LORA_TRAIN_PATH", values.get("train_path"));
        env.put("LORA_VAL_PATH", values.get("val_path"));
        env.put("LORA_TEST_PATH", values.get("test_path"));
        env.put("LORA_CONFIG_JSON", objectMapper.writeValueAsString(request.config()));
        env.put("LORA_ADAPTER_DIR", adapterDir.toString());
        env.put("LORA_CHECKPOINT_DIR", checkpointDir.toString());

        log.info("trainer.command.start run={} command={}", request.runId(), command);
        Process process = processStarter.start(runDir, env, "bash", "-lc", command);

        AtomicBoolean stopped = new AtomicBoolean(false);
        CompletableFuture<String> stdoutFuture = CompletableFuture.supplyAsync(
                () -> readProgress(process, process.getInputStream(), progress, stopped));
        CompletableFuture<String> stderrFuture = readTail(process.getErrorStream());

        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
        String stdoutTail = stdoutFuture.join();
        String stderrTail = stderrFuture.join();
        writeCommandResult(runDir, command, exitCode, stdoutTail, stderrTail);

        if (stopped.get()) {
            return Result.cancelled(0);
        }
        if (exitCode == RETRYABLE_EXIT_CODE) {
            return Result.failed("Trainer exited with retryable code " + exitCode + ": " + lastLine(stderrTail), true);
        }
        if (exitCode != 0) {
            return Result.failed("Trainer exited with code " + exitCode + ": " + lastLine(stderrTail), false);
        }
        if (!Files.exists(adapterDir.resolve(ADAPTER_WEIGHTS))) {
            return Result.failed("Trainer finished without writing " + ADAPTER_WEIGHTS, false);
        }
        return Result.succeeded(latestCheckpoint(checkpointDir), adapterDir, null, 0);
    }

    static String render(String template, Map<String, String> values) {
        String rendered = template;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            rendered = rendered.replace("{" + entry.getKey() + "}", shellQuote(entry.getValue()));
        }
        return rendered;
    }

    static String shellQuote(String value) {
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }

    private String readProgress(Process process, InputStream stream, ProgressSink progress, AtomicBoolean stopped) {
        Deque<String> tail = new ArrayDeque<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                remember(tail, line);
                String trimmed = line.trim();
                if (!trimmed.startsWith("PROGRESS ") || stopped.get()) {
                    continue;
                }
                try {
                    double fraction = Double.parseDouble(trimmed.substring("PROGRESS ".length()).trim());
                    if (!progress.report(fraction)) {
                        stopped.set(true);
                        process.destroy();
                    }
                } catch (NumberFormatException e) {
                    log.warn("trainer.command.bad-progress line={}", trimmed);
                }
            }
        } catch (IOException e) {
            log.debug("trainer.command.stdout-closed reason={}", e.getMessage());
        }
        return String.join(System.lineSeparator(), tail);
    }

    private CompletableFuture<String> readTail(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            Deque<String> tail = new ArrayDeque<>();
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    remember(tail, line);
                }
            } catch (IOException e) {
                log.debug("trainer.command.stderr-closed reason={}", e.getMessage());
            }
            return String.join(System.lineSeparator(), tail);
        });
    }

    private void writeCommandResult(Path runDir, String command, int exitCode, String stdout, String stderr)
            throws IOException {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("command", command);
        result.put("exitCode", exitCode);
        result.put("stdoutTail", stdout);
        result.put("stderrTail", stderr);
        objectMapper.writerWithDefaultPrettyPrinter()
                .writeValue(runDir.resolve("trainer-command-result.json").toFile(), result);
    }

    private static Path latestCheckpoint(Path checkpointDir) throws IOException {
        try (var entries = Files.list(checkpointDir)) {
            return entries.filter(Files::isDirectory)
                    .max((a, b) -> Long.compare(stepOf(a), stepOf(b)))
                    .orElse(checkpointDir);
        }
    }

    private static long stepOf(Path checkpoint) {
        String name = checkpoint.getFileName().toString();
        String digits = name.replaceAll("\\D", "");
        return digits.isEmpty() ? -1 : Long.parseLong(digits);
    }

    private static void remember(Deque<String> tail, String line) {
        tail.addLast(line);
        if (tail.size() > TAIL_LINES) {
            tail.removeFirst();
        }
    }

    private static String lastLine(String text) {
        if (text == null || text.isBlank()) {
            return "no stderr output";
        }
        String[] lines = text.split("\\R");
        return lines[lines.length - 1];
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    interface ProcessStarter {
        Process start(Path workingDirectory, Map<String, String> environment, String... command) throws IOException;
    }

    private static final class DefaultProcessStarter implements ProcessStarter {
        @Override
        public Process start(Path workingDirectory, Map<String, String> environment, String... command)
                throws IOException {
            ProcessBuilder builder = new ProcessBuilder(command).directory(workingDirectory.toFile());
            builder.environment().putAll(environment);
            return builder.start();
        }
    }
}
