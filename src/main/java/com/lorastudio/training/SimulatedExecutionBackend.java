package com.lorastudio.training;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class SimulatedExecutionBackend implements ExecutionBackend {
    private static final Logger log = LoggerFactory.getLogger(SimulatedExecutionBackend.class);

    private final int steps;
    private final long stepDelayMs;
    private final ObjectMapper objectMapper;

    public SimulatedExecutionBackend(int steps, long stepDelayMs) {
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be positive");
        }
        this.steps = steps;
        this.stepDelayMs = Math.max(0, stepDelayMs);
        this.objectMapper = JsonMapper.builder().findAndAddModules().build();
    }

    @Override
    public String name() {
        return "simulator";
    }

    @Override
    public Result execute(ExecutionRequest request, ProgressSink progress) throws IOException, InterruptedException {
        TrainingConfig config = request.config();
        int totalSteps = config.maxSteps() > 0 ? Math.min(config.maxSteps(), steps) : steps;
        Path checkpointsDir = request.runDirectory().resolve("checkpoints");
        Files.createDirectories(checkpointsDir);

        Path lastCheckpoint = null;
        double loss = 2.0;
        for (int step = 1; step <= totalSteps; step++) {
            if (stepDelayMs > 0) {
                Thread.sleep(stepDelayMs);
            }
            loss = 2.0 / (1.0 + 0.05 * step);
            if (step % config.saveEverySteps() == 0 || step == totalSteps) {
                lastCheckpoint = writeCheckpoint(checkpointsDir, step, loss);
            }
            if (!progress.report((double) step / totalSteps)) {
                log.info("simulator.stopped run={} step={}", request.runId(), step);
                return Result.cancelled(step);
            }
        }

        Path adapterDir = request.runDirectory().resolve("adapter");
        Files.createDirectories(adapterDir);
        Files.write(adapterDir.resolve("adapter_model.safetensors"), adapterWeights(request));
        Map<String, Object> adapterConfig = new LinkedHashMap<>();
        adapterConfig.put("base_model_name_or_path", request.baseModelId());
        adapterConfig.put("peft_type", "LORA");
        adapterConfig.put("r", config.loraRank());
        adapterConfig.put("lora_alpha", config.loraAlpha());
        adapterConfig.put("lora_dropout", config.loraDropout());
        objectMapper.writerWithDefaultPrettyPrinter()
                .writeValue(adapterDir.resolve("adapter_config.json").toFile(), adapterConfig);

        log.info("simulator.completed run={} steps={} loss={}", request.runId(), totalSteps, loss);
        return Result.succeeded(lastCheckpoint, adapterDir, loss, totalSteps);
    }

    private Path writeCheckpoint(Path checkpointsDir, int step, double loss) throws IOException {
        Path checkpoint = checkpointsDir.resolve("step-" + step);
        Files.createDirectories(checkpoint);
        objectMapper.writeValue(checkpoint.resolve("checkpoint.json").toFile(), Map.of("step", step, "loss", loss));
        return checkpoint;
    }

    private byte[] adapterWeights(ExecutionRequest request) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(request.baseModelId().getBytes(StandardCharsets.UTF_8));
            digest.update(request.dataset().id().getBytes(StandardCharsets.UTF_8));
            digest.update(objectMapper.writeValueAsBytes(request.config()));
            return HexFormat.of().formatHex(digest.digest()).getBytes(StandardCharsets.UTF_8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Missing SHA-256 algorithm", e);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize training config", e);
        }
    }
}
