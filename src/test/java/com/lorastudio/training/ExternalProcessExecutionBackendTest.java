package com.lorastudio.training;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.lorastudio.dataset.DatasetStatus;
import com.lorastudio.dataset.DatasetVersion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExternalProcessExecutionBackendTest {
    @TempDir
    Path tempDir;

    @Test
    void shouldForwardProgressAndPickLatestCheckpoint() throws Exception {
        ExternalProcessExecutionBackend backend = new ExternalProcessExecutionBackend(
                "echo PROGRESS 0.5; mkdir -p {checkpoint_dir}/checkpoint-5 {checkpoint_dir}/checkpoint-10; "
                        + "printf weights > {adapter_dir}/adapter_model.safetensors; echo PROGRESS 1.0");
        List<Double> progress = new ArrayList<>();

        ExecutionBackend.Result result = backend.execute(request(), fraction -> progress.add(fraction));

        assertTrue(result.succeeded(), result.error());
        assertEquals(List.of(0.5, 1.0), progress);
        assertEquals(tempDir.resolve("run/checkpoints/checkpoint-10"), result.checkpointPath());
        assertTrue(Files.exists(tempDir.resolve("run/trainer-command-result.json")));
    }

    @Test
    void shouldClassifyExitCodes() throws Exception {
        ExecutionBackend.Result retryable = new ExternalProcessExecutionBackend("echo preempted >&2; exit 75")
                .execute(request(), fraction -> true);
        ExecutionBackend.Result permanent = new ExternalProcessExecutionBackend("echo bad config >&2; exit 3")
                .execute(request(), fraction -> true);
        ExecutionBackend.Result noAdapter = new ExternalProcessExecutionBackend("true")
                .execute(request(), fraction -> true);

        assertTrue(retryable.retryable());
        assertTrue(retryable.error().contains("preempted"), retryable.error());
        assertFalse(permanent.retryable());
        assertTrue(permanent.error().contains("code 3"), permanent.error());
        assertFalse(noAdapter.succeeded());
        assertTrue(noAdapter.error().contains(ExternalProcessExecutionBackend.ADAPTER_WEIGHTS));
    }

    @Test
    void shouldQuotePlaceholderValues() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("train_path", "/data/it's here.jsonl");

        String rendered = ExternalProcessExecutionBackend.render("train --data {train_path}", values);

        assertEquals("train --data '/data/it'\"'\"'s here.jsonl'", rendered);
    }

    private ExecutionRequest request() {
        DatasetVersion dataset = new DatasetVersion("ds-1", "tenant-a", "project-1", "support", DatasetStatus.READY,
                tempDir.resolve("train.jsonl").toString(), null, null, null, Map.of());
        return new ExecutionRequest("run-1", "base-7b", TrainingConfig.defaults(), dataset, tempDir.resolve("run"));
    }
}
