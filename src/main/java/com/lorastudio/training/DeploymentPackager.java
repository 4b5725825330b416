package com.lorastudio.training;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.lorastudio.evaluation.EvaluationReport;

public class DeploymentPackager {
    static final String BUNDLE_NAME = "deployment-bundle.zip";

    private final Map<String, Object> inferenceSettings;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public DeploymentPackager(Map<String, Object> inferenceSettings) {
        this(inferenceSettings, Clock.systemUTC());
    }

    DeploymentPackager(Map<String, Object> inferenceSettings, Clock clock) {
        this.inferenceSettings = Map.copyOf(inferenceSettings);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.objectMapper = JsonMapper.builder().findAndAddModules().build();
    }

    public Path buildPackage(TrainingRun run, EvaluationReport report, Path runDirectory) throws IOException {
        if (run.adapterPath() == null) {
            throw new IOException("Run " + run.id() + " has no adapter to package");
        }
        Path adapterDir = Path.of(run.adapterPath());
        if (!Files.isDirectory(adapterDir)) {
            throw new IOException("Adapter directory missing: " + adapterDir);
        }

        Path packageDir = runDirectory.resolve("package");
        Path bundleDir = packageDir.resolve("bundle");
        copyTree(adapterDir, bundleDir.resolve("adapter"));

        Map<String, Object> manifest = new LinkedHashMap<>();
        manifest.put("runId", run.id());
        manifest.put("tenantId", run.tenantId());
        manifest.put("projectId", run.projectId());
        manifest.put("datasetVersionId", run.datasetVersionId());
        manifest.put("baseModelId", run.baseModelId());
        manifest.put("config", run.config());
        manifest.put("evalReportId", report.id());
        manifest.put("goNoGo", report.goNoGo());
        manifest.put("gateFailures", report.gateFailures());
        manifest.put("adapterSha256", sha256(bundleDir.resolve("adapter")));
        manifest.put("packagedAt", clock.instant());
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(bundleDir.resolve("run-manifest.json").toFile(), manifest);

        Map<String, Object> inference = new LinkedHashMap<>(inferenceSettings);
        inference.put("baseModelId", run.baseModelId());
        inference.put("adapterDirectory", "adapter");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(bundleDir.resolve("inference-config.json").toFile(), inference);

        Path bundle = packageDir.resolve(BUNDLE_NAME);
        zip(bundleDir, bundle);
        return bundle;
    }

    private static void copyTree(Path source, Path target) throws IOException {
        Files.createDirectories(target);
        try (var stream = Files.walk(source)) {
            for (Path path : stream.toList()) {
                Path destination = target.resolve(source.relativize(path).toString());
                if (Files.isDirectory(path)) {
                    Files.createDirectories(destination);
                } else {
                    Files.copy(path, destination, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }
    }

    private static void zip(Path sourceDir, Path zipFile) throws IOException {
        try (OutputStream out = Files.newOutputStream(zipFile);
                ZipOutputStream zip = new ZipOutputStream(out);
                var stream = Files.walk(sourceDir)) {
            List<Path> files = stream.filter(Files::isRegularFile).sorted().toList();
            for (Path file : files) {
                zip.putNextEntry(new ZipEntry(sourceDir.relativize(file).toString().replace('\\', '/')));
                Files.copy(file, zip);
                zip.closeEntry();
            }
        }
    }

    private static String sha256(Path directory) throws IOException {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            try (var stream = Files.walk(directory)) {
                for (Path file : stream.filter(Files::isRegularFile).sorted().toList()) {
                    digest.update(directory.relativize(file).toString().getBytes(StandardCharsets.UTF_8));
                    digest.update(Files.readAllBytes(file));
                }
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Missing SHA-256 algorithm", e);
        }
    }
}
