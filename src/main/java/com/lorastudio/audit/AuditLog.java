package com.lorastudio.audit;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class AuditLog {
    public static final String TRAINING_RUN_CREATED = "training_run_created";
    public static final String TRAINING_RUN_CANCELLED = "training_run_cancelled";
    public static final String TRAINING_RUN_READY = "training_run_ready";
    public static final String TRAINING_RUN_FAILED = "training_run_failed";
    public static final String DEPLOYMENT_ACTIVATED = "deployment_activated";
    public static final String DEPLOYMENT_ROLLED_BACK = "deployment_rolled_back";

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    private final Path auditPath;
    private final ObjectMapper objectMapper;

    public AuditLog(Path auditPath) {
        this.auditPath = Objects.requireNonNull(auditPath, "auditPath");
        this.objectMapper = JsonMapper.builder().findAndAddModules().build();
    }

    public synchronized void append(AuditEntry entry) {
        try {
            if (auditPath.getParent() != null) {
                Files.createDirectories(auditPath.getParent());
            }
            Files.writeString(
                    auditPath,
                    objectMapper.writeValueAsString(entry) + System.lineSeparator(),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append audit entry " + entry.action(), e);
        }
        log.info("audit.recorded action={} entity={} actor={}", entry.action(), entry.entityId(), entry.userId());
    }

    public synchronized List<AuditEntry> readAll() throws IOException {
        if (!Files.exists(auditPath)) {
            return List.of();
        }
        List<AuditEntry> entries = new ArrayList<>();
        for (String line : Files.readAllLines(auditPath, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                entries.add(objectMapper.readValue(line, AuditEntry.class));
            }
        }
        return entries;
    }
}
