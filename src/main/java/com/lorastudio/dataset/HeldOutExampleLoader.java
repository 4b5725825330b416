package com.lorastudio.dataset;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class HeldOutExampleLoader {
    private final ObjectMapper objectMapper;

    public HeldOutExampleLoader() {
        this.objectMapper = JsonMapper.builder().findAndAddModules().build();
    }

    public List<HeldOutExample> load(DatasetVersion dataset) throws IOException {
        String source = dataset.goldPath() != null && !dataset.goldPath().isBlank()
                ? dataset.goldPath()
                : dataset.testPath();
        if (source == null || source.isBlank()) {
            throw new IOException("Dataset " + dataset.id() + " has neither gold nor test split");
        }
        return readJsonl(Path.of(source));
    }

    public List<HeldOutExample> readJsonl(Path path) throws IOException {
        List<HeldOutExample> examples = new ArrayList<>();
        int lineNumber = 0;
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            HeldOutExample parsed = objectMapper.readValue(line, HeldOutExample.class);
            if (parsed.id() == null || parsed.id().isBlank()) {
                parsed = new HeldOutExample("example-" + lineNumber, parsed.instruction(), parsed.output(),
                        parsed.expectedRefusal(), parsed.context());
            }
            examples.add(parsed);
        }
        return examples;
    }
}
