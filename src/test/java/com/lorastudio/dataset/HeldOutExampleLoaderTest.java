package com.lorastudio.dataset;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HeldOutExampleLoaderTest {
    @TempDir
    Path tempDir;

    private final HeldOutExampleLoader loader = new HeldOutExampleLoader();

    @Test
    void shouldPreferGoldSplitAndAssignMissingIds() throws Exception {
        Path gold = tempDir.resolve("gold.jsonl");
        Path test = tempDir.resolve("test.jsonl");
        Files.writeString(gold, """
                {"instruction":"Who approves overtime?","output":"The shift manager.","expected_refusal":false}

                {"id":"g2","instruction":"Home address?","output":"I cannot share that.","expected_refusal":true,"context":"policy"}
                """);
        Files.writeString(test, "{\"id\":\"t1\",\"instruction\":\"x\",\"output\":\"y\"}\n");

        List<HeldOutExample> examples = loader.load(version(test, gold));

        assertEquals(2, examples.size());
        assertEquals("example-1", examples.get(0).id());
        assertEquals("g2", examples.get(1).id());
        assertTrue(examples.get(1).expectedRefusal());
        assertEquals("policy", examples.get(1).context());
    }

    @Test
    void shouldFallBackToTestSplit() throws Exception {
        Path test = tempDir.resolve("test.jsonl");
        Files.writeString(test, "{\"id\":\"t1\",\"instruction\":\"x\",\"output\":\"y\"}\n");

        assertEquals("t1", loader.load(version(test, null)).get(0).id());
        assertThrows(IOException.class, () -> loader.load(version(null, null)));
    }

    private static DatasetVersion version(Path test, Path gold) {
        return new DatasetVersion("ds-1", "tenant-a", "project-1", "support", DatasetStatus.READY, null, null,
                test == null ? null : test.toString(), gold == null ? null : gold.toString(), Map.of());
    }
}
