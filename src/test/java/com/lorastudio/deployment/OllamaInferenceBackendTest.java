package com.lorastudio.deployment;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OllamaInferenceBackendTest {
    private MockWebServer server;
    private OllamaInferenceBackend backend;
    private final InferenceContext context = new InferenceContext(
            new Deployment("dep-1", "tenant-a", "project-1", "v1", "run-1", DeploymentStatus.ACTIVE,
                    "local://project-1/v1", null, Instant.parse("2026-03-01T10:00:00Z"), null),
            List.of(new GroundingSnippet("handbook#0", "handbook", "Refunds are accepted within 30 days.", 1.0)));

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        OkHttpClient client = new OkHttpClient.Builder().callTimeout(Duration.ofSeconds(2)).build();
        backend = new OllamaInferenceBackend(client, server.url("/").toString(), "llama3.1:8b");
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void shouldSendGroundedChatRequest() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"message\":{\"role\":\"assistant\",\"content\":\" Refunds take 30 days [handbook#0]. \"}}"));

        InferenceBackend.Generation generation = backend.generate("What is the refund window?", context);

        assertEquals("Refunds take 30 days [handbook#0].", generation.text());
        assertEquals("ollama", generation.backend());
        assertFalse(generation.fallback());
        RecordedRequest request = server.takeRequest();
        assertEquals("/api/chat", request.getPath());
        String body = request.getBody().readUtf8();
        assertTrue(body.contains("\"model\":\"llama3.1:8b\""), body);
        assertTrue(body.contains("[handbook#0] Refunds are accepted"), body);
    }

    @Test
    void shouldFallBackToTemplateAnswerOnServerError() {
        server.enqueue(new MockResponse().setResponseCode(500));

        InferenceBackend.Generation generation = backend.generate("What is the refund window?", context);

        assertTrue(generation.fallback());
        assertTrue(generation.text().startsWith("Based on grounded project documents (v1)"), generation.text());
    }

    @Test
    void shouldFallBackWhenServerIsUnreachable() throws Exception {
        server.shutdown();

        InferenceBackend.Generation generation = backend.generate("refund window", context);

        assertTrue(generation.fallback());
        assertTrue(generation.text().contains("[handbook#0]"));
    }
}
