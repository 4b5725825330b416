package com.lorastudio.deployment;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public class OllamaInferenceBackend implements InferenceBackend {
    static final String NAME = "ollama";
    static final String SYSTEM_PROMPT = "You answer questions for a project team. Use only the provided context. "
            + "Cite snippet ids in square brackets. If the context does not contain the answer, say you do not "
            + "have enough information and suggest escalating.";

    private static final Logger log = LoggerFactory.getLogger(OllamaInferenceBackend.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String chatModel;

    public OllamaInferenceBackend(OkHttpClient httpClient, String baseUrl, String chatModel) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.mapper = new ObjectMapper();
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
    }

    @Override
    public Generation generate(String prompt, InferenceContext context) {
        try {
            String payload = mapper.writeValueAsString(Map.of(
                    "model", chatModel,
                    "stream", false,
                    "messages", List.of(
                            Map.of("role", "system", "content", SYSTEM_PROMPT),
                            Map.of("role", "user", "content", composeUserMessage(prompt, context)))));
            Request request = new Request.Builder()
                    .url(baseUrl + "/api/chat")
                    .post(RequestBody.create(payload, JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful() || response.body() == null) {
                    log.warn("inference.ollama.rejected status={} model={}", response.code(), chatModel);
                    return fallback(prompt, context);
                }
                JsonNode root = mapper.readTree(response.body().string());
                String content = root.path("message").path("content").asText("");
                if (content.isBlank()) {
                    log.warn("inference.ollama.empty model={}", chatModel);
                    return fallback(prompt, context);
                }
                return new Generation(content.strip(), NAME, false);
            }
        } catch (IOException e) {
            log.warn("inference.ollama.unavailable baseUrl={} reason={}", baseUrl, e.getMessage());
            return fallback(prompt, context);
        }
    }

    static String composeUserMessage(String prompt, InferenceContext context) {
        String evidence = context.snippets().stream()
                .map(snippet -> "[" + snippet.snippetId() + "] " + snippet.text())
                .collect(Collectors.joining("\n\n"));
        return "Context:\n" + (evidence.isEmpty() ? "(none)" : evidence) + "\n\nQuestion: " + prompt.strip();
    }

    private Generation fallback(String prompt, InferenceContext context) {
        return new Generation(TemplateInferenceBackend.groundedAnswer(prompt, context), NAME, true);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
