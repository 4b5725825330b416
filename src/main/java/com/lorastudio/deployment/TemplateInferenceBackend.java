package com.lorastudio.deployment;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public class TemplateInferenceBackend implements InferenceBackend {
    static final String NAME = "template";

    @Override
    public Generation generate(String prompt, InferenceContext context) {
        return new Generation(groundedAnswer(prompt, context), NAME, false);
    }

    static String groundedAnswer(String prompt, InferenceContext context) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt must not be blank");
        }
        if (context.snippets().isEmpty()) {
            return "No grounded project documents matched the request: " + prompt.strip();
        }
        Set<String> keywords = keywords(prompt);
        String evidence = context.snippets().stream()
                .map(snippet -> "[" + snippet.snippetId() + "] " + firstMatchingSentence(snippet.text(), keywords))
                .collect(Collectors.joining(" "));
        return "Based on grounded project documents (" + context.deployment().versionLabel() + "): " + evidence;
    }

    private static Set<String> keywords(String input) {
        return Arrays.stream(input.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(token -> token.length() > 2)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static String firstMatchingSentence(String text, Set<String> keywords) {
        String[] sentences = text.split("(?<=[.!?])\\s+");
        for (String sentence : sentences) {
            String lower = sentence.toLowerCase(Locale.ROOT);
            if (keywords.stream().anyMatch(lower::contains)) {
                return sentence.trim();
            }
        }
        return sentences[0].trim();
    }
}
