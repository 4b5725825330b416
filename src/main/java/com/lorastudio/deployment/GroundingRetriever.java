package com.lorastudio.deployment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

import com.lorastudio.evaluation.TextSimilarity;

public class GroundingRetriever {
    static final int MAX_SECTIONS_PER_DOCUMENT = 15;
    static final int MAX_SNIPPET_WORDS = 120;

    private final int topK;

    public GroundingRetriever(int topK) {
        if (topK < 1) {
            throw new IllegalArgumentException("inference.groundingTopK must be positive");
        }
        this.topK = topK;
    }

    public List<GroundingSnippet> retrieve(String query, List<ContextDocument> documents) {
        Set<String> queryTerms = TextSimilarity.tokenSet(query);
        if (queryTerms.isEmpty() || documents == null || documents.isEmpty()) {
            return List.of();
        }
        List<GroundingSnippet> scored = new ArrayList<>();
        for (ContextDocument document : documents) {
            List<String> sections = sections(document.text());
            for (int i = 0; i < sections.size(); i++) {
                String section = sections.get(i);
                Set<String> words = TextSimilarity.tokenSet(section);
                long matches = queryTerms.stream().filter(words::contains).count();
                if (matches == 0) {
                    continue;
                }
                scored.add(new GroundingSnippet(
                        document.id() + "#" + i,
                        document.id(),
                        truncate(section),
                        (double) matches / queryTerms.size()));
            }
        }
        return scored.stream()
                .sorted(Comparator.comparingDouble(GroundingSnippet::score).reversed()
                        .thenComparing(GroundingSnippet::snippetId))
                .limit(topK)
                .toList();
    }

    private static List<String> sections(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(text.split("\\R\\s*\\R"))
                .map(String::strip)
                .filter(section -> !section.isEmpty())
                .limit(MAX_SECTIONS_PER_DOCUMENT)
                .toList();
    }

    private static String truncate(String section) {
        String[] words = section.split("\\s+");
        if (words.length <= MAX_SNIPPET_WORDS) {
            return String.join(" ", words);
        }
        return String.join(" ", Arrays.copyOf(words, MAX_SNIPPET_WORDS));
    }
}
