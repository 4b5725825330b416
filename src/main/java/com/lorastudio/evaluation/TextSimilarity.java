package com.lorastudio.evaluation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TextSimilarity {
    private static final Pattern TOKEN = Pattern.compile("[a-zA-Z0-9]{2,}");
    private static final List<String> REFUSAL_MARKERS = List.of(
            "cannot", "can't", "do not have", "insufficient", "escalate");

    private TextSimilarity() {
    }

    public static List<String> tokens(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group().toLowerCase(Locale.ROOT));
        }
        return tokens;
    }

    public static Set<String> tokenSet(String text) {
        return Set.copyOf(tokens(text));
    }

    public static double editRatio(String a, String b) {
        String left = a == null ? "" : a.strip();
        String right = b == null ? "" : b.strip();
        int longest = Math.max(left.length(), right.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(left, right) / longest;
    }

    public static double cosine(String a, String b) {
        Map<String, Integer> left = frequencies(tokens(a));
        Map<String, Integer> right = frequencies(tokens(b));
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        double dot = 0.0;
        for (Map.Entry<String, Integer> entry : left.entrySet()) {
            dot += entry.getValue() * (double) right.getOrDefault(entry.getKey(), 0);
        }
        return dot / (norm(left) * norm(right));
    }

    public static boolean isRefusal(String text) {
        if (text == null) {
            return false;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        return REFUSAL_MARKERS.stream().anyMatch(lowered::contains);
    }

    public static double novelTokenShare(String answer, String... supporting) {
        Set<String> answerTokens = tokenSet(answer);
        if (answerTokens.isEmpty()) {
            return 0.0;
        }
        List<String> known = new ArrayList<>();
        for (String text : supporting) {
            known.addAll(tokens(text));
        }
        Set<String> knownTokens = Set.copyOf(known);
        long novel = answerTokens.stream().filter(token -> !knownTokens.contains(token)).count();
        return (double) novel / answerTokens.size();
    }

    private static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int substitution = previous[j - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j] + 1, current[j - 1] + 1));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private static Map<String, Integer> frequencies(List<String> tokens) {
        Map<String, Integer> counts = new HashMap<>();
        for (String token : tokens) {
            counts.merge(token, 1, Integer::sum);
        }
        return counts;
    }

    private static double norm(Map<String, Integer> vector) {
        double sum = 0.0;
        for (int count : vector.values()) {
            sum += (double) count * count;
        }
        return Math.sqrt(sum);
    }
}
