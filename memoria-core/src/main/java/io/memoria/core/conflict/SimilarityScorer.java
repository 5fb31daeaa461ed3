package io.memoria.core.conflict;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

public final class SimilarityScorer {

    private SimilarityScorer() {
    }

    /**
     * Jaccard similarity of the two texts' word sets. Words are lowercased, stripped of
     * punctuation, and words of two characters or fewer are ignored. Returns 0 when either
     * side has no qualifying word.
     */
    public static double jaccard(String left, String right) {
        Set<String> leftWords = words(left);
        Set<String> rightWords = words(right);
        if (leftWords.isEmpty() || rightWords.isEmpty()) {
            return 0;
        }

        int overlap = 0;
        for (String word : leftWords) {
            if (rightWords.contains(word)) {
                overlap++;
            }
        }
        Set<String> union = new HashSet<>(leftWords);
        union.addAll(rightWords);
        return (double) overlap / union.size();
    }

    static Set<String> words(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        String normalized = text.toLowerCase(Locale.ROOT).replaceAll("[^\\w\\s]", "");
        Set<String> words = new LinkedHashSet<>();
        for (String token : normalized.split("\\s+")) {
            if (token.length() > 2) {
                words.add(token);
            }
        }
        return words;
    }
}
