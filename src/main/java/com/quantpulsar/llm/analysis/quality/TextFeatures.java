package com.quantpulsar.llm.analysis.quality;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Tokenizing helpers shared by the quality detectors. */
final class TextFeatures {

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "is", "are", "was", "were", "be", "been", "being",
            "have", "has", "had", "do", "does", "did", "will", "would", "could",
            "should", "may", "might", "must", "shall", "can", "need", "dare",
            "ought", "used", "to", "of", "in", "for", "on", "with", "at", "by",
            "from", "as", "into", "through", "during", "before", "after", "above",
            "below", "between", "under", "again", "further", "then", "once", "here",
            "there", "when", "where", "why", "how", "all", "each", "few", "more",
            "most", "other", "some", "such", "no", "nor", "not", "only", "own",
            "same", "so", "than", "too", "very", "just", "and", "but", "if", "or",
            "because", "until", "while", "although", "though", "this", "that",
            "these", "those", "what", "which", "who", "whom", "whose", "it", "its",
            "i", "me", "my", "we", "our", "you", "your", "he", "him", "his", "she",
            "her", "they", "them", "their");

    private TextFeatures() {
    }

    /** Lowercase words longer than two characters that are not stop words. Duplicates kept. */
    static List<String> keywords(String text) {
        List<String> keywords = new ArrayList<>();
        for (String word : words(text)) {
            if (word.length() > 2 && !STOP_WORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return keywords;
    }

    /** Lowercase words split on non-word characters. */
    static List<String> words(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\W+"))
                .filter(w -> !w.isEmpty())
                .toList();
    }

    /** Whitespace-delimited n-grams of the text, in order. */
    static List<String> ngrams(String text, int n) {
        List<String> tokens = Arrays.stream(text.split("\\s+"))
                .filter(w -> !w.isEmpty())
                .toList();
        List<String> ngrams = new ArrayList<>();
        for (int i = 0; i + n <= tokens.size(); i++) {
            ngrams.add(String.join(" ", tokens.subList(i, i + n)));
        }
        return ngrams;
    }

    /** Non-blank fragments between sentence terminators. */
    static List<String> sentences(String text) {
        List<String> sentences = new ArrayList<>();
        for (String part : text.split("[.!?]+")) {
            if (!part.trim().isEmpty()) {
                sentences.add(part);
            }
        }
        return sentences;
    }

    static boolean containsIgnoreCase(String haystack, String needle) {
        return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }
}
