package com.evaluate.interviewprep.service;

import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword and sentence helpers shared by the heuristic scorers.
 */
final class TextSignals {

    private static final Pattern LONG_WORD = Pattern.compile("\\b[a-zA-Z]{3,}\\b");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.!?]+");

    private TextSignals() {
    }

    static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    static String[] words(String text) {
        if (text == null || text.isBlank()) {
            return new String[0];
        }
        return text.trim().split("\\s+");
    }

    /** True when {@code term} occurs in {@code lowerText} without letters or digits glued to either side. */
    static boolean containsTerm(String lowerText, String term) {
        String needle = term.toLowerCase(Locale.ROOT);
        if (needle.isEmpty()) {
            return false;
        }
        Pattern pattern = Pattern.compile("(?<![a-z0-9])" + Pattern.quote(needle) + "(?![a-z0-9])");
        return pattern.matcher(lowerText).find();
    }

    /** Number of distinct terms from {@code terms} present in the text. */
    static int countTerms(String lowerText, Collection<String> terms) {
        return (int) terms.stream()
                .map(term -> term.toLowerCase(Locale.ROOT))
                .distinct()
                .filter(term -> containsTerm(lowerText, term))
                .count();
    }

    static boolean containsAny(String lowerText, Collection<String> terms) {
        return terms.stream().anyMatch(term -> containsTerm(lowerText, term));
    }

    static long sentenceCount(String text) {
        if (text == null) {
            return 0;
        }
        return Arrays.stream(SENTENCE_BREAK.split(text))
                .filter(part -> !part.isBlank())
                .count();
    }

    /** Share of tokens that are real words of three letters or more. */
    static double longWordShare(String text) {
        String[] tokens = words(text);
        if (tokens.length == 0) {
            return 0.0;
        }
        Matcher matcher = LONG_WORD.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return (double) count / tokens.length;
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    static double average(Collection<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
