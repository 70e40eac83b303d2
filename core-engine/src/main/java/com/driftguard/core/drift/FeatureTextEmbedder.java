package com.driftguard.core.drift;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Deterministic lexical feature embedder.
 *
 * <p>
 * The text is lower-cased, whitespace is collapsed and symbols other than
 * {@code . , ! ? ; :} are dropped. The vector is then assembled from:
 * </p>
 * <ol>
 * <li>50 letter frequencies ({@code a..z} cycling) plus length, word-density
 * and uppercase ratios;</li>
 * <li>word length mean and population deviation, vocabulary diversity and the
 * frequencies of ten function words;</li>
 * <li>sentence, question and exclamation densities and the ratios of
 * sentiment and topic indicator words.</li>
 * </ol>
 * <p>
 * The 73 features are zero-padded to {@link #DIMENSION} and L2-normalized.
 * </p>
 *
 * @since 1.0.0
 */
public class FeatureTextEmbedder implements TextEmbedder {

    private static final long serialVersionUID = 1L;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern DISALLOWED = Pattern.compile("[^\\w\\s.,!?;:]", Pattern.UNICODE_CHARACTER_CLASS);

    private static final int LETTER_FEATURES = 50;

    private static final List<String> COMMON_WORDS =
            List.of("the", "and", "or", "but", "in", "on", "at", "to", "for", "of");
    private static final List<String> POSITIVE_WORDS =
            List.of("good", "great", "excellent", "amazing", "wonderful", "fantastic");
    private static final List<String> NEGATIVE_WORDS =
            List.of("bad", "terrible", "awful", "horrible", "disappointing", "poor");
    private static final List<String> TECH_WORDS =
            List.of("algorithm", "data", "model", "system", "code", "software");
    private static final List<String> BUSINESS_WORDS =
            List.of("revenue", "profit", "customer", "market", "strategy", "business");

    @Override
    public EmbeddingVector embed(String text) {
        Objects.requireNonNull(text, "text must not be null");
        String clean = preprocess(text);

        List<Double> features = new ArrayList<>();
        addCharacterFeatures(clean, features);
        addWordFeatures(clean, features);
        addSemanticFeatures(clean, features);

        double[] raw = new double[features.size()];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = features.get(i);
        }
        return EmbeddingVector.normalized(raw, DIMENSION);
    }

    static String preprocess(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        String collapsed = WHITESPACE.matcher(lower).replaceAll(" ");
        return DISALLOWED.matcher(collapsed).replaceAll("").strip();
    }

    static List<String> words(String text) {
        String stripped = text.strip();
        if (stripped.isEmpty()) {
            return List.of();
        }
        return List.of(WHITESPACE.split(stripped));
    }

    static int length(String text) {
        return text.codePointCount(0, text.length());
    }

    // ---------------------------------------------------------------
    // Feature groups
    // ---------------------------------------------------------------

    private static void addCharacterFeatures(String text, List<Double> features) {
        int totalChars = length(text);
        int[] letterCounts = new int[26];
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= 'a' && c <= 'z') {
                letterCounts[c - 'a']++;
            }
        }
        for (int i = 0; i < LETTER_FEATURES; i++) {
            features.add(letterCounts[i % 26] / (double) Math.max(totalChars, 1));
        }

        long upper = text.codePoints().filter(Character::isUpperCase).count();
        features.add(totalChars / 1000.0);
        features.add(words(text).size() / (double) Math.max(totalChars, 1));
        features.add(upper / (double) Math.max(totalChars, 1));
    }

    private static void addWordFeatures(String text, List<Double> features) {
        List<String> words = words(text);

        if (!words.isEmpty()) {
            double sum = 0;
            for (String w : words) {
                sum += length(w);
            }
            double mean = sum / words.size();
            double squared = 0;
            for (String w : words) {
                double diff = length(w) - mean;
                squared += diff * diff;
            }
            features.add(mean / 10.0);
            features.add(Math.sqrt(squared / words.size()) / 10.0);
            features.add(new HashSet<>(words).size() / (double) words.size());
        } else {
            features.add(0.0);
            features.add(0.0);
            features.add(0.0);
        }

        for (String common : COMMON_WORDS) {
            long count = words.stream().filter(common::equals).count();
            features.add(count / (double) Math.max(words.size(), 1));
        }
    }

    private static void addSemanticFeatures(String text, List<Double> features) {
        int len = Math.max(length(text), 1);
        int wordCount = Math.max(words(text).size(), 1);

        int sentences = text.split("\\.", -1).length;
        features.add(sentences / (double) len);
        features.add(count(text, '?') / (double) len);
        features.add(count(text, '!') / (double) len);

        features.add(containedCount(text, POSITIVE_WORDS) / (double) wordCount);
        features.add(containedCount(text, NEGATIVE_WORDS) / (double) wordCount);
        features.add(containedCount(text, TECH_WORDS) / (double) wordCount);
        features.add(containedCount(text, BUSINESS_WORDS) / (double) wordCount);
    }

    private static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }

    /** Number of indicator words that occur anywhere in the text, as substrings. */
    private static int containedCount(String text, List<String> indicators) {
        int n = 0;
        for (String word : indicators) {
            if (text.contains(word)) {
                n++;
            }
        }
        return n;
    }
}
