package com.driftguard.core.metrics;

import com.driftguard.core.detection.Stats;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Heuristic quality, performance and trend metrics for one LLM response.
 *
 * <p>
 * All text measures split words on whitespace and sentences on {@code '.'};
 * blank sentence fragments are ignored. Scores are in {@code [0, 1]}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Stateless and thread-safe. Trend history lives in a {@link MetricsHistory}
 * owned by the caller.
 * </p>
 *
 * @since 1.0.0
 */
public class LlmMetricsCalculator implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Metrics that get trend analysis, in output order. */
    public static final List<String> TREND_METRICS =
            List.of("response_time", "token_count", "confidence_score", "coherence_score");

    private static final List<String> TRANSITION_WORDS = List.of(
            "however", "therefore", "furthermore", "additionally", "moreover",
            "consequently", "meanwhile", "similarly", "in contrast", "for example");

    private static final List<String> PRONOUNS = List.of("it", "this", "that", "these", "those", "they", "them");

    private static final List<String> CONCLUSION_WORDS = List.of("conclusion", "summary", "finally", "therefore");

    private static final List<String> EXAMPLE_WORDS = List.of("example", "instance", "such as", "for example");

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
            "is", "are", "was", "were");

    // ---------------------------------------------------------------
    // Quality
    // ---------------------------------------------------------------

    /**
     * Quality metrics of a response: {@code response_length, word_count,
     * sentence_count, avg_word_length, readability_score, coherence_score,
     * completeness_score, language_quality, information_density}.
     *
     * @param response the response text; must not be {@code null}
     * @param prompt   the prompt, or {@code null}/empty when unknown
     * @return metrics in the order above
     */
    public Map<String, Double> responseQuality(String response, String prompt) {
        List<String> words = words(response);
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("response_length", (double) length(response));
        metrics.put("word_count", (double) words.size());
        metrics.put("sentence_count", (double) sentences(response).size());
        metrics.put("avg_word_length", averageWordLength(words));
        metrics.put("readability_score", readability(response));
        metrics.put("coherence_score", coherence(response));
        metrics.put("completeness_score", completeness(response, prompt));
        metrics.put("language_quality", languageQuality(response));
        metrics.put("information_density", informationDensity(response));
        return metrics;
    }

    /**
     * Mean of readability, coherence, completeness and language quality.
     *
     * @param quality output of {@link #responseQuality}
     * @return the overall score
     */
    public double overallQuality(Map<String, Double> quality) {
        return (quality.getOrDefault("readability_score", 0.0)
                + quality.getOrDefault("coherence_score", 0.0)
                + quality.getOrDefault("completeness_score", 0.0)
                + quality.getOrDefault("language_quality", 0.0)) / 4.0;
    }

    static double readability(String text) {
        List<String> sentences = sentences(text);
        List<String> words = words(text);
        if (sentences.isEmpty() || words.isEmpty()) {
            return 0.0;
        }
        double avgSentenceLength = (double) words.size() / sentences.size();
        double avgWordLength = averageWordLength(words);
        double readability = 1.0 - Math.min(1.0, (avgSentenceLength / 20 + avgWordLength / 6) / 2);
        return Math.max(0.0, readability);
    }

    static double coherence(String text) {
        if (text.isEmpty()) {
            return 0.0;
        }
        List<String> sentences = sentences(text);
        if (sentences.size() < 2) {
            return 1.0;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        long transitions = TRANSITION_WORDS.stream().filter(lower::contains).count();
        Set<String> tokens = new HashSet<>(words(lower));
        long pronouns = PRONOUNS.stream().filter(tokens::contains).count();
        return Math.min(1.0, (transitions * 0.1 + pronouns * 0.05) / sentences.size());
    }

    static double completeness(String response, String prompt) {
        if (response.isEmpty()) {
            return 0.0;
        }
        String lower = response.toLowerCase(Locale.ROOT);
        double completeness = 0.0;
        if (CONCLUSION_WORDS.stream().anyMatch(lower::contains)) {
            completeness += 0.4;
        }
        if (EXAMPLE_WORDS.stream().anyMatch(lower::contains)) {
            completeness += 0.3;
        }
        if (sentences(response).size() >= 2) {
            completeness += 0.3;
        }
        if (prompt != null && !prompt.isEmpty()) {
            Set<String> promptWords = new HashSet<>(words(prompt.toLowerCase(Locale.ROOT)));
            Set<String> responseWords = new HashSet<>(words(lower));
            int promptSize = promptWords.size();
            promptWords.retainAll(responseWords);
            double overlap = (double) promptWords.size() / Math.max(promptSize, 1);
            completeness = (completeness + overlap) / 2;
        }
        return Math.min(1.0, completeness);
    }

    static double languageQuality(String text) {
        if (text.isEmpty()) {
            return 0.0;
        }
        double quality = grammar(text) * 0.5 + vocabularyDiversity(text) * 0.3 + (1 - repetition(text)) * 0.2;
        return Math.max(0.0, Math.min(1.0, quality));
    }

    static double informationDensity(String text) {
        List<String> words = words(text);
        if (words.isEmpty()) {
            return 0.0;
        }
        long content = words.stream()
                .filter(w -> !STOP_WORDS.contains(w.toLowerCase(Locale.ROOT)))
                .count();
        return (double) content / words.size();
    }

    static double repetition(String text) {
        List<String> words = words(text.toLowerCase(Locale.ROOT));
        if (words.size() < 2) {
            return 0.0;
        }
        Map<String, Integer> counts = new HashMap<>();
        words.forEach(w -> counts.merge(w, 1, Integer::sum));
        int maxCount = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        // up to 10% repetition is normal
        return Math.max(0.0, (double) maxCount / words.size() - 0.1);
    }

    static double grammar(String text) {
        boolean capitalStart = !text.isEmpty() && Character.isUpperCase(text.codePointAt(0));
        boolean punctuated = text.endsWith(".") || text.endsWith("!") || text.endsWith("?");
        List<String> sentences = sentences(text);
        long proper = sentences.stream()
                .filter(s -> Character.isUpperCase(s.codePointAt(0)))
                .count();
        double sentenceQuality = (double) proper / Math.max(sentences.size(), 1);

        double score = 0.0;
        if (capitalStart) {
            score += 0.3;
        }
        if (punctuated) {
            score += 0.3;
        }
        score += sentenceQuality * 0.4;
        return Math.min(1.0, score);
    }

    static double vocabularyDiversity(String text) {
        List<String> words = words(text.toLowerCase(Locale.ROOT));
        if (words.isEmpty()) {
            return 0.0;
        }
        return (double) new HashSet<>(words).size() / words.size();
    }

    // ---------------------------------------------------------------
    // Performance
    // ---------------------------------------------------------------

    /**
     * Performance metrics: {@code response_time, tokens_per_second,
     * time_per_token, token_count, performance_category} and, when a
     * confidence is given, {@code confidence_score, confidence_category}.
     *
     * @param responseTime response time in seconds
     * @param tokenCount   generated tokens
     * @param confidence   model confidence, or {@code null}
     * @return metrics in the order above; categories are strings
     */
    public Map<String, Object> performance(double responseTime, int tokenCount, Double confidence) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("response_time", responseTime);
        metrics.put("tokens_per_second", tokenCount / Math.max(responseTime, 0.001));
        metrics.put("time_per_token", responseTime / Math.max(tokenCount, 1));
        metrics.put("token_count", tokenCount);
        metrics.put("performance_category", performanceCategory(responseTime, tokenCount));
        if (confidence != null) {
            metrics.put("confidence_score", confidence);
            metrics.put("confidence_category", confidenceCategory(confidence));
        }
        return metrics;
    }

    static String performanceCategory(double responseTime, int tokenCount) {
        double tokensPerSecond = tokenCount / Math.max(responseTime, 0.001);
        if (responseTime < 1.0 && tokensPerSecond > 100) {
            return "excellent";
        } else if (responseTime < 3.0 && tokensPerSecond > 50) {
            return "good";
        } else if (responseTime < 10.0 && tokensPerSecond > 20) {
            return "acceptable";
        }
        return "poor";
    }

    static String confidenceCategory(double confidence) {
        if (confidence >= 0.9) {
            return "very_high";
        } else if (confidence >= 0.7) {
            return "high";
        } else if (confidence >= 0.5) {
            return "medium";
        } else if (confidence >= 0.3) {
            return "low";
        }
        return "very_low";
    }

    // ---------------------------------------------------------------
    // Trends
    // ---------------------------------------------------------------

    /**
     * Trend metrics of {@link #TREND_METRICS} against the history:
     * {@code <m>_trend_pct}, {@code <m>_trend_direction} and, with at least
     * two historical values, {@code <m>_volatility} (population standard
     * deviation).
     *
     * @param current metric values of the current record
     * @param history earlier snapshots
     * @return trend metrics; empty when the history is empty
     */
    public Map<String, Object> trends(Map<String, Double> current, MetricsHistory history) {
        Map<String, Object> trends = new LinkedHashMap<>();
        List<Map<String, Double>> entries = history.entries();
        if (entries.isEmpty()) {
            return trends;
        }
        for (String metric : TREND_METRICS) {
            Double value = current.get(metric);
            if (value == null) {
                continue;
            }
            List<Double> historical = new ArrayList<>();
            for (Map<String, Double> entry : entries) {
                Double past = entry.get(metric);
                if (past != null) {
                    historical.add(past);
                }
            }
            if (historical.isEmpty()) {
                continue;
            }
            double avg = Stats.mean(historical);
            double pct = (value - avg) / Math.max(avg, 0.001) * 100;
            trends.put(metric + "_trend_pct", pct);
            trends.put(metric + "_trend_direction", pct > 5 ? "improving" : pct < -5 ? "declining" : "stable");
            if (historical.size() > 1) {
                trends.put(metric + "_volatility", Stats.populationStdDev(historical));
            }
        }
        return trends;
    }

    // ---------------------------------------------------------------
    // Text helpers
    // ---------------------------------------------------------------

    static List<String> words(String text) {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(trimmed.split("\\s+"));
    }

    static List<String> sentences(String text) {
        List<String> sentences = new ArrayList<>();
        for (String part : text.split("\\.", -1)) {
            String stripped = part.strip();
            if (!stripped.isEmpty()) {
                sentences.add(stripped);
            }
        }
        return sentences;
    }

    private static int length(String text) {
        return text.codePointCount(0, text.length());
    }

    private static double averageWordLength(List<String> words) {
        if (words.isEmpty()) {
            return 0.0;
        }
        double total = 0;
        for (String word : words) {
            total += length(word);
        }
        return total / words.size();
    }
}
