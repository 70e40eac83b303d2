package com.driftguard.core.drift;

import com.driftguard.core.detection.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Scores semantic drift of a text against a static baseline set and the
 * recent history of its stream.
 *
 * <p>
 * {@code driftScore = 1 - max(cosine(current, baseline))} over all baselines
 * ({@code 0} when there are none); drift is detected when
 * {@code driftScore > 1 - similarityThreshold}, both sides taken at
 * {@value #SCORE_PLACES} decimal places. Similarities are clamped to
 * {@code [-1, 1]} and the score to {@code [0, 1]}. The recent similarity is the
 * mean cosine similarity to the last {@value #RECENT_COMPARISONS} embeddings
 * of the {@link RecentSampleWindow}; the current embedding is appended to the
 * window afterwards.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftScorer implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DriftScorer.class);

    /** Default similarity threshold. */
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.8;

    static final int RECENT_COMPARISONS = 10;

    /** Decimal places drift scores are reported and compared at. */
    static final int SCORE_PLACES = 4;

    private final TextEmbedder embedder;
    private final double similarityThreshold;

    /**
     * @param embedder            text embedder; must not be {@code null}
     * @param similarityThreshold minimum acceptable similarity, in {@code [0, 1]}
     * @throws IllegalArgumentException if the threshold is outside {@code [0, 1]}
     */
    public DriftScorer(TextEmbedder embedder, double similarityThreshold) {
        this.embedder = Objects.requireNonNull(embedder, "TextEmbedder must not be null");
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException(
                    "Similarity threshold must be in [0, 1], got: " + similarityThreshold);
        }
        this.similarityThreshold = similarityThreshold;
    }

    /**
     * Score one text and record its embedding in {@code recent}.
     *
     * @param text      the text; must not be {@code null}
     * @param baselines baseline embeddings; may be empty
     * @param recent    the stream's recent-sample window
     * @return the drift verdict
     * @throws IllegalArgumentException if a baseline has a different dimension
     */
    public DriftResult score(String text, List<EmbeddingVector> baselines, RecentSampleWindow recent) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(baselines, "baselines must not be null");
        Objects.requireNonNull(recent, "recent window must not be null");

        EmbeddingVector current = embedder.embed(text);

        double driftScore = 0.0;
        if (!baselines.isEmpty()) {
            double maxSimilarity = Double.NEGATIVE_INFINITY;
            for (EmbeddingVector baseline : baselines) {
                maxSimilarity = Math.max(maxSimilarity, current.dot(baseline));
            }
            driftScore = clamp(1.0 - clamp(maxSimilarity, -1.0, 1.0), 0.0, 1.0);
        }
        // compared at record precision so self-similarity rounding noise never counts as drift
        boolean detected = Stats.round(driftScore, SCORE_PLACES)
                > Stats.round(1.0 - similarityThreshold, SCORE_PLACES);

        double recentSimilarity = 1.0;
        if (!recent.isEmpty()) {
            List<EmbeddingVector> latest = recent.latest(RECENT_COMPARISONS);
            double sum = 0;
            for (EmbeddingVector sample : latest) {
                sum += current.dot(sample);
            }
            recentSimilarity = clamp(sum / latest.size(), -1.0, 1.0);
        }
        recent.add(current);

        if (detected) {
            LOG.debug("Drift detected: score={} threshold={}", driftScore, similarityThreshold);
        }
        return new DriftResult(driftScore, detected, recentSimilarity);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public TextEmbedder getEmbedder() {
        return embedder;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }
}
