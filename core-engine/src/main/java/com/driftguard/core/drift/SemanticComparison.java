package com.driftguard.core.drift;

/**
 * Result of comparing two texts with {@link SemanticComparator}.
 *
 * @since 1.0.0
 */
public final class SemanticComparison {

    private final double similarity;
    private final double cosineSimilarity;
    private final double wordOverlap;
    private final double lengthRatio;

    SemanticComparison(double similarity, double cosineSimilarity, double wordOverlap, double lengthRatio) {
        this.similarity = similarity;
        this.cosineSimilarity = cosineSimilarity;
        this.wordOverlap = wordOverlap;
        this.lengthRatio = lengthRatio;
    }

    /**
     * @return similarity under the requested method
     */
    public double getSimilarity() {
        return similarity;
    }

    public double getSemanticDistance() {
        return 1.0 - similarity;
    }

    /**
     * @return {@code 1 - cosine similarity}
     */
    public double getSemanticShift() {
        return 1.0 - cosineSimilarity;
    }

    public double getShiftMagnitude() {
        return Math.abs(1.0 - cosineSimilarity);
    }

    public double getWordOverlap() {
        return wordOverlap;
    }

    public double getLengthRatio() {
        return lengthRatio;
    }

    /**
     * @return {@code expansion} above a 1.2 length ratio, {@code contraction}
     *         below 0.8, otherwise {@code stable}
     */
    public String getShiftDirection() {
        if (lengthRatio > 1.2) {
            return "expansion";
        } else if (lengthRatio < 0.8) {
            return "contraction";
        }
        return "stable";
    }

    /**
     * @return {@code very_high} from 0.9, {@code high} from 0.7,
     *         {@code medium} from 0.5, {@code low} from 0.3, else
     *         {@code very_low}
     */
    public String getSimilarityCategory() {
        if (similarity >= 0.9) {
            return "very_high";
        } else if (similarity >= 0.7) {
            return "high";
        } else if (similarity >= 0.5) {
            return "medium";
        } else if (similarity >= 0.3) {
            return "low";
        }
        return "very_low";
    }
}
