package com.driftguard.core.reference;

import com.driftguard.core.drift.EmbeddingVector;
import com.driftguard.core.drift.TextEmbedder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of all reference data used while annotating records.
 *
 * <p>
 * One snapshot is shared read-only by every monitoring session. Reloading
 * produces a new snapshot; see {@link ReferenceDataRegistry}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ReferenceData implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ReferenceData.class);

    private static final ReferenceData EMPTY =
            new ReferenceData(BaselineTable.empty(), ThresholdTable.empty(), List.of());

    private final BaselineTable baselines;
    private final ThresholdTable thresholds;
    private final List<EmbeddingVector> baselineEmbeddings;

    public ReferenceData(BaselineTable baselines, ThresholdTable thresholds,
            List<EmbeddingVector> baselineEmbeddings) {
        this.baselines = Objects.requireNonNull(baselines, "BaselineTable must not be null");
        this.thresholds = Objects.requireNonNull(thresholds, "ThresholdTable must not be null");
        this.baselineEmbeddings = List.copyOf(
                Objects.requireNonNull(baselineEmbeddings, "Baseline embeddings must not be null"));
    }

    public static ReferenceData empty() {
        return EMPTY;
    }

    /**
     * Load all reference tables from one directory. Missing or malformed
     * files yield empty tables.
     *
     * @param directory         lookup directory
     * @param baselineFile      baseline CSV file name
     * @param thresholdFile     threshold CSV file name
     * @param baselineTextFile  baseline text/embedding CSV file name
     * @param embedder          embedder for text rows
     * @return the snapshot, never {@code null}
     */
    public static ReferenceData load(Path directory, String baselineFile, String thresholdFile,
            String baselineTextFile, TextEmbedder embedder) {
        Objects.requireNonNull(directory, "Lookup directory must not be null");
        ReferenceData data = new ReferenceData(
                ReferenceTableLoader.loadBaselines(directory.resolve(baselineFile)),
                ReferenceTableLoader.loadThresholds(directory.resolve(thresholdFile)),
                ReferenceTableLoader.loadBaselineEmbeddings(directory.resolve(baselineTextFile), embedder));
        LOG.info("Reference data loaded from {}: {} baseline row(s), {} threshold(s), {} baseline embedding(s)",
                directory, data.baselines.size(), data.thresholds.size(), data.baselineEmbeddings.size());
        return data;
    }

    public BaselineTable getBaselines() {
        return baselines;
    }

    public ThresholdTable getThresholds() {
        return thresholds;
    }

    public List<EmbeddingVector> getBaselineEmbeddings() {
        return baselineEmbeddings;
    }

    @Override
    public String toString() {
        return "ReferenceData{" +
                "baselines=" + baselines.size() +
                ", thresholds=" + thresholds.size() +
                ", baselineEmbeddings=" + baselineEmbeddings.size() +
                '}';
    }
}
