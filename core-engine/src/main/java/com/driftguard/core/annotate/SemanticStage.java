package com.driftguard.core.annotate;

import com.driftguard.core.detection.Stats;
import com.driftguard.core.drift.SemanticComparator;
import com.driftguard.core.drift.SemanticComparison;
import com.driftguard.core.drift.SimilarityMethod;
import com.driftguard.core.model.TelemetryRecord;
import com.driftguard.core.reference.ReferenceData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Compares two text fields of the same record.
 *
 * @since 1.0.0
 */
public class SemanticStage implements AnnotationStage {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SemanticStage.class);

    private final String field1;
    private final String field2;
    private final SimilarityMethod method;
    private final boolean includeAnalysis;
    private final SemanticComparator comparator;

    public SemanticStage(String field1, String field2, SimilarityMethod method, boolean includeAnalysis,
            SemanticComparator comparator) {
        this.field1 = Objects.requireNonNull(field1, "field1 must not be null");
        this.field2 = Objects.requireNonNull(field2, "field2 must not be null");
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.includeAnalysis = includeAnalysis;
        this.comparator = Objects.requireNonNull(comparator, "SemanticComparator must not be null");
    }

    @Override
    public void annotate(TelemetryRecord record, MonitoringSession session, ReferenceData reference) {
        try {
            String text1 = record.getText(field1);
            String text2 = record.getText(field2);
            if (text1.isEmpty() || text2.isEmpty()) {
                record.setField("similarity_score", 0.0);
                record.setField("semantic_comparison_error", "Empty text fields");
                return;
            }

            SemanticComparison comparison = comparator.compare(text1, text2, method);
            record.setField("similarity_score", Stats.round(comparison.getSimilarity(), 4));
            record.setField("similarity_method", method.getId());
            record.setField("semantic_distance", Stats.round(comparison.getSemanticDistance(), 4));

            if (includeAnalysis) {
                record.setField("semantic_shift", Stats.round(comparison.getSemanticShift(), 4));
                record.setField("word_overlap", Stats.round(comparison.getWordOverlap(), 4));
                record.setField("length_ratio", Stats.round(comparison.getLengthRatio(), 4));
                record.setField("shift_magnitude", Stats.round(comparison.getShiftMagnitude(), 4));
                record.setField("shift_direction", comparison.getShiftDirection());
            }
            record.setField("similarity_category", comparison.getSimilarityCategory());
        } catch (RuntimeException e) {
            LOG.error("Error processing semantic comparison: {}", e.getMessage(), e);
            record.setField("similarity_score", 0.0);
            record.setField("semantic_comparison_error", String.valueOf(e.getMessage()));
        }
    }

    @Override
    public String getName() {
        return "semantic";
    }
}
