package com.driftguard.core.annotate;

import com.driftguard.core.detection.Stats;
import com.driftguard.core.drift.DriftResult;
import com.driftguard.core.drift.DriftScorer;
import com.driftguard.core.model.TelemetryRecord;
import com.driftguard.core.reference.ReferenceData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Scores semantic drift of one text field against the baseline embeddings.
 *
 * <p>
 * An empty or missing text is annotated as "no drift" and does not enter the
 * session's recent-sample window.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftStage implements AnnotationStage {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DriftStage.class);

    private final String field;
    private final DriftScorer scorer;
    private final Clock clock;

    public DriftStage(String field, DriftScorer scorer, Clock clock) {
        this.field = Objects.requireNonNull(field, "field must not be null");
        this.scorer = Objects.requireNonNull(scorer, "DriftScorer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void annotate(TelemetryRecord record, MonitoringSession session, ReferenceData reference) {
        try {
            String text = record.getText(field);
            if (text.isEmpty()) {
                record.setField("drift_score", 0.0);
                record.setField("drift_detected", false);
                record.setField("baseline_similarity", 0.0);
                return;
            }

            DriftResult result = scorer.score(text, reference.getBaselineEmbeddings(), session.getRecentSamples());
            record.setField("drift_score", Stats.round(result.getDriftScore(), 4));
            record.setField("drift_detected", result.isDriftDetected());
            record.setField("baseline_similarity", Stats.round(result.getBaselineSimilarity(), 4));
            record.setField("recent_similarity", Stats.round(result.getRecentSimilarity(), 4));
            record.setField("drift_severity", result.getSeverity().label());
            if (result.isDriftDetected()) {
                record.setField("drift_event_time", Instant.now(clock).toString());
            }
        } catch (RuntimeException e) {
            LOG.error("Error processing drift for field {}: {}", field, e.getMessage(), e);
            record.setField("drift_score", 0.0);
            record.setField("drift_detected", false);
            record.setField("drift_error", String.valueOf(e.getMessage()));
        }
    }

    @Override
    public String getName() {
        return "drift";
    }

    public DriftScorer getScorer() {
        return scorer;
    }
}
