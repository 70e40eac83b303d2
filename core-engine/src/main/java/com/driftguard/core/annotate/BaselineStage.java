package com.driftguard.core.annotate;

import com.driftguard.core.baseline.BaselineComparator;
import com.driftguard.core.baseline.ComparisonResult;
import com.driftguard.core.baseline.ComparisonStatus;
import com.driftguard.core.detection.Stats;
import com.driftguard.core.model.FieldReading;
import com.driftguard.core.model.TelemetryRecord;
import com.driftguard.core.reference.BaselineTable;
import com.driftguard.core.reference.ReferenceData;
import com.driftguard.core.reference.ThresholdRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Compares one metric of the record with its baseline.
 *
 * <h3>Baseline resolution</h3>
 * <ol>
 * <li>The inline baseline field, when configured, present and numeric.</li>
 * <li>The {@link BaselineTable} value for the record's model id (see
 * {@link BaselineTable#lookup(String, String)}).</li>
 * </ol>
 * <p>
 * Without a baseline the record gets {@code baseline_comparison_error} and
 * no comparison fields.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineStage implements AnnotationStage {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(BaselineStage.class);

    private final String metric;
    private final String baselineField;
    private final String modelField;
    private final String comparison;
    private final boolean generateAlerts;
    private final Clock clock;

    /**
     * @param metric         field holding the current value
     * @param baselineField  inline baseline field, or {@code null}
     * @param modelField     field holding the model id
     * @param comparison     comparison type recorded on the record
     * @param generateAlerts whether to attach alert fields
     * @param clock          source of timestamps
     */
    public BaselineStage(String metric, String baselineField, String modelField, String comparison,
            boolean generateAlerts, Clock clock) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.baselineField = baselineField;
        this.modelField = Objects.requireNonNull(modelField, "modelField must not be null");
        this.comparison = comparison != null ? comparison : BaselineComparator.DEFAULT_COMPARISON_TYPE;
        this.generateAlerts = generateAlerts;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void annotate(TelemetryRecord record, MonitoringSession session, ReferenceData reference) {
        try {
            FieldReading current = record.readNumeric(metric);
            if (!current.isPresent()) {
                record.setField("baseline_comparison_error", current.describeProblem());
                return;
            }

            String modelId = record.getStringField(modelField).orElse(BaselineTable.DEFAULT_MODEL);
            Optional<Double> baseline = resolveBaseline(record, reference.getBaselines(), modelId);
            if (baseline.isEmpty()) {
                record.setField("baseline_comparison_error", "No baseline found for metric " + metric);
                return;
            }

            BaselineComparator comparator = new BaselineComparator(reference.getThresholds());
            ComparisonResult result = comparator.compare(current.getValue(), baseline.get(), metric, comparison);
            String now = Instant.now(clock).toString();

            record.setField("baseline_comparison_status", result.getStatus().label());
            record.setField("baseline_current_value", Stats.round(result.getCurrent(), 4));
            record.setField("baseline_reference_value", Stats.round(result.getBaseline(), 4));
            record.setField("baseline_absolute_deviation", Stats.round(result.getAbsoluteDeviation(), 4));
            record.setField("baseline_percentage_change", Stats.round(result.getPercentageChange(), 2));
            result.getRatio().ifPresent(r -> record.setField("baseline_ratio", Stats.round(r, 4)));
            result.getZScoreEstimate().ifPresent(z -> record.setField("baseline_z_score", Stats.round(z, 2)));

            if (generateAlerts && result.getStatus() != ComparisonStatus.NORMAL) {
                record.setField("baseline_alert_message", comparator.alertMessage(result, modelId));
                record.setField("baseline_alert_severity", result.getStatus().label());
                record.setField("baseline_alert_time", now);
                LOG.debug("Baseline alert for model {} on {}: {}", modelId, metric, result.getStatus());
            }

            Optional<ThresholdRule> rule = comparator.thresholdFor(metric);
            if (rule.isPresent()) {
                record.setField("baseline_warning_threshold", rule.get().getWarningThreshold());
                record.setField("baseline_critical_threshold", rule.get().getCriticalThreshold());
                record.setField("baseline_threshold_type", rule.get().getThresholdType());
            }

            record.setField("baseline_deviation_category", result.getDeviationCategory());
            record.setField("baseline_trend", result.getTrend());
            record.setField("baseline_comparison_time", now);
            record.setField("baseline_comparison_method", comparison);
        } catch (RuntimeException e) {
            LOG.error("Error in baseline comparison: {}", e.getMessage(), e);
            record.setField("baseline_comparison_error", String.valueOf(e.getMessage()));
        }
    }

    private Optional<Double> resolveBaseline(TelemetryRecord record, BaselineTable table, String modelId) {
        if (baselineField != null && record.hasField(baselineField)) {
            FieldReading inline = record.readNumeric(baselineField);
            if (inline.isPresent()) {
                return Optional.of(inline.getValue());
            }
        }
        Optional<Object> stored = table.lookup(modelId, metric);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        Object raw = stored.get();
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        throw new IllegalArgumentException("Invalid baseline value for " + metric + ": " + raw);
    }

    @Override
    public String getName() {
        return "baseline";
    }
}
