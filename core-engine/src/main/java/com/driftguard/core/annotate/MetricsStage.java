package com.driftguard.core.annotate;

import com.driftguard.core.detection.Stats;
import com.driftguard.core.metrics.LlmMetricsCalculator;
import com.driftguard.core.metrics.MetricsHistory;
import com.driftguard.core.model.FieldReading;
import com.driftguard.core.model.TelemetryRecord;
import com.driftguard.core.reference.ReferenceData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Adds response quality, performance and trend metrics.
 *
 * <p>
 * Optional input fields that are configured but absent read as {@code 0};
 * configured fields holding non-numeric values fail the stage for that
 * record. Performance metrics need both a time and a token field. With
 * trends enabled, every processed record is appended to the session's
 * {@link MetricsHistory} after its trends are computed.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricsStage implements AnnotationStage {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MetricsStage.class);

    private final String responseField;
    private final String promptField;
    private final String timeField;
    private final String tokenField;
    private final String confidenceField;
    private final boolean includeTrends;
    private final LlmMetricsCalculator calculator = new LlmMetricsCalculator();
    private final Clock clock;

    /**
     * @param responseField   response text field
     * @param promptField     prompt text field, or {@code null}
     * @param timeField       response time field (seconds), or {@code null}
     * @param tokenField      token count field, or {@code null}
     * @param confidenceField confidence field, or {@code null}
     * @param includeTrends   whether to compute trends against the history
     * @param clock           source of timestamps
     */
    public MetricsStage(String responseField, String promptField, String timeField, String tokenField,
            String confidenceField, boolean includeTrends, Clock clock) {
        this.responseField = Objects.requireNonNull(responseField, "responseField must not be null");
        this.promptField = promptField;
        this.timeField = timeField;
        this.tokenField = tokenField;
        this.confidenceField = confidenceField;
        this.includeTrends = includeTrends;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void annotate(TelemetryRecord record, MonitoringSession session, ReferenceData reference) {
        try {
            String response = record.getText(responseField);
            String prompt = promptField != null ? record.getText(promptField) : null;
            Double responseTime = timeField != null ? readOrZero(record, timeField) : null;
            Integer tokenCount = tokenField != null ? readTokenCount(record, tokenField) : null;
            Double confidence = confidenceField != null ? readOrZero(record, confidenceField) : null;

            if (response.isEmpty()) {
                record.setField("llm_metrics_error", "Empty response field");
                return;
            }

            Map<String, Double> quality = calculator.responseQuality(response, prompt);
            quality.forEach((key, value) -> record.setField("quality_" + key, Stats.round(value, 4)));

            if (responseTime != null && tokenCount != null) {
                calculator.performance(responseTime, tokenCount, confidence)
                        .forEach((key, value) -> record.setField("perf_" + key, rounded(value)));
            }

            if (includeTrends) {
                Map<String, Double> current = new LinkedHashMap<>(quality);
                if (responseTime != null) {
                    current.put("response_time", responseTime);
                }
                if (tokenCount != null) {
                    current.put("token_count", tokenCount.doubleValue());
                }
                if (confidence != null) {
                    current.put("confidence_score", confidence);
                }
                MetricsHistory history = session.getMetricsHistory();
                calculator.trends(current, history)
                        .forEach((key, value) -> record.setField("trend_" + key, rounded(value)));
                history.add(current);
            }

            record.setField("overall_quality_score", Stats.round(calculator.overallQuality(quality), 4));
            record.setField("metrics_calculated_at", Instant.now(clock).toString());
        } catch (RuntimeException e) {
            LOG.error("Error calculating LLM metrics: {}", e.getMessage(), e);
            record.setField("llm_metrics_error", String.valueOf(e.getMessage()));
        }
    }

    private static double readOrZero(TelemetryRecord record, String field) {
        FieldReading reading = record.readNumeric(field);
        return switch (reading.getStatus()) {
            case PRESENT -> reading.getValue();
            case MISSING -> 0.0;
            case INVALID -> throw new IllegalArgumentException(reading.describeProblem());
        };
    }

    private static int readTokenCount(TelemetryRecord record, String field) {
        Object raw = record.getField(field).orElse(null);
        if (raw == null) {
            return 0;
        }
        if (raw instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value for " + field + ": " + raw, e);
        }
    }

    private static Object rounded(Object value) {
        if (value instanceof Double d) {
            return Stats.round(d, 4);
        }
        return value;
    }

    @Override
    public String getName() {
        return "metrics";
    }
}
