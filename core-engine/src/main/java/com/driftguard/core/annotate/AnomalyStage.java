package com.driftguard.core.annotate;

import com.driftguard.core.detection.AnomalyDetector;
import com.driftguard.core.detection.AnomalySeverity;
import com.driftguard.core.detection.Stats;
import com.driftguard.core.model.DetectionResult;
import com.driftguard.core.model.FieldReading;
import com.driftguard.core.model.TelemetryRecord;
import com.driftguard.core.reference.ReferenceData;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the configured detectors over every analysed numeric field.
 *
 * <p>
 * Anomalies are identified as {@code <field>_<kind>} and reported in field
 * order, then detector order. Fields that are missing or not numeric are
 * skipped and listed in {@code anomaly_field_errors}.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyStage implements AnnotationStage {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnomalyStage.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<String> fields;
    private final List<AnomalyDetector> detectors;
    private final String method;
    private final double threshold;
    private final boolean includeAnalysis;
    private final Clock clock;

    /**
     * @param fields          numeric fields to analyse, in order
     * @param detectors       detectors to run on each field, in order
     * @param method          configured method name, recorded on the record
     * @param threshold       configured threshold, recorded on the record
     * @param includeAnalysis whether to attach per-anomaly diagnostics
     * @param clock           source of detection timestamps
     */
    public AnomalyStage(List<String> fields, List<AnomalyDetector> detectors, String method, double threshold,
            boolean includeAnalysis, Clock clock) {
        this.fields = List.copyOf(Objects.requireNonNull(fields, "fields must not be null"));
        this.detectors = List.copyOf(Objects.requireNonNull(detectors, "detectors must not be null"));
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.threshold = threshold;
        this.includeAnalysis = includeAnalysis;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void annotate(TelemetryRecord record, MonitoringSession session, ReferenceData reference) {
        try {
            List<String> anomalies = new ArrayList<>();
            Map<String, Double> scores = new LinkedHashMap<>();
            Map<String, Map<String, Object>> details = new LinkedHashMap<>();
            List<String> fieldErrors = new ArrayList<>();

            for (String field : fields) {
                FieldReading reading = record.readNumeric(field);
                if (!reading.isPresent()) {
                    fieldErrors.add(reading.describeProblem());
                    continue;
                }
                for (AnomalyDetector detector : detectors) {
                    DetectionResult result = detector.evaluate(session.getWindows(), field, reading.getValue());
                    if (result.isAnomaly()) {
                        String id = detector.getKind().anomalyId(field);
                        anomalies.add(id);
                        scores.put(id, result.getScore());
                        if (includeAnalysis) {
                            details.put(id, result.getDiagnostics());
                        }
                    }
                }
            }

            record.setField("anomaly_detected", !anomalies.isEmpty());
            record.setField("anomaly_count", anomalies.size());
            record.setField("anomaly_types", String.join(",", anomalies));

            if (anomalies.isEmpty()) {
                record.setField("anomaly_severity", AnomalySeverity.NONE.label());
                record.setField("max_anomaly_score", 0.0);
            } else {
                double maxScore = scores.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
                record.setField("anomaly_severity", AnomalySeverity.classify(anomalies.size(), maxScore).label());
                record.setField("max_anomaly_score", Stats.round(maxScore, 4));
                scores.forEach((id, score) -> record.setField("anomaly_score_" + id, Stats.round(score, 4)));
                LOG.debug("Record flagged with {} anomaly(ies): {}", anomalies.size(), anomalies);
            }

            if (includeAnalysis && !details.isEmpty()) {
                record.setField("anomaly_analysis", MAPPER.writeValueAsString(details));
            }
            if (!fieldErrors.isEmpty()) {
                record.setField("anomaly_field_errors", String.join("; ", fieldErrors));
            }

            record.setField("anomaly_detection_time", Instant.now(clock).toString());
            record.setField("anomaly_detection_method", method);
            record.setField("anomaly_threshold", threshold);
        } catch (JsonProcessingException | RuntimeException e) {
            LOG.error("Error detecting anomalies: {}", e.getMessage(), e);
            record.setField("anomaly_detection_error", String.valueOf(e.getMessage()));
            record.setField("anomaly_detected", false);
        }
    }

    @Override
    public String getName() {
        return "anomaly";
    }

    public List<AnomalyDetector> getDetectors() {
        return detectors;
    }
}
