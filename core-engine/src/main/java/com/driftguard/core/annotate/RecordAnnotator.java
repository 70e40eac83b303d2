package com.driftguard.core.annotate;

import com.driftguard.core.config.MonitorConfig;
import com.driftguard.core.detection.DetectorFactory;
import com.driftguard.core.drift.DriftScorer;
import com.driftguard.core.drift.SemanticComparator;
import com.driftguard.core.drift.TextEmbedder;
import com.driftguard.core.model.TelemetryRecord;
import com.driftguard.core.reference.ReferenceData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Annotates telemetry records with every enabled monitoring stage.
 *
 * <h3>Stage order</h3>
 * <p>
 * metrics, anomaly, baseline, drift, semantic. Each stage writes its own
 * error field on failure. A stage that still throws is reported in
 * {@code annotation_error} and the remaining stages run. The record is always
 * returned.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The annotator itself is immutable. The {@link MonitoringSession} passed to
 * {@link #annotate} must not be used by two threads at once.
 * </p>
 *
 * @since 1.0.0
 */
public class RecordAnnotator implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RecordAnnotator.class);

    private final MonitorConfig config;
    private final TextEmbedder embedder;
    private final List<AnnotationStage> stages;

    public RecordAnnotator(MonitorConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * @param config validated monitor configuration
     * @param clock  source of the timestamps written to records
     * @throws IllegalStateException if the configuration is invalid
     */
    public RecordAnnotator(MonitorConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "MonitorConfig must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        config.validate();
        this.embedder = config.getDrift().embedderType().create();
        this.stages = Collections.unmodifiableList(buildStages(config, embedder, clock));
        LOG.info("Record annotator ready with stages {}", stageNames());
    }

    private static List<AnnotationStage> buildStages(MonitorConfig config, TextEmbedder embedder, Clock clock) {
        List<AnnotationStage> stages = new ArrayList<>();

        MonitorConfig.MetricsSettings metrics = config.getMetrics();
        if (metrics.isEnabled()) {
            stages.add(new MetricsStage(metrics.getResponseField(), metrics.getPromptField(),
                    metrics.getTimeField(), metrics.getTokenField(), metrics.getConfidenceField(),
                    metrics.isIncludeTrends(), clock));
        }

        MonitorConfig.AnomalySettings anomaly = config.getAnomaly();
        if (anomaly.isEnabled()) {
            stages.add(new AnomalyStage(anomaly.getFields(),
                    DetectorFactory.createAll(anomaly.detectorKinds(), anomaly.getThreshold()),
                    anomaly.getMethod().trim().toLowerCase(Locale.ROOT), anomaly.getThreshold(),
                    anomaly.isIncludeAnalysis(), clock));
        }

        MonitorConfig.BaselineSettings baseline = config.getBaseline();
        if (baseline.isEnabled()) {
            stages.add(new BaselineStage(baseline.getMetric(), baseline.getBaselineField(),
                    baseline.getModelField(), baseline.getComparison(), baseline.isGenerateAlerts(), clock));
        }

        MonitorConfig.DriftSettings drift = config.getDrift();
        if (drift.isEnabled()) {
            stages.add(new DriftStage(drift.getField(), new DriftScorer(embedder, drift.getThreshold()), clock));
        }

        MonitorConfig.SemanticSettings semantic = config.getSemantic();
        if (semantic.isEnabled()) {
            stages.add(new SemanticStage(semantic.getField1(), semantic.getField2(), semantic.similarityMethod(),
                    semantic.isIncludeAnalysis(), new SemanticComparator(embedder)));
        }
        return stages;
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Create fresh state for a new record stream, sized from the
     * configuration.
     *
     * @return a new session
     */
    public MonitoringSession newSession() {
        return new MonitoringSession(config.getAnomaly().getWindow(), config.getDrift().getWindowSize());
    }

    /**
     * Load the reference tables named by the configuration from its lookup
     * directory. Missing or malformed files yield empty tables.
     *
     * @return the snapshot
     */
    public ReferenceData loadReferenceData() {
        return ReferenceData.load(Path.of(config.getLookupDirectory()),
                config.getBaseline().getBaselineFile(),
                config.getBaseline().getThresholdFile(),
                config.getDrift().getBaselineFile(),
                embedder);
    }

    /**
     * Annotate one record in place.
     *
     * @param record    the record; must not be {@code null}
     * @param session   the stream's state; must not be {@code null}
     * @param reference reference data snapshot; must not be {@code null}
     * @return the same record instance
     */
    public TelemetryRecord annotate(TelemetryRecord record, MonitoringSession session, ReferenceData reference) {
        Objects.requireNonNull(record, "record must not be null");
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(reference, "reference data must not be null");

        for (AnnotationStage stage : stages) {
            try {
                stage.annotate(record, session, reference);
            } catch (RuntimeException e) {
                LOG.error("Stage '{}' failed: {}", stage.getName(), e.getMessage(), e);
                record.setField("annotation_error", stage.getName() + ": " + e.getMessage());
            }
        }
        LOG.trace("Annotated record: {}", record);
        return record;
    }

    public List<String> stageNames() {
        return stages.stream().map(AnnotationStage::getName).toList();
    }

    public List<AnnotationStage> getStages() {
        return stages;
    }

    public MonitorConfig getConfig() {
        return config;
    }

    public TextEmbedder getEmbedder() {
        return embedder;
    }
}
