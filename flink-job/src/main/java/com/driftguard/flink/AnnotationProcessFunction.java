package com.driftguard.flink;

import com.driftguard.core.annotate.MonitoringSession;
import com.driftguard.core.annotate.RecordAnnotator;
import com.driftguard.core.config.MonitorConfig;
import com.driftguard.core.model.TelemetryRecord;
import com.driftguard.core.reference.ReferenceDataRegistry;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Flink {@link KeyedProcessFunction} that annotates every telemetry record of
 * a stream key with the configured monitoring stages.
 *
 * <h3>State Management</h3>
 * <p>
 * A {@code ValueState<MonitoringSession>} holds the detector windows, recent
 * drift samples and metrics history of each key, so streams never share
 * state. Reference data is read-only and shared by all keys of the task
 * through a {@link ReferenceDataRegistry}; with a reload interval configured
 * a background thread swaps in freshly loaded tables.
 * </p>
 *
 * <h3>Metrics</h3>
 * <p>
 * Custom Flink metrics are registered in {@link #open(Configuration)} and
 * updated for every record.
 * </p>
 *
 * @since 1.0.0
 */
public class AnnotationProcessFunction
        extends KeyedProcessFunction<String, TelemetryRecord, TelemetryRecord> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnnotationProcessFunction.class);

    private final MonitorConfig monitorConfig;
    private final long referenceReloadIntervalMs;

    private transient RecordAnnotator annotator;
    private transient ReferenceDataRegistry referenceData;
    private transient ScheduledExecutorService reloader;

    /** Flink keyed state holding the per-key monitoring session. */
    private transient ValueState<MonitoringSession> sessionState;

    /** Custom Flink metrics. */
    private transient DriftGuardMetrics metrics;

    /**
     * @param monitorConfig             validated monitoring configuration
     * @param referenceReloadIntervalMs reload period for reference tables,
     *                                  {@code 0} to load them once
     */
    public AnnotationProcessFunction(MonitorConfig monitorConfig, long referenceReloadIntervalMs) {
        this.monitorConfig = Objects.requireNonNull(monitorConfig, "MonitorConfig must not be null");
        if (referenceReloadIntervalMs < 0) {
            throw new IllegalArgumentException(
                    "referenceReloadIntervalMs must be >= 0, got: " + referenceReloadIntervalMs);
        }
        this.referenceReloadIntervalMs = referenceReloadIntervalMs;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        annotator = new RecordAnnotator(monitorConfig);
        referenceData = new ReferenceDataRegistry(annotator.loadReferenceData());

        if (referenceReloadIntervalMs > 0) {
            reloader = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "driftguard-reference-reload");
                t.setDaemon(true);
                return t;
            });
            reloader.scheduleWithFixedDelay(this::reloadReferenceData,
                    referenceReloadIntervalMs, referenceReloadIntervalMs, TimeUnit.MILLISECONDS);
        }

        ValueStateDescriptor<MonitoringSession> descriptor = new ValueStateDescriptor<>(
                "monitoring-session", TypeInformation.of(MonitoringSession.class));
        sessionState = getRuntimeContext().getState(descriptor);

        metrics = new DriftGuardMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("AnnotationProcessFunction opened with stages {}", annotator.stageNames());
    }

    @Override
    public void close() {
        if (reloader != null) {
            reloader.shutdownNow();
        }
        LOG.info("AnnotationProcessFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(TelemetryRecord record,
            KeyedProcessFunction<String, TelemetryRecord, TelemetryRecord>.Context ctx,
            Collector<TelemetryRecord> out) throws Exception {
        long startNanos = System.nanoTime();

        // lazily create the session on the key's first record
        MonitoringSession session = sessionState.value();
        if (session == null) {
            session = annotator.newSession();
            LOG.debug("New monitoring session for key {}", ctx.getCurrentKey());
        }

        annotator.annotate(record, session, referenceData.current());
        sessionState.update(session);
        out.collect(record);

        updateMetrics(record);
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        metrics.recordLatency(durationMs);
    }

    private void updateMetrics(TelemetryRecord record) {
        metrics.incrementRecordsProcessed();
        if (Boolean.TRUE.equals(record.getField("anomaly_detected").orElse(null))) {
            metrics.incrementAnomaliesFlagged();
        }
        if (Boolean.TRUE.equals(record.getField("drift_detected").orElse(null))) {
            metrics.incrementDriftEvents();
        }
        if (hasErrorField(record)) {
            metrics.incrementAnnotationErrors();
        }
    }

    static boolean hasErrorField(TelemetryRecord record) {
        return record.getFields().keySet().stream()
                .anyMatch(name -> name.endsWith("_error") || name.equals("anomaly_field_errors"));
    }

    private void reloadReferenceData() {
        try {
            referenceData.reload(annotator::loadReferenceData);
        } catch (RuntimeException e) {
            LOG.error("Reference data reload failed, keeping previous tables: {}", e.getMessage(), e);
        }
    }
}
