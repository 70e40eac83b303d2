package com.driftguard.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metric definitions for DriftGuard.
 * <p>
 * Flink exposes these via its configured metric reporters. The reporter is
 * configured at cluster level; the job only defines the metrics.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code records_processed_total} - counter of annotated records</li>
 *   <li>{@code anomalies_flagged_total} - records with at least one anomaly</li>
 *   <li>{@code drift_events_total} - records with detected drift</li>
 *   <li>{@code annotation_errors_total} - records carrying an error field</li>
 *   <li>{@code processing_latency_ms} - histogram of per-record latency</li>
 * </ul>
 */
public class DriftGuardMetrics {

    private final Counter recordsProcessed;
    private final Counter anomaliesFlagged;
    private final Counter driftEvents;
    private final Counter annotationErrors;
    private final Histogram processingLatency;

    public DriftGuardMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("llm_driftguard");

        this.recordsProcessed = group.counter("records_processed_total");
        this.anomaliesFlagged = group.counter("anomalies_flagged_total");
        this.driftEvents = group.counter("drift_events_total");
        this.annotationErrors = group.counter("annotation_errors_total");

        // sliding window of 350 samples, exposes p50/p95/p99
        this.processingLatency = group
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementRecordsProcessed() {
        recordsProcessed.inc();
    }

    public void incrementAnomaliesFlagged() {
        anomaliesFlagged.inc();
    }

    public void incrementDriftEvents() {
        driftEvents.inc();
    }

    public void incrementAnnotationErrors() {
        annotationErrors.inc();
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
