package com.driftguard.core.annotate;

import com.driftguard.core.drift.RecentSampleWindow;
import com.driftguard.core.metrics.MetricsHistory;
import com.driftguard.core.window.WindowStore;

import java.io.Serializable;

/**
 * Mutable monitoring state of one record stream.
 *
 * <p>
 * Holds the detector windows, the recent drift samples and the metrics
 * history. Each stream owns exactly one session; sessions are never shared,
 * so no locking is needed. The class is {@link Serializable} so a stream
 * processor can keep it in keyed state.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringSession implements Serializable {

    private static final long serialVersionUID = 1L;

    private final WindowStore windows;
    private final RecentSampleWindow recentSamples;
    private final MetricsHistory metricsHistory;

    public MonitoringSession() {
        this(WindowStore.DEFAULT_CAPACITY, RecentSampleWindow.DEFAULT_CAPACITY);
    }

    /**
     * @param windowCapacity capacity of every detector window
     * @param recentCapacity capacity of the recent drift sample window
     */
    public MonitoringSession(int windowCapacity, int recentCapacity) {
        this.windows = new WindowStore(windowCapacity);
        this.recentSamples = new RecentSampleWindow(recentCapacity);
        this.metricsHistory = new MetricsHistory();
    }

    public WindowStore getWindows() {
        return windows;
    }

    public RecentSampleWindow getRecentSamples() {
        return recentSamples;
    }

    public MetricsHistory getMetricsHistory() {
        return metricsHistory;
    }

    @Override
    public String toString() {
        return "MonitoringSession{" +
                "windows=" + windows +
                ", recentSamples=" + recentSamples.size() +
                ", metricsHistory=" + metricsHistory.size() +
                '}';
    }
}
