package com.driftguard.core.detection;

import com.driftguard.core.model.DetectionResult;
import com.driftguard.core.window.WindowStore;

import java.io.Serializable;

/**
 * Contract for all anomaly detectors.
 * <p>
 * Detectors hold only their configuration. The observation history lives in
 * the {@link WindowStore} passed to {@link #evaluate}, which belongs to the
 * calling session; each detector records the value in its own window (keyed by
 * {@link DetectorKind#anomalyId(String)}) before judging it.
 * </p>
 */
public interface AnomalyDetector extends Serializable {

    /**
     * Record {@code value} in the detector's window for {@code field} and
     * decide whether it is anomalous relative to that window.
     *
     * @param windows the session's window store
     * @param field   name of the analysed field
     * @param value   the new observation
     * @return the verdict; never {@code null}
     */
    DetectionResult evaluate(WindowStore windows, String field, double value);

    /**
     * @return the algorithm this detector implements
     */
    DetectorKind getKind();
}
