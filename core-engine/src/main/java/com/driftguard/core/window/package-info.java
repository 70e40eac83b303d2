/**
 * Bounded per-key rolling windows used by the anomaly detectors.
 *
 * @since 1.0.0
 */
package com.driftguard.core.window;
