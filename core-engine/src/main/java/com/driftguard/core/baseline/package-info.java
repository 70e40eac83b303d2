/**
 * Baseline comparison: deviation of a current metric value from its stored
 * per-model reference, classified through the alert threshold table.
 *
 * @since 1.0.0
 */
package com.driftguard.core.baseline;
