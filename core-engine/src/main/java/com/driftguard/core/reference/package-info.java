/**
 * Reference data: per-model baselines, alert thresholds and baseline text
 * embeddings, loaded from CSV lookup files.
 *
 * <p>
 * Tables are immutable once loaded. {@link com.driftguard.core.reference.ReferenceDataRegistry}
 * publishes whole snapshots so reloads are atomic for readers.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftguard.core.reference;
