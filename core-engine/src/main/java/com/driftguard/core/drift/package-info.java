/**
 * Text embeddings, semantic drift scoring and pairwise text comparison.
 *
 * <p>
 * {@link com.driftguard.core.drift.DriftScorer} compares each text against a
 * static set of baseline embeddings and against the stream's
 * {@link com.driftguard.core.drift.RecentSampleWindow}.
 * {@link com.driftguard.core.drift.SemanticComparator} compares two texts of
 * the same record. Both rely on a deterministic
 * {@link com.driftguard.core.drift.TextEmbedder}.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftguard.core.drift;
