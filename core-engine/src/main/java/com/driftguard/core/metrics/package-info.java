/**
 * LLM response metrics: text quality heuristics, throughput figures and
 * trends against a rolling history.
 *
 * @since 1.0.0
 */
package com.driftguard.core.metrics;
