/**
 * Apache Flink streaming job for LLM DriftGuard.
 *
 * <p>
 * This package wires the core monitoring engine into a Flink pipeline that
 * consumes telemetry records from Kafka, annotates them per stream key, and
 * publishes the annotated records back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.driftguard.flink.DriftGuardJob} - main entry point</li>
 * <li>{@link com.driftguard.flink.AnnotationProcessFunction} - keyed process
 * function</li>
 * <li>{@link com.driftguard.flink.JobConfig} - environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.driftguard.flink;
