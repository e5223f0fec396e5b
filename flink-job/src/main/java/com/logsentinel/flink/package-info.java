/**
 * Apache Flink streaming job for Log Sentinel.
 *
 * <p>
 * This package wires the core detection engine into a Flink pipeline that
 * consumes parsed log records from Kafka, runs the missing-value detectors
 * in a single operator instance, and publishes anomaly events back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.logsentinel.flink.LogSentinelJob}: main entry point</li>
 * <li>{@link com.logsentinel.flink.DetectorProcessFunction}: keyed process
 * function hosting the detectors</li>
 * <li>{@link com.logsentinel.flink.DetectorDispatcher}: record, timer and
 * statistics dispatch</li>
 * <li>{@link com.logsentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.logsentinel.flink;
