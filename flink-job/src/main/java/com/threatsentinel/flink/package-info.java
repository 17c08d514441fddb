/**
 * Apache Flink streaming host for Threat Sentinel.
 *
 * <p>
 * This package runs the core detection engine inside a Flink pipeline that
 * consumes security events from Kafka, keyed by actor, and publishes alerts,
 * incidents and containment commands back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.threatsentinel.flink.ThreatSentinelJob}: main entry
 * point</li>
 * <li>{@link com.threatsentinel.flink.SiemProcessFunction}: keyed process
 * function</li>
 * <li>{@link com.threatsentinel.flink.EngineSession}: per-task engine and
 * output capture</li>
 * <li>{@link com.threatsentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.threatsentinel.flink.HealthServer}: HTTP health/readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.threatsentinel.flink;
