/**
 * Threat Sentinel detection engine.
 *
 * <p>
 * {@link com.threatsentinel.core.SiemEngine} is the entry point: it wires
 * ingress, windowed counters, baselines, the rule and correlation engines,
 * escalation, containment and the event bus. Sub-packages hold each stage.
 * </p>
 *
 * @since 1.0.0
 */
package com.threatsentinel.core;
