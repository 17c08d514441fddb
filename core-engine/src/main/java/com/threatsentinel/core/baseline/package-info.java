/**
 * Per-actor behavioral baselines (bounded sample history, mean, population
 * standard deviation) backing anomaly-detection rules.
 */
package com.threatsentinel.core.baseline;
