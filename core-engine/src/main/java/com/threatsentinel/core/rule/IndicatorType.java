package com.threatsentinel.core.rule;

/**
 * Kinds of threat-intelligence indicators.
 */
public enum IndicatorType {
    IP,
    DOMAIN,
    HASH,
    URL
}
