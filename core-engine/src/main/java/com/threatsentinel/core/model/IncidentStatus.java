package com.threatsentinel.core.model;

/**
 * Lifecycle of an {@link Incident}. The engine only creates incidents in
 * {@link #OPEN}.
 */
public enum IncidentStatus {
    OPEN,
    TRIAGING,
    CONTAINING,
    ERADICATING,
    RECOVERING,
    RESOLVED,
    POST_MORTEM
}
