package com.threatsentinel.core.model;

/**
 * Lifecycle of an {@link Alert}. Only {@link #OPEN} is set by the engine;
 * the remaining states belong to the external case-management workflow.
 */
public enum AlertStatus {
    OPEN,
    INVESTIGATING,
    RESOLVED,
    DISMISSED
}
