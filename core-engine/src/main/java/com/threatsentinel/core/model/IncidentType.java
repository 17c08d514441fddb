package com.threatsentinel.core.model;

/**
 * Incident categories used by the case-management surface.
 *
 * @since 1.0.0
 */
public enum IncidentType {
    MALWARE,
    PHISHING,
    UNAUTHORIZED_ACCESS,
    DATA_BREACH,
    DENIAL_OF_SERVICE,
    RANSOMWARE,
    PRIVILEGE_ESCALATION,
    INSIDER_THREAT,
    OTHER
}
