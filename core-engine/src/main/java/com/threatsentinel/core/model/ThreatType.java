package com.threatsentinel.core.model;

/**
 * Threat categories assigned to detection rules.
 *
 * @since 1.0.0
 */
public enum ThreatType {

    BRUTE_FORCE(IncidentType.UNAUTHORIZED_ACCESS),
    PRIVILEGE_ESCALATION(IncidentType.PRIVILEGE_ESCALATION),
    DATA_EXFILTRATION(IncidentType.DATA_BREACH),
    MALWARE(IncidentType.MALWARE),
    INSIDER_THREAT(IncidentType.INSIDER_THREAT),
    DDOS(IncidentType.DENIAL_OF_SERVICE),
    ACCOUNT_COMPROMISE(IncidentType.UNAUTHORIZED_ACCESS),
    UNAUTHORIZED_ACCESS(IncidentType.UNAUTHORIZED_ACCESS),
    SUSPICIOUS_ACTIVITY(IncidentType.OTHER);

    private final IncidentType incidentType;

    ThreatType(IncidentType incidentType) {
        this.incidentType = incidentType;
    }

    /**
     * @return the incident category an escalated threat of this type is filed under
     */
    public IncidentType getIncidentType() {
        return incidentType;
    }
}
