package com.threatsentinel.core.config;

import com.threatsentinel.core.model.Severity;
import com.threatsentinel.core.rule.DetectionRule;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Engine configuration: alert-threshold categories, notification recipients,
 * static IP blacklist, retention and buffer sizing.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * alertThresholds:
 *   authFailures: { threshold: 5, timeWindowMinutes: 5, severity: HIGH }
 * notificationRecipients:
 *   CRITICAL: [soc-oncall@example.com]
 * blacklistedIps: [203.0.113.7]
 * logRetentionDays: 90
 * maxEventsInMemory: 10000
 * </pre>
 *
 * @since 1.0.0
 */
public class SiemConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String AUTH_FAILURES = "authFailures";
    public static final String PRIVILEGE_ESCALATION = "privilegeEscalation";
    public static final String MALICIOUS_IP = "maliciousIP";
    public static final String DATA_EXFILTRATION = "dataExfiltration";
    public static final String ABNORMAL_ACCESS = "abnormalAccess";

    private Map<String, AlertThreshold> alertThresholds = new LinkedHashMap<>();
    private Map<String, List<String>> notificationRecipients = new LinkedHashMap<>();
    private List<String> blacklistedIps = new ArrayList<>();
    private int logRetentionDays = 90;
    private int maxEventsInMemory = 10_000;
    private int maintenanceIntervalSeconds = 60;
    private int staleAlertMinutes = 60;
    private int recentAlertCapacity = 1_000;

    /**
     * Built-in configuration used when no YAML is supplied.
     */
    public static SiemConfig defaults() {
        SiemConfig config = new SiemConfig();
        config.alertThresholds.put(AUTH_FAILURES, AlertThreshold.of(5, 5, Severity.HIGH));
        config.alertThresholds.put(PRIVILEGE_ESCALATION, AlertThreshold.of(1, 60, Severity.HIGH));
        config.alertThresholds.put(MALICIOUS_IP, AlertThreshold.of(1, 60, Severity.HIGH));
        config.alertThresholds.put(DATA_EXFILTRATION, AlertThreshold.of(10L * 1024 * 1024, 60, Severity.HIGH));
        config.alertThresholds.put(ABNORMAL_ACCESS, AlertThreshold.of(3, 60, Severity.MEDIUM));
        return config;
    }

    // ---------------------------------------------------------------
    // Derived views
    // ---------------------------------------------------------------

    /**
     * @param severity alert severity
     * @return configured recipients for the tier, possibly empty
     */
    public List<String> recipientsFor(Severity severity) {
        for (Map.Entry<String, List<String>> entry : notificationRecipients.entrySet()) {
            if (Severity.parse(entry.getKey()) == severity && entry.getValue() != null) {
                return Collections.unmodifiableList(entry.getValue());
            }
        }
        return List.of();
    }

    /**
     * Apply each rule's {@code thresholdCategory}, if it names a configured
     * category.
     *
     * @return number of rules that were rebound
     */
    public int bindThresholds(List<DetectionRule> rules) {
        int bound = 0;
        for (DetectionRule rule : rules) {
            String category = rule.getThresholdCategory();
            AlertThreshold threshold = category != null ? alertThresholds.get(category) : null;
            if (threshold != null) {
                threshold.applyTo(rule);
                bound++;
            }
        }
        return bound;
    }

    /**
     * Add addresses to the static blacklist, ignoring blanks and duplicates.
     */
    public void addBlacklistedIps(Iterable<String> ips) {
        Set<String> merged = new LinkedHashSet<>(blacklistedIps);
        for (String ip : ips) {
            if (ip != null && !ip.isBlank()) {
                merged.add(ip.trim());
            }
        }
        blacklistedIps = new ArrayList<>(merged);
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        alertThresholds.forEach((name, t) -> {
            if (t == null) {
                errors.add("Alert threshold '" + name + "' is empty");
            } else {
                if (t.getThreshold() <= 0) {
                    errors.add("Alert threshold '" + name + "' requires 'threshold' > 0");
                }
                if (t.getTimeWindowMinutes() <= 0) {
                    errors.add("Alert threshold '" + name + "' requires 'timeWindowMinutes' > 0");
                }
                if (t.getSeverity() == null) {
                    errors.add("Alert threshold '" + name + "' requires 'severity'");
                }
            }
        });
        notificationRecipients.keySet().forEach(tier -> {
            if (Severity.parse(tier) == null) {
                errors.add("Unknown notification tier '" + tier + "'");
            }
        });
        if (logRetentionDays <= 0) {
            errors.add("'logRetentionDays' must be > 0");
        }
        if (maxEventsInMemory <= 0) {
            errors.add("'maxEventsInMemory' must be > 0");
        }
        if (maintenanceIntervalSeconds <= 0) {
            errors.add("'maintenanceIntervalSeconds' must be > 0");
        }
        if (staleAlertMinutes <= 0) {
            errors.add("'staleAlertMinutes' must be > 0");
        }
        if (recentAlertCapacity <= 0) {
            errors.add("'recentAlertCapacity' must be > 0");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "SIEM configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public Map<String, AlertThreshold> getAlertThresholds() {
        return alertThresholds;
    }

    public void setAlertThresholds(Map<String, AlertThreshold> alertThresholds) {
        this.alertThresholds = alertThresholds != null ? new LinkedHashMap<>(alertThresholds) : new LinkedHashMap<>();
    }

    public Map<String, List<String>> getNotificationRecipients() {
        return notificationRecipients;
    }

    public void setNotificationRecipients(Map<String, List<String>> notificationRecipients) {
        this.notificationRecipients = notificationRecipients != null
                ? new LinkedHashMap<>(notificationRecipients)
                : new LinkedHashMap<>();
    }

    public List<String> getBlacklistedIps() {
        return Collections.unmodifiableList(blacklistedIps);
    }

    public void setBlacklistedIps(List<String> blacklistedIps) {
        this.blacklistedIps = blacklistedIps != null ? new ArrayList<>(blacklistedIps) : new ArrayList<>();
    }

    public int getLogRetentionDays() {
        return logRetentionDays;
    }

    public void setLogRetentionDays(int logRetentionDays) {
        this.logRetentionDays = logRetentionDays;
    }

    public int getMaxEventsInMemory() {
        return maxEventsInMemory;
    }

    public void setMaxEventsInMemory(int maxEventsInMemory) {
        this.maxEventsInMemory = maxEventsInMemory;
    }

    public int getMaintenanceIntervalSeconds() {
        return maintenanceIntervalSeconds;
    }

    public void setMaintenanceIntervalSeconds(int maintenanceIntervalSeconds) {
        this.maintenanceIntervalSeconds = maintenanceIntervalSeconds;
    }

    public int getStaleAlertMinutes() {
        return staleAlertMinutes;
    }

    public void setStaleAlertMinutes(int staleAlertMinutes) {
        this.staleAlertMinutes = staleAlertMinutes;
    }

    public int getRecentAlertCapacity() {
        return recentAlertCapacity;
    }

    public void setRecentAlertCapacity(int recentAlertCapacity) {
        this.recentAlertCapacity = recentAlertCapacity;
    }

    @Override
    public String toString() {
        return "SiemConfig{" +
                "alertThresholds=" + alertThresholds.keySet() +
                ", blacklistedIps=" + blacklistedIps.size() +
                ", logRetentionDays=" + logRetentionDays +
                ", maxEventsInMemory=" + maxEventsInMemory +
                '}';
    }
}
