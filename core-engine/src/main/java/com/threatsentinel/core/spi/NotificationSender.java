package com.threatsentinel.core.spi;

import com.threatsentinel.core.model.Alert;

import java.util.List;

/**
 * Outbound alert notification channel (email, webhook, pager).
 */
public interface NotificationSender {

    /**
     * @param recipients non-empty list of addresses for the alert's severity
     *                   tier
     * @param alert      the alert to announce
     */
    void sendAlertEmail(List<String> recipients, Alert alert);
}
