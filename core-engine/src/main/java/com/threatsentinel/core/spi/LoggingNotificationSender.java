package com.threatsentinel.core.spi;

import com.threatsentinel.core.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Notification sender that logs instead of delivering.
 */
public class LoggingNotificationSender implements NotificationSender {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingNotificationSender.class);

    @Override
    public void sendAlertEmail(List<String> recipients, Alert alert) {
        LOG.info("Alert notification [{}] {} for {}", alert.getSeverity(), alert.getName(), recipients);
    }
}
