package com.threatsentinel.core.escalation;

import com.threatsentinel.core.config.SiemConfig;
import com.threatsentinel.core.model.Alert;
import com.threatsentinel.core.spi.NotificationSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Sends alert notifications to the recipients configured for the alert's
 * severity tier, off the detection path.
 *
 * @since 1.0.0
 */
public class NotificationDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final SiemConfig config;
    private final NotificationSender sender;
    private final Executor executor;

    public NotificationDispatcher(SiemConfig config, NotificationSender sender, Executor executor) {
        this.config = Objects.requireNonNull(config, "SiemConfig must not be null");
        this.sender = Objects.requireNonNull(sender, "NotificationSender must not be null");
        this.executor = Objects.requireNonNull(executor, "Executor must not be null");
    }

    /**
     * @return {@code true} if a notification was scheduled, {@code false} when
     *         the tier has no recipients
     */
    public boolean notify(Alert alert) {
        List<String> recipients = config.recipientsFor(alert.getSeverity());
        if (recipients.isEmpty()) {
            LOG.debug("No recipients for {} alerts, skipping notification of {}", alert.getSeverity(),
                    alert.getId());
            return false;
        }
        CompletableFuture.runAsync(() -> sender.sendAlertEmail(recipients, alert), executor)
                .exceptionally(e -> {
                    LOG.warn("Notification for alert {} to {} failed", alert.getId(), recipients, e);
                    return null;
                });
        return true;
    }
}
