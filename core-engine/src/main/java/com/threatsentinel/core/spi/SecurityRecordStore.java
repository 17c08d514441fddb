package com.threatsentinel.core.spi;

import com.threatsentinel.core.model.Alert;
import com.threatsentinel.core.model.Incident;
import com.threatsentinel.core.model.SecurityEvent;

/**
 * Durable storage for events, alerts and incidents.
 *
 * <p>
 * Called from the engine's async executor; implementations may block and
 * may throw, failures are logged by the caller and never reach the
 * detection path.
 * </p>
 */
public interface SecurityRecordStore {

    void saveEvent(SecurityEvent event);

    void saveAlert(Alert alert);

    void saveIncident(Incident incident);
}
