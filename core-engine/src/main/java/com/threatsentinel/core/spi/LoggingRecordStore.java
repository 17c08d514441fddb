package com.threatsentinel.core.spi;

import com.threatsentinel.core.model.Alert;
import com.threatsentinel.core.model.Incident;
import com.threatsentinel.core.model.SecurityEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Record store that only logs; the default when no durable store is wired.
 */
public class LoggingRecordStore implements SecurityRecordStore {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingRecordStore.class);

    @Override
    public void saveEvent(SecurityEvent event) {
        LOG.trace("Event {} ({}) not persisted: no record store configured", event.getId(), event.getType());
    }

    @Override
    public void saveAlert(Alert alert) {
        LOG.debug("Alert {} not persisted: no record store configured", alert.getId());
    }

    @Override
    public void saveIncident(Incident incident) {
        LOG.debug("Incident {} not persisted: no record store configured", incident.getId());
    }
}
