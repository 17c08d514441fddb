package com.threatsentinel.core.escalation;

import com.threatsentinel.core.model.Alert;
import com.threatsentinel.core.model.ContainmentAction;
import com.threatsentinel.core.model.Incident;

import java.util.Objects;
import java.util.Optional;

/**
 * What escalating one threat produced.
 *
 * @since 1.0.0
 */
public final class EscalationResult {

    private final Alert alert;
    private final Incident incident;
    private final ContainmentAction containment;

    EscalationResult(Alert alert, Incident incident, ContainmentAction containment) {
        this.alert = Objects.requireNonNull(alert, "alert must not be null");
        this.incident = incident;
        this.containment = containment;
    }

    public Alert getAlert() {
        return alert;
    }

    public Optional<Incident> getIncident() {
        return Optional.ofNullable(incident);
    }

    /**
     * @return the containment action handed to the enforcer, if any
     */
    public Optional<ContainmentAction> getContainment() {
        return Optional.ofNullable(containment);
    }
}
