package com.threatsentinel.core.rule;

import java.io.Serializable;

/**
 * What the engine does once a rule fires.
 *
 * <pre>
 * response:
 *   createAlert: true
 *   createIncident: false
 *   autoContainment: true
 *   containmentAction: LOCK_ACCOUNT
 * </pre>
 *
 * @since 1.0.0
 */
public class ResponsePolicy implements Serializable {

    private static final long serialVersionUID = 1L;

    /** When {@code false} the alert is still recorded but nobody is emailed. */
    private boolean createAlert = true;
    private boolean createIncident;
    private boolean autoContainment;
    /** One of the {@link com.threatsentinel.core.model.ContainmentAction} tokens. */
    private String containmentAction;

    public ResponsePolicy() {
    }

    ResponsePolicy(ResponsePolicy other) {
        this.createAlert = other.createAlert;
        this.createIncident = other.createIncident;
        this.autoContainment = other.autoContainment;
        this.containmentAction = other.containmentAction;
    }

    /**
     * @return {@code true} when containment is requested and an action is declared
     */
    public boolean requestsContainment() {
        return autoContainment && containmentAction != null && !containmentAction.isBlank();
    }

    public boolean isCreateAlert() {
        return createAlert;
    }

    public void setCreateAlert(boolean createAlert) {
        this.createAlert = createAlert;
    }

    public boolean isCreateIncident() {
        return createIncident;
    }

    public void setCreateIncident(boolean createIncident) {
        this.createIncident = createIncident;
    }

    public boolean isAutoContainment() {
        return autoContainment;
    }

    public void setAutoContainment(boolean autoContainment) {
        this.autoContainment = autoContainment;
    }

    public String getContainmentAction() {
        return containmentAction;
    }

    public void setContainmentAction(String containmentAction) {
        this.containmentAction = containmentAction;
    }

    @Override
    public String toString() {
        return "ResponsePolicy{createAlert=" + createAlert
                + ", createIncident=" + createIncident
                + ", autoContainment=" + autoContainment
                + ", containmentAction='" + containmentAction + "'}";
    }
}
