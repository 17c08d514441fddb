package com.threatsentinel.core.containment;

import com.threatsentinel.core.model.ContainmentAction;

/**
 * Identity/session subsystem that carries out containment actions.
 */
public interface ContainmentEnforcer {

    /**
     * @param action containment to apply
     * @param userId affected account
     */
    void enforceContainment(ContainmentAction action, String userId);
}
