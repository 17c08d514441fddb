package com.threatsentinel.core.containment;

import com.threatsentinel.core.model.ContainmentAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enforcer that records the requested action without applying it.
 */
public class LoggingContainmentEnforcer implements ContainmentEnforcer {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingContainmentEnforcer.class);

    @Override
    public void enforceContainment(ContainmentAction action, String userId) {
        LOG.info("No enforcer configured: {} for user {} recorded only", action, userId);
    }
}
