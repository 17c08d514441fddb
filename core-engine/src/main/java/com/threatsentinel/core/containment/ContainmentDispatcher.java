package com.threatsentinel.core.containment;

import com.threatsentinel.core.model.ContainmentAction;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.model.Threat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Turns a threat's containment request into a call on the
 * {@link ContainmentEnforcer}.
 *
 * <p>
 * Every intent is logged at WARN before enforcement, forming the audit
 * trail. Unknown action tokens and events without a {@code userId} are
 * logged and skipped. Enforcement failures are logged and never propagate
 * to the detection path.
 * </p>
 *
 * @since 1.0.0
 */
public class ContainmentDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(ContainmentDispatcher.class);

    private final ContainmentEnforcer enforcer;

    public ContainmentDispatcher(ContainmentEnforcer enforcer) {
        this.enforcer = Objects.requireNonNull(enforcer, "ContainmentEnforcer must not be null");
    }

    /**
     * @param actionToken action name, e.g. {@code LOCK_ACCOUNT}
     * @param event       event whose actor is contained
     * @param threat      threat requesting containment
     * @return the action that was handed to the enforcer, or empty if skipped
     *         or failed
     */
    public Optional<ContainmentAction> execute(String actionToken, SecurityEvent event, Threat threat) {
        Objects.requireNonNull(event, "Event must not be null");
        Objects.requireNonNull(threat, "Threat must not be null");

        Optional<ContainmentAction> action = ContainmentAction.fromToken(actionToken);
        if (action.isEmpty()) {
            LOG.error("Unknown containment action '{}' requested by rule '{}'", actionToken, threat.getRuleName());
            return Optional.empty();
        }
        Optional<String> userId = event.getUserId();
        if (userId.isEmpty()) {
            LOG.warn("Containment {} requested by rule '{}' skipped: event {} has no userId", action.get(),
                    threat.getRuleName(), event.getId());
            return Optional.empty();
        }

        LOG.warn("CONTAINMENT {} for user {} (rule '{}', threat {}, severity {})", action.get(), userId.get(),
                threat.getRuleName(), threat.getId(), threat.getSeverity());
        try {
            enforcer.enforceContainment(action.get(), userId.get());
            return action;
        } catch (RuntimeException e) {
            LOG.error("Containment {} for user {} failed", action.get(), userId.get(), e);
            return Optional.empty();
        }
    }
}
