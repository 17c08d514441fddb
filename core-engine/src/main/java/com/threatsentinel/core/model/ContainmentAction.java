package com.threatsentinel.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Automated response tokens understood by the identity/session subsystem.
 *
 * @since 1.0.0
 */
public enum ContainmentAction {
    LOCK_ACCOUNT,
    REVOKE_SESSION,
    REQUIRE_MFA;

    /**
     * Resolve a token case-insensitively.
     *
     * @param token action name, may be {@code null}
     * @return the action, or empty if the token is not a known action
     */
    public static Optional<ContainmentAction> fromToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        for (ContainmentAction action : values()) {
            if (action.name().equals(token.trim().toUpperCase(Locale.ROOT))) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
