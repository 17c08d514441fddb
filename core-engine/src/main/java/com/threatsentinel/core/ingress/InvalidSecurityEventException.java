package com.threatsentinel.core.ingress;

/**
 * Thrown when an inbound event cannot be accepted, e.g. because it has no
 * type.
 */
public class InvalidSecurityEventException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidSecurityEventException(String message) {
        super(message);
    }
}
