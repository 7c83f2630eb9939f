package com.qqsuccubus.zonal.core.error;

/**
 * Thrown when a backend cannot be placed in a registry snapshot
 * (missing identity, non-positive capacity, duplicate id).
 */
public class InvalidBackendException extends ZonalBalancingException {

    public InvalidBackendException(String message) {
        super(message);
    }
}
