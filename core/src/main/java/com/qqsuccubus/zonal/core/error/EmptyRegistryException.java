package com.qqsuccubus.zonal.core.error;

/**
 * Thrown when zone capacities are requested for a registry snapshot without backends.
 */
public class EmptyRegistryException extends ZonalBalancingException {

    public EmptyRegistryException(long epoch) {
        super("Registry snapshot (epoch=" + epoch + ") has no backends");
    }
}
