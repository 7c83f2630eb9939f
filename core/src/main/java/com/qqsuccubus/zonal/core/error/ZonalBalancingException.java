package com.qqsuccubus.zonal.core.error;

/**
 * Base type for failures raised while deriving zone weights or building registry snapshots.
 * <p>
 * All subtypes are unchecked: they signal precondition violations by the caller
 * (bad registry contents, unknown zones), not conditions to recover from locally.
 * </p>
 */
public class ZonalBalancingException extends RuntimeException {

    public ZonalBalancingException(String message) {
        super(message);
    }

    public ZonalBalancingException(String message, Throwable cause) {
        super(message, cause);
    }
}
