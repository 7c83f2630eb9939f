package com.qqsuccubus.zonal.core.error;

import lombok.Getter;

/**
 * Thrown by a strict weight calculator when the client's home zone hosts no backends.
 */
@Getter
public class UnknownHomeZoneException extends ZonalBalancingException {

    private final Object homeZone;

    public UnknownHomeZoneException(Object homeZone) {
        super("Home zone '" + homeZone + "' is not present in the registry");
        this.homeZone = homeZone;
    }
}
