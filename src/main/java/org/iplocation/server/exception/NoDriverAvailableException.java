package org.iplocation.server.exception;

import lombok.Getter;

/**
 * Thrown when the selected driver and every fallback driver failed to locate an address.
 */
@Getter
public class NoDriverAvailableException extends LocationException {

    private final String lastDriver;

    public NoDriverAvailableException(String lastDriver) {
        super(("No location drivers are available. Last driver tried was: %s."
                + " Did you forget to set up your MaxMind GeoLite2-City.mmdb?").formatted(lastDriver));
        this.lastDriver = lastDriver;
    }
}
