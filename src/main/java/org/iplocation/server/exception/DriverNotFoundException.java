package org.iplocation.server.exception;

import lombok.Getter;

@Getter
public class DriverNotFoundException extends LocationException {

    private final String driver;

    public DriverNotFoundException(String driver) {
        super("The driver: %s, does not exist. Please check the configured driver names.".formatted(driver));
        this.driver = driver;
    }
}
