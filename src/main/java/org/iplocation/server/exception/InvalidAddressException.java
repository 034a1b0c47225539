package org.iplocation.server.exception;

import lombok.Getter;

/**
 * Thrown when an explicitly supplied IP address is neither a valid IPv4 nor IPv6 literal.
 */
@Getter
public class InvalidAddressException extends LocationException {

    private final String address;

    public InvalidAddressException(String address) {
        super("The IP Address: %s is invalid".formatted(address));
        this.address = address;
    }
}
