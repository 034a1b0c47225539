package org.iplocation.server.location.model;

import lombok.Value;

/**
 * Fixed location served for every address starting with {@code addressPattern}.
 */
@Value(staticConstructor = "of")
public class AddressLocation {

    String addressPattern;

    Location location;
}
