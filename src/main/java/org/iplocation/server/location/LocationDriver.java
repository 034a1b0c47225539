package org.iplocation.server.location;

import org.iplocation.server.location.model.Location;

/**
 * Retrieves location information by IP address from a single data source.
 * <p>
 * Implementations never throw for a lookup that merely failed: they return a {@link Location}
 * with the error flag set, which makes {@link LocationResolver} move on to the next driver.
 */
@FunctionalInterface
public interface LocationDriver {

    Location get(String ip);
}
