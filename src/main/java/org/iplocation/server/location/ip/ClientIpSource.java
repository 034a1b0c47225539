package org.iplocation.server.location.ip;

import org.iplocation.server.location.model.RequestEnvironment;

/**
 * One place of the request environment a client IP address may be found in.
 */
public interface ClientIpSource {

    String name();

    /**
     * Returns the address found in this source or null when the source is absent or empty.
     */
    String lookup(RequestEnvironment environment);
}
