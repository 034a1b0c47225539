package org.iplocation.server.location.model;

import io.vertx.core.MultiMap;
import lombok.Value;

/**
 * Client-related data of the request a location is resolved for.
 */
@Value(staticConstructor = "of")
public class RequestEnvironment {

    private static final RequestEnvironment EMPTY = of(MultiMap.caseInsensitiveMultiMap(), null);

    MultiMap headers;

    /**
     * Host of the remote socket address, null outside of an HTTP request.
     */
    String remoteAddress;

    public static RequestEnvironment empty() {
        return EMPTY;
    }
}
