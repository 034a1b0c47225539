package org.iplocation.server.location.ip;

import org.apache.commons.lang3.StringUtils;
import org.iplocation.server.location.model.RequestEnvironment;

public class RemoteAddressClientIpSource implements ClientIpSource {

    public static final String NAME = "remote-address";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String lookup(RequestEnvironment environment) {
        return StringUtils.trimToNull(environment.getRemoteAddress());
    }

    @Override
    public String toString() {
        return NAME;
    }
}
