package org.iplocation.server.location.ip;

import org.apache.commons.lang3.StringUtils;
import org.iplocation.server.location.model.RequestEnvironment;

import java.util.Objects;

/**
 * Takes the client address from a request header. For headers carrying a proxy chain
 * ({@code client, proxy1, proxy2}) the first entry is the client.
 */
public class HeaderClientIpSource implements ClientIpSource {

    private final String name;
    private final String header;

    public HeaderClientIpSource(String name, String header) {
        this.name = Objects.requireNonNull(name);
        this.header = Objects.requireNonNull(header);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String lookup(RequestEnvironment environment) {
        final String value = environment.getHeaders() != null ? environment.getHeaders().get(header) : null;
        return StringUtils.trimToNull(StringUtils.substringBefore(value, ","));
    }

    @Override
    public String toString() {
        return name + "(" + header + ")";
    }
}
