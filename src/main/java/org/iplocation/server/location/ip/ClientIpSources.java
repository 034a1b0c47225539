package org.iplocation.server.location.ip;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Known client IP sources, addressable by name from configuration.
 */
public final class ClientIpSources {

    public static final List<String> DEFAULT_ORDER = Collections.unmodifiableList(Arrays.asList(
            "client-ip",
            "x-forwarded-for",
            "x-forwarded",
            "forwarded-for",
            "forwarded",
            "remote-addr",
            RemoteAddressClientIpSource.NAME));

    private static final Map<String, ClientIpSource> SOURCES = Arrays.stream(new ClientIpSource[]{
                    new HeaderClientIpSource("client-ip", "Client-IP"),
                    new HeaderClientIpSource("x-forwarded-for", "X-Forwarded-For"),
                    new HeaderClientIpSource("x-forwarded", "X-Forwarded"),
                    new HeaderClientIpSource("forwarded-for", "Forwarded-For"),
                    new HeaderClientIpSource("forwarded", "Forwarded"),
                    new HeaderClientIpSource("remote-addr", "Remote-Addr"),
                    new RemoteAddressClientIpSource()})
            .collect(Collectors.toMap(ClientIpSource::name, Function.identity(), (o1, o2) -> o1, LinkedHashMap::new));

    private ClientIpSources() {
    }

    public static List<ClientIpSource> defaults() {
        return of(DEFAULT_ORDER);
    }

    /**
     * Returns sources in the order of given names.
     *
     * @throws IllegalArgumentException if some name does not denote a known source
     */
    public static List<ClientIpSource> of(List<String> names) {
        return names.stream()
                .map(ClientIpSources::byName)
                .toList();
    }

    private static ClientIpSource byName(String name) {
        final ClientIpSource source = SOURCES.get(name);
        if (source == null) {
            throw new IllegalArgumentException(
                    "Unknown client IP source: %s, expected one of %s".formatted(name, SOURCES.keySet()));
        }
        return source;
    }
}
