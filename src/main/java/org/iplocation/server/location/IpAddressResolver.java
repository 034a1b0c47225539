package org.iplocation.server.location;

import inet.ipaddr.IPAddress;
import inet.ipaddr.IPAddressString;
import inet.ipaddr.IPAddressStringParameters;
import org.apache.commons.lang3.StringUtils;
import org.iplocation.server.exception.InvalidAddressException;
import org.iplocation.server.location.ip.ClientIpSource;
import org.iplocation.server.location.model.RequestEnvironment;
import org.iplocation.server.log.Logger;
import org.iplocation.server.log.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Determines the IP address a location is looked up for.
 */
public class IpAddressResolver {

    private static final Logger logger = LoggerFactory.getLogger(IpAddressResolver.class);

    private static final IPAddressStringParameters IP_ADDRESS_VALIDATION_OPTIONS;

    static {
        final IPAddressStringParameters.Builder builder = IPAddressString.DEFAULT_VALIDATION_OPTIONS.toBuilder()
                .allowSingleSegment(false)
                .allowEmpty(false);
        builder.getIPv4AddressParametersBuilder()
                .allow_inet_aton(false)
                .allowLeadingZeros(false);
        builder.getIPv6AddressParametersBuilder().allowZone(false);
        IP_ADDRESS_VALIDATION_OPTIONS = builder.toParams();
    }

    private final boolean localhostTesting;
    private final String localhostTestingIp;
    private final String defaultIp;
    private final List<ClientIpSource> sources;

    public IpAddressResolver(boolean localhostTesting,
                             String localhostTestingIp,
                             String defaultIp,
                             List<ClientIpSource> sources) {

        this.localhostTesting = localhostTesting;
        this.localhostTestingIp = localhostTestingIp;
        this.defaultIp = defaultIp;
        this.sources = Objects.requireNonNull(sources);
    }

    /**
     * Returns the explicitly given address once it is validated, otherwise detects the client address.
     * A non-empty explicit address is always validated, even when it consists of whitespace only.
     *
     * @throws InvalidAddressException if the explicit address is not a valid IPv4 or IPv6 address
     */
    public String resolve(String explicitIp, RequestEnvironment environment) {
        if (StringUtils.isNotEmpty(explicitIp)) {
            return validate(explicitIp);
        }

        return clientIp(environment);
    }

    /**
     * Returns true only for a single IPv4 or IPv6 address, not for a range or a network.
     */
    public static boolean isValid(String ip) {
        if (ip == null || StringUtils.containsWhitespace(ip)) {
            return false;
        }

        final IPAddress address = new IPAddressString(ip, IP_ADDRESS_VALIDATION_OPTIONS).getAddress();
        return address != null && !address.isMultiple() && !address.isPrefixed();
    }

    private static String validate(String ip) {
        if (!isValid(ip)) {
            throw new InvalidAddressException(ip);
        }
        return ip;
    }

    private String clientIp(RequestEnvironment environment) {
        if (localhostTesting) {
            return localhostTestingIp;
        }

        final RequestEnvironment resolvedEnvironment = environment != null ? environment : RequestEnvironment.empty();
        for (ClientIpSource source : sources) {
            final String ip = source.lookup(resolvedEnvironment);
            if (ip != null) {
                logger.debug("Client IP {} taken from {}", ip, source.name());
                return ip;
            }
        }

        return defaultIp;
    }
}
