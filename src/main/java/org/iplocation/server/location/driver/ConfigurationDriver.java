package org.iplocation.server.location.driver;

import org.iplocation.server.location.CountryCodes;
import org.iplocation.server.location.LocationDriver;
import org.iplocation.server.location.model.AddressLocation;
import org.iplocation.server.location.model.Location;

import java.util.List;
import java.util.Objects;

/**
 * Serves locations configured for address prefixes, e.g. for private networks no database knows about.
 * A configured country code without a country name gets the name from the country table.
 */
public class ConfigurationDriver implements LocationDriver {

    public static final String NAME = "Configuration";

    private final List<AddressLocation> addressLocations;
    private final CountryCodes countryCodes;

    public ConfigurationDriver(List<AddressLocation> addressLocations, CountryCodes countryCodes) {
        this.addressLocations = List.copyOf(Objects.requireNonNull(addressLocations));
        this.countryCodes = Objects.requireNonNull(countryCodes);
    }

    @Override
    public Location get(String ip) {
        return addressLocations.stream()
                .filter(addressLocation -> matches(addressLocation, ip))
                .findFirst()
                .map(addressLocation -> specify(addressLocation.getLocation(), ip))
                .orElseGet(() -> Location.failed(NAME, ip));
    }

    private static boolean matches(AddressLocation addressLocation, String ip) {
        return ip != null && ip.startsWith(addressLocation.getAddressPattern());
    }

    private Location specify(Location location, String ip) {
        final String countryName = location.getCountryName() == null && location.getCountryCode() != null
                ? countryCodes.nameOf(location.getCountryCode())
                : location.getCountryName();

        return location.toBuilder()
                .countryName(countryName)
                .driver(NAME)
                .ip(ip)
                .error(false)
                .build();
    }
}
