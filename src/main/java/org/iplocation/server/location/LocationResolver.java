package org.iplocation.server.location;

import org.apache.commons.lang3.StringUtils;
import org.iplocation.server.exception.FieldNotFoundException;
import org.iplocation.server.exception.NoDriverAvailableException;
import org.iplocation.server.location.model.Location;
import org.iplocation.server.location.model.LocationContext;
import org.iplocation.server.log.ConditionalLogger;
import org.iplocation.server.log.Logger;
import org.iplocation.server.log.LoggerFactory;
import org.iplocation.server.session.SessionStore;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Resolves the location of a visitor.
 * <p>
 * The first successful lookup within a session is stored in the session and returned by every
 * following call of that session, whatever IP address those calls ask for. A lookup starts
 * with the selected driver; when it reports an error the fallback drivers are tried in the
 * configured order and the first one succeeding wins.
 */
public class LocationResolver {

    private static final Logger logger = LoggerFactory.getLogger(LocationResolver.class);
    private static final ConditionalLogger conditionalLogger = new ConditionalLogger(logger);

    private static final int LOG_PERIOD_SECONDS = 60;

    public static final String SESSION_KEY = "location";

    private final String selectedDriverName;
    private final LocationDriver selectedDriver;
    private final List<String> fallbackDrivers;
    private final boolean forgetLocation;
    private final String dropdownValueField;
    private final String dropdownNameField;
    private final DriverFactory driverFactory;
    private final IpAddressResolver ipAddressResolver;
    private final CountryCodes countryCodes;

    public LocationResolver(String selectedDriverName,
                            List<String> fallbackDrivers,
                            boolean forgetLocation,
                            String dropdownValueField,
                            String dropdownNameField,
                            DriverFactory driverFactory,
                            IpAddressResolver ipAddressResolver,
                            CountryCodes countryCodes) {

        this.selectedDriverName = Objects.requireNonNull(selectedDriverName);
        this.fallbackDrivers = List.copyOf(Objects.requireNonNull(fallbackDrivers));
        this.forgetLocation = forgetLocation;
        this.dropdownValueField = Objects.requireNonNull(dropdownValueField);
        this.dropdownNameField = Objects.requireNonNull(dropdownNameField);
        this.driverFactory = Objects.requireNonNull(driverFactory);
        this.ipAddressResolver = Objects.requireNonNull(ipAddressResolver);
        this.countryCodes = Objects.requireNonNull(countryCodes);

        selectedDriver = driverFactory.create(selectedDriverName);
    }

    public Location get(LocationContext context) {
        return get(context, null);
    }

    public Location get(LocationContext context, String ip) {
        final SessionStore session = context.getSession();

        if (forgetLocation) {
            session.forget(SESSION_KEY);
        }

        if (session.has(SESSION_KEY)) {
            return (Location) session.get(SESSION_KEY);
        }

        final String resolvedIp = ipAddressResolver.resolve(ip, context.getEnvironment());

        Location location = lookup(selectedDriverName, selectedDriver, resolvedIp);
        if (location.isError()) {
            location = lookupFallback(resolvedIp);
        }

        session.set(SESSION_KEY, location);
        return location;
    }

    /**
     * Returns the value of a single attribute of the resolved location.
     * <p>
     * The location is resolved, and stored in the session, before the attribute is looked up.
     *
     * @throws FieldNotFoundException if location has no attribute with the given name
     */
    public Object get(LocationContext context, String ip, String field) {
        final Location location = get(context, ip);
        if (field == null) {
            return location;
        }

        final Map<String, Object> attributes = location.attributes();
        if (!attributes.containsKey(field)) {
            throw new FieldNotFoundException(field);
        }
        return attributes.get(field);
    }

    /**
     * Returns true if any attribute value of the current location equals the given one ignoring case.
     */
    public boolean is(LocationContext context, String value) {
        return get(context).attributes().entrySet().stream()
                .filter(attribute -> !Location.ERROR_ATTRIBUTE.equals(attribute.getKey()))
                .map(Map.Entry::getValue)
                .filter(Objects::nonNull)
                .anyMatch(attributeValue -> StringUtils.equalsIgnoreCase(String.valueOf(attributeValue), value));
    }

    /**
     * Returns a country list keyed by {@code valueField} and holding {@code nameField}. If both are blank
     * the configured dropdown fields are used.
     */
    public Map<String, String> lists(String valueField, String nameField) {
        if (StringUtils.isBlank(valueField) && StringUtils.isBlank(nameField)) {
            return countryCodes.lists(dropdownValueField, dropdownNameField);
        }
        return countryCodes.lists(valueField, nameField);
    }

    /**
     * @deprecated use {@link #lists(String, String)}
     */
    @Deprecated
    public Map<String, String> dropdown(String valueField, String nameField) {
        return lists(valueField, nameField);
    }

    private Location lookupFallback(String ip) {
        String lastDriver = selectedDriverName;
        for (String driverName : fallbackDrivers) {
            final LocationDriver driver = driverFactory.create(driverName);
            lastDriver = driverName;

            final Location location = lookup(driverName, driver, ip);
            if (!location.isError()) {
                return location;
            }
        }

        throw new NoDriverAvailableException(lastDriver);
    }

    private static Location lookup(String driverName, LocationDriver driver, String ip) {
        final Location location = driver.get(ip);
        if (location == null) {
            throw new IllegalStateException("Driver %s returned no location for %s".formatted(driverName, ip));
        }

        if (location.isError()) {
            conditionalLogger.warn("Location driver %s failed to locate an address".formatted(driverName),
                    LOG_PERIOD_SECONDS, TimeUnit.SECONDS);
        }
        return location;
    }
}
