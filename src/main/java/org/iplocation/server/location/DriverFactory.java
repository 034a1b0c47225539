package org.iplocation.server.location;

import org.iplocation.server.exception.DriverNotFoundException;
import org.iplocation.server.log.Logger;
import org.iplocation.server.log.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Creates drivers by name. A name is prefixed with the configured namespace and the result
 * is looked up, case-sensitively, among the registered driver suppliers.
 */
public class DriverFactory {

    private static final Logger logger = LoggerFactory.getLogger(DriverFactory.class);

    private final String namespace;
    private final Map<String, Supplier<LocationDriver>> registry;

    public DriverFactory(String namespace, Map<String, Supplier<LocationDriver>> registry) {
        this.namespace = Objects.requireNonNull(namespace);
        this.registry = Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNull(registry)));

        logger.info("Registered location drivers: {}", this.registry.keySet());
    }

    public LocationDriver create(String driverName) {
        final Supplier<LocationDriver> supplier = driverName != null ? registry.get(identity(driverName)) : null;
        if (supplier == null) {
            throw new DriverNotFoundException(driverName);
        }

        return Objects.requireNonNull(supplier.get(), () -> "Driver %s supplied no instance".formatted(driverName));
    }

    public Set<String> registeredDrivers() {
        return registry.keySet();
    }

    /**
     * Returns the registry key a driver with the given name must be registered under.
     */
    public String identity(String driverName) {
        return namespace + driverName;
    }
}
