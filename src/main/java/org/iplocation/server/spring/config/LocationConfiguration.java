package org.iplocation.server.spring.config;

import org.iplocation.server.json.JacksonMapper;
import org.iplocation.server.location.CountryCodes;
import org.iplocation.server.location.DriverFactory;
import org.iplocation.server.location.IpAddressResolver;
import org.iplocation.server.location.LocationDriver;
import org.iplocation.server.location.LocationResolver;
import org.iplocation.server.location.driver.ConfigurationDriver;
import org.iplocation.server.location.driver.IpApiDriver;
import org.iplocation.server.location.driver.MaxMindDriver;
import org.iplocation.server.location.ip.ClientIpSources;
import org.iplocation.server.location.model.AddressLocation;
import org.iplocation.server.spring.config.model.LocationProperties;
import org.iplocation.server.util.ResourceUtil;
import org.iplocation.server.vertx.httpclient.HttpClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@Configuration
public class LocationConfiguration {

    /**
     * Namespace the built-in drivers are registered under.
     */
    public static final String BUILT_IN_DRIVER_NAMESPACE = "org.iplocation.server.location.driver.";

    @Bean
    @ConfigurationProperties(prefix = "location")
    LocationProperties locationProperties() {
        return new LocationProperties();
    }

    @Bean
    CountryCodes countryCodes(LocationProperties locationProperties) throws IOException {
        return new CountryCodes(ResourceUtil.readFromClasspath(locationProperties.getCountryCodesFile()));
    }

    @Bean
    IpAddressResolver ipAddressResolver(LocationProperties locationProperties) {
        return new IpAddressResolver(
                locationProperties.isLocalhostTesting(),
                locationProperties.getLocalhostTestingIp(),
                locationProperties.getDefaultIp(),
                ClientIpSources.of(locationProperties.getIpSources()));
    }

    @Bean
    @Lazy
    MaxMindDriver maxMindDriver(LocationProperties locationProperties) {
        return MaxMindDriver.create(locationProperties.getDrivers().getMaxmind().getDatabasePath());
    }

    @Bean
    @Lazy
    IpApiDriver ipApiDriver(LocationProperties locationProperties, HttpClient httpClient, JacksonMapper mapper) {
        final LocationProperties.IpApiProperties ipApi = locationProperties.getDrivers().getIpApi();
        return new IpApiDriver(httpClient, mapper, ipApi.getEndpoint(), ipApi.getTimeoutMs());
    }

    @Bean
    @Lazy
    ConfigurationDriver configurationDriver(LocationProperties locationProperties, CountryCodes countryCodes) {
        final List<AddressLocation> addressLocations = locationProperties.getDrivers().getConfiguration()
                .getAddresses().stream()
                .map(LocationProperties.AddressLocationProperties::toAddressLocation)
                .toList();

        return new ConfigurationDriver(addressLocations, countryCodes);
    }

    @Bean
    DriverFactory driverFactory(LocationProperties locationProperties,
                                ObjectProvider<MaxMindDriver> maxMindDriver,
                                ObjectProvider<IpApiDriver> ipApiDriver,
                                ObjectProvider<ConfigurationDriver> configurationDriver) {

        final Map<String, Supplier<LocationDriver>> registry = new LinkedHashMap<>();
        registry.put(BUILT_IN_DRIVER_NAMESPACE + MaxMindDriver.NAME, maxMindDriver::getObject);
        registry.put(BUILT_IN_DRIVER_NAMESPACE + IpApiDriver.NAME, ipApiDriver::getObject);
        registry.put(BUILT_IN_DRIVER_NAMESPACE + ConfigurationDriver.NAME, configurationDriver::getObject);

        return new DriverFactory(locationProperties.getDriverNamespace(), registry);
    }

    @Bean
    LocationResolver locationResolver(LocationProperties locationProperties,
                                      DriverFactory driverFactory,
                                      IpAddressResolver ipAddressResolver,
                                      CountryCodes countryCodes) {

        return new LocationResolver(
                locationProperties.getSelectedDriver(),
                locationProperties.getFallbackDrivers(),
                locationProperties.isLocalhostForgetLocation(),
                locationProperties.getDropdown().getValue(),
                locationProperties.getDropdown().getName(),
                driverFactory,
                ipAddressResolver,
                countryCodes);
    }
}
