package org.iplocation.server.spring.config.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.iplocation.server.location.ip.ClientIpSources;
import org.iplocation.server.location.model.AddressLocation;
import org.iplocation.server.location.model.Location;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Validated
@NoArgsConstructor
@Data
public class LocationProperties {

    @NotBlank
    private String selectedDriver;

    @NotNull
    private List<String> fallbackDrivers = new ArrayList<>();

    @NotNull
    private String driverNamespace;

    private boolean localhostTesting;

    private String localhostTestingIp;

    private boolean localhostForgetLocation;

    @NotBlank
    private String defaultIp;

    @NotEmpty
    private List<String> ipSources = new ArrayList<>(ClientIpSources.DEFAULT_ORDER);

    @NotBlank
    private String countryCodesFile;

    @Valid
    @NotNull
    private DropdownProperties dropdown = new DropdownProperties();

    @Valid
    @NotNull
    private DriversProperties drivers = new DriversProperties();

    @NoArgsConstructor
    @Data
    public static class DropdownProperties {

        @NotBlank
        private String value;

        @NotBlank
        private String name;
    }

    @NoArgsConstructor
    @Data
    public static class DriversProperties {

        @Valid
        @NotNull
        private MaxMindProperties maxmind = new MaxMindProperties();

        @Valid
        @NotNull
        private IpApiProperties ipApi = new IpApiProperties();

        @Valid
        @NotNull
        private ConfigurationDriverProperties configuration = new ConfigurationDriverProperties();
    }

    @NoArgsConstructor
    @Data
    public static class MaxMindProperties {

        private String databasePath;
    }

    @NoArgsConstructor
    @Data
    public static class IpApiProperties {

        @NotBlank
        private String endpoint;

        @Positive
        private long timeoutMs;
    }

    @NoArgsConstructor
    @Data
    public static class ConfigurationDriverProperties {

        @Valid
        @NotNull
        private List<AddressLocationProperties> addresses = new ArrayList<>();
    }

    /**
     * Location served for addresses starting with {@code addressPattern}.
     */
    @NoArgsConstructor
    @Data
    public static class AddressLocationProperties {

        @NotBlank
        private String addressPattern;

        private String countryCode;

        private String countryName;

        private String regionCode;

        private String regionName;

        private String cityName;

        private String zipCode;

        private Double latitude;

        private Double longitude;

        private String timeZone;

        public AddressLocation toAddressLocation() {
            return AddressLocation.of(addressPattern, Location.builder()
                    .countryCode(countryCode)
                    .isoCode(countryCode)
                    .countryName(countryName)
                    .regionCode(regionCode)
                    .regionName(regionName)
                    .cityName(cityName)
                    .zipCode(zipCode)
                    .latitude(latitude)
                    .longitude(longitude)
                    .timeZone(timeZone)
                    .build());
        }
    }
}
