package org.iplocation.server.location.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Location of an IP address as reported by a single driver.
 * <p>
 * Which attributes are filled depends on the driver. The {@code error} flag is always set
 * and is the only way a driver reports a failed lookup.
 */
@Builder(toBuilder = true)
@Value
public class Location {

    public static final String ERROR_ATTRIBUTE = "error";

    /**
     * Address the location was resolved for.
     */
    String ip;

    /**
     * Country code in ISO-3166-1-alpha-2 format.
     */
    String countryCode;

    String countryName;

    /**
     * Region code, ISO-3166-2 subdivision part where the driver knows it.
     */
    String regionCode;

    String regionName;

    String cityName;

    String zipCode;

    String postalCode;

    String isoCode;

    String metroCode;

    String areaCode;

    Double latitude;

    Double longitude;

    String timeZone;

    /**
     * Internet service provider or organization owning the address.
     */
    String isp;

    /**
     * Name of the driver which produced this location.
     */
    String driver;

    boolean error;

    public static Location failed(String driver, String ip) {
        return Location.builder().driver(driver).ip(ip).error(true).build();
    }

    /**
     * Returns all attributes of this location keyed by attribute name, in declaration order.
     * Attributes the driver did not fill are present with {@code null} values.
     */
    @JsonIgnore
    public Map<String, Object> attributes() {
        final Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("ip", ip);
        attributes.put("countryCode", countryCode);
        attributes.put("countryName", countryName);
        attributes.put("regionCode", regionCode);
        attributes.put("regionName", regionName);
        attributes.put("cityName", cityName);
        attributes.put("zipCode", zipCode);
        attributes.put("postalCode", postalCode);
        attributes.put("isoCode", isoCode);
        attributes.put("metroCode", metroCode);
        attributes.put("areaCode", areaCode);
        attributes.put("latitude", latitude);
        attributes.put("longitude", longitude);
        attributes.put("timeZone", timeZone);
        attributes.put("isp", isp);
        attributes.put("driver", driver);
        attributes.put(ERROR_ATTRIBUTE, error);
        return Collections.unmodifiableMap(attributes);
    }
}
