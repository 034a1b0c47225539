package org.iplocation.server.location.driver.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Body of an ip-api.com compatible JSON lookup response.
 */
@Builder
@Jacksonized
@Value
public class IpApiResponse {

    public static final String SUCCESS_STATUS = "success";

    @JsonProperty("status")
    String status;

    @JsonProperty("message")
    String message;

    @JsonProperty("query")
    String query;

    @JsonProperty("country")
    String country;

    @JsonProperty("countryCode")
    String countryCode;

    @JsonProperty("region")
    String region;

    @JsonProperty("regionName")
    String regionName;

    @JsonProperty("city")
    String city;

    @JsonProperty("zip")
    String zip;

    @JsonProperty("lat")
    Double lat;

    @JsonProperty("lon")
    Double lon;

    @JsonProperty("timezone")
    String timezone;

    @JsonProperty("isp")
    String isp;
}
