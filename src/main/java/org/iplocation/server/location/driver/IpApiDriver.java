package org.iplocation.server.location.driver;

import org.apache.commons.lang3.StringUtils;
import org.iplocation.server.exception.LocationException;
import org.iplocation.server.json.DecodeException;
import org.iplocation.server.json.JacksonMapper;
import org.iplocation.server.location.LocationDriver;
import org.iplocation.server.location.driver.model.IpApiResponse;
import org.iplocation.server.location.model.Location;
import org.iplocation.server.log.Logger;
import org.iplocation.server.log.LoggerFactory;
import org.iplocation.server.vertx.httpclient.HttpClient;
import org.iplocation.server.vertx.httpclient.model.HttpClientResponse;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Looks addresses up with an ip-api.com compatible HTTP JSON endpoint.
 * <p>
 * The calling thread is blocked until the response arrives or the timeout expires,
 * so the driver must not be called from an event loop thread.
 */
public class IpApiDriver implements LocationDriver {

    private static final Logger logger = LoggerFactory.getLogger(IpApiDriver.class);

    public static final String NAME = "IpApi";

    private static final String IP_MACRO = "{ip}";

    private final HttpClient httpClient;
    private final JacksonMapper mapper;
    private final String endpoint;
    private final long timeoutMs;

    public IpApiDriver(HttpClient httpClient, JacksonMapper mapper, String endpoint, long timeoutMs) {
        this.httpClient = Objects.requireNonNull(httpClient);
        this.mapper = Objects.requireNonNull(mapper);
        this.endpoint = Objects.requireNonNull(endpoint);
        this.timeoutMs = timeoutMs;
    }

    @Override
    public Location get(String ip) {
        final String url = endpoint.replace(IP_MACRO, URLEncoder.encode(ip, StandardCharsets.UTF_8));

        try {
            final HttpClientResponse response = httpClient.get(url, timeoutMs)
                    .toCompletionStage()
                    .toCompletableFuture()
                    .get(timeoutMs, TimeUnit.MILLISECONDS);

            return toLocation(ip, parseResponse(response));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("IpApi lookup for {} was interrupted", ip);
        } catch (ExecutionException e) {
            logger.warn("IpApi lookup for {} failed: {}", ip, e.getCause() != null ? e.getCause().getMessage() : null);
        } catch (TimeoutException e) {
            logger.warn("IpApi lookup for {} timed out after {} ms", ip, timeoutMs);
        } catch (LocationException e) {
            logger.warn("IpApi lookup for {} failed: {}", ip, e.getMessage());
        }

        return Location.failed(NAME, ip);
    }

    private IpApiResponse parseResponse(HttpClientResponse response) {
        final int statusCode = response.getStatusCode();
        if (statusCode != 200) {
            throw new LocationException("Failed to fetch IP info, status code = %d".formatted(statusCode));
        }

        final IpApiResponse ipApiResponse;
        try {
            ipApiResponse = mapper.decodeValue(response.getBody(), IpApiResponse.class);
        } catch (DecodeException e) {
            throw new LocationException("Unable to parse IP info data", e);
        }

        if (ipApiResponse == null) {
            throw new LocationException("IP info response is empty");
        }
        if (!IpApiResponse.SUCCESS_STATUS.equals(ipApiResponse.getStatus())) {
            throw new LocationException("IP info lookup was not successful: %s"
                    .formatted(StringUtils.defaultIfEmpty(ipApiResponse.getMessage(), ipApiResponse.getStatus())));
        }
        return ipApiResponse;
    }

    private static Location toLocation(String ip, IpApiResponse response) {
        return Location.builder()
                .driver(NAME)
                .ip(StringUtils.defaultIfEmpty(response.getQuery(), ip))
                .countryCode(response.getCountryCode())
                .isoCode(response.getCountryCode())
                .countryName(response.getCountry())
                .regionCode(response.getRegion())
                .regionName(response.getRegionName())
                .cityName(response.getCity())
                .zipCode(response.getZip())
                .latitude(response.getLat())
                .longitude(response.getLon())
                .timeZone(response.getTimezone())
                .isp(response.getIsp())
                .error(false)
                .build();
    }
}
