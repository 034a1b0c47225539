package org.iplocation.server.location.driver;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.iplocation.server.VertxTest;
import org.iplocation.server.location.model.Location;
import org.iplocation.server.vertx.httpclient.HttpClient;
import org.iplocation.server.vertx.httpclient.model.HttpClientResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
public class IpApiDriverTest extends VertxTest {

    private static final String ENDPOINT = "http://ip-api.com/json/{ip}";
    private static final String TEST_IP = "8.8.8.8";

    @Mock
    private HttpClient httpClient;

    private IpApiDriver ipApiDriver;

    @BeforeEach
    public void setUp() {
        ipApiDriver = new IpApiDriver(httpClient, jacksonMapper, ENDPOINT, 100L);
    }

    @Test
    public void getShouldRequestEndpointWithIpSubstituted() {
        // given
        givenHttpClientReturnsResponse(200, successBody());

        // when
        ipApiDriver.get("2001:4860::8888");

        // then
        verify(httpClient).get("http://ip-api.com/json/2001%3A4860%3A%3A8888", 100L);
    }

    @Test
    public void getShouldMapSuccessfulResponse() {
        // given
        givenHttpClientReturnsResponse(200, successBody());

        // when
        final Location result = ipApiDriver.get(TEST_IP);

        // then
        assertThat(result).isEqualTo(Location.builder()
                .driver(IpApiDriver.NAME)
                .ip(TEST_IP)
                .countryCode("US")
                .isoCode("US")
                .countryName("United States")
                .regionCode("VA")
                .regionName("Virginia")
                .cityName("Ashburn")
                .zipCode("20149")
                .latitude(39.03)
                .longitude(-77.5)
                .timeZone("America/New_York")
                .isp("Google LLC")
                .error(false)
                .build());
    }

    @Test
    public void getShouldReturnFailedLocationWhenLookupWasNotSuccessful() {
        // given
        givenHttpClientReturnsResponse(200, "{\"status\":\"fail\",\"message\":\"private range\",\"query\":\"10.0.0.1\"}");

        // when and then
        assertThat(ipApiDriver.get(TEST_IP)).isEqualTo(Location.failed(IpApiDriver.NAME, TEST_IP));
    }

    @Test
    public void getShouldReturnFailedLocationOnNonOkStatus() {
        // given
        givenHttpClientReturnsResponse(429, successBody());

        // when and then
        assertThat(ipApiDriver.get(TEST_IP).isError()).isTrue();
    }

    @Test
    public void getShouldReturnFailedLocationOnMalformedBody() {
        // given
        givenHttpClientReturnsResponse(200, "{");

        // when and then
        assertThat(ipApiDriver.get(TEST_IP).isError()).isTrue();
    }

    @Test
    public void getShouldReturnFailedLocationWhenRequestFails() {
        // given
        given(httpClient.get(anyString(), anyLong()))
                .willReturn(Future.failedFuture(new TimeoutException("Timeout period of 100ms has been exceeded")));

        // when and then
        assertThat(ipApiDriver.get(TEST_IP)).isEqualTo(Location.failed(IpApiDriver.NAME, TEST_IP));
    }

    @Test
    public void getShouldReturnFailedLocationWhenResponseDoesNotArriveInTime() {
        // given
        given(httpClient.get(anyString(), anyLong())).willReturn(Promise.<HttpClientResponse>promise().future());

        // when and then
        assertThat(ipApiDriver.get(TEST_IP).isError()).isTrue();
    }

    private void givenHttpClientReturnsResponse(int statusCode, String body) {
        given(httpClient.get(anyString(), anyLong()))
                .willReturn(Future.succeededFuture(HttpClientResponse.of(statusCode, null, body)));
    }

    private static String successBody() {
        return """
                {
                  "status": "success",
                  "country": "United States",
                  "countryCode": "US",
                  "region": "VA",
                  "regionName": "Virginia",
                  "city": "Ashburn",
                  "zip": "20149",
                  "lat": 39.03,
                  "lon": -77.5,
                  "timezone": "America/New_York",
                  "isp": "Google LLC",
                  "query": "8.8.8.8"
                }
                """;
    }
}
