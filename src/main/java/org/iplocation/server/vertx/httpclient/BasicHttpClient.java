package org.iplocation.server.vertx.httpclient;

import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import org.iplocation.server.vertx.httpclient.model.HttpClientResponse;

import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Simple wrapper around {@link io.vertx.core.http.HttpClient} with general functionality.
 */
public class BasicHttpClient implements HttpClient {

    private final io.vertx.core.http.HttpClient httpClient;

    public BasicHttpClient(io.vertx.core.http.HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient);
    }

    @Override
    public Future<HttpClientResponse> request(HttpMethod method,
                                              String url,
                                              MultiMap headers,
                                              String body,
                                              long timeoutMs) {

        if (timeoutMs <= 0) {
            return Future.failedFuture(new TimeoutException("Timeout has been exceeded"));
        }

        final RequestOptions options = new RequestOptions()
                .setMethod(method)
                .setAbsoluteURI(url)
                .setTimeout(timeoutMs);
        if (headers != null) {
            options.setHeaders(headers);
        }

        return httpClient.request(options)
                .compose(request -> send(request, body))
                .compose(response -> response.body()
                        .map(buffer -> HttpClientResponse.of(
                                response.statusCode(), response.headers(), buffer.toString())));
    }

    private static Future<io.vertx.core.http.HttpClientResponse> send(HttpClientRequest request, String body) {
        return body != null ? request.send(body) : request.send();
    }
}
