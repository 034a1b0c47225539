package org.iplocation.server.vertx.httpclient;

import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.http.HttpMethod;
import org.iplocation.server.vertx.httpclient.model.HttpClientResponse;

/**
 * Interface describes HTTP interactions.
 */
public interface HttpClient {

    Future<HttpClientResponse> request(HttpMethod method, String url, MultiMap headers, String body, long timeoutMs);

    default Future<HttpClientResponse> get(String url, long timeoutMs) {
        return request(HttpMethod.GET, url, null, null, timeoutMs);
    }
}
