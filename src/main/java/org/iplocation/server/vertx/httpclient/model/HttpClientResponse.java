package org.iplocation.server.vertx.httpclient.model;

import io.vertx.core.MultiMap;
import lombok.Value;

@Value(staticConstructor = "of")
public class HttpClientResponse {

    int statusCode;

    MultiMap headers;

    String body;
}
