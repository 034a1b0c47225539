package org.iplocation.server.util;

import io.netty.handler.codec.http.HttpHeaderValues;
import io.vertx.core.MultiMap;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.net.SocketAddress;
import io.vertx.ext.web.RoutingContext;
import org.iplocation.server.location.model.RequestEnvironment;
import org.iplocation.server.log.ConditionalLogger;
import org.iplocation.server.log.Logger;
import org.iplocation.server.log.LoggerFactory;
import org.iplocation.server.model.Endpoint;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * This class consists of {@code static} utility methods for operating HTTP requests.
 */
public final class HttpUtil {

    private static final Logger logger = LoggerFactory.getLogger(HttpUtil.class);
    private static final ConditionalLogger conditionalLogger = new ConditionalLogger(logger);

    public static final String APPLICATION_JSON_CONTENT_TYPE =
            HttpHeaderValues.APPLICATION_JSON + ";" + HttpHeaderValues.CHARSET + "="
                    + StandardCharsets.UTF_8.toString().toLowerCase();

    public static final CharSequence CONTENT_TYPE_HEADER = HttpHeaders.createOptimized("Content-Type");

    private HttpUtil() {
    }

    /**
     * Collects headers and remote address of the request a location is resolved for.
     */
    public static RequestEnvironment requestEnvironment(HttpServerRequest request) {
        final MultiMap headers = MultiMap.caseInsensitiveMultiMap().addAll(request.headers());
        final SocketAddress remoteAddress = request.remoteAddress();

        return RequestEnvironment.of(headers, remoteAddress != null ? remoteAddress.host() : null);
    }

    public static boolean executeSafely(RoutingContext routingContext,
                                        Endpoint endpoint,
                                        Consumer<HttpServerResponse> responseConsumer) {

        final HttpServerResponse response = routingContext.response();

        if (response.closed()) {
            conditionalLogger.warn("Client already closed connection, response to %s will be skipped"
                    .formatted(endpoint.value()), 1, TimeUnit.MINUTES);
            return false;
        }

        try {
            responseConsumer.accept(response);
            return true;
        } catch (Exception e) {
            logger.warn("Failed to send {} response: {}", endpoint.value(), e.getMessage());
            return false;
        }
    }
}
