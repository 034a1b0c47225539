package org.iplocation.server.handler;

import io.netty.handler.codec.http.HttpResponseStatus;
import io.vertx.core.AsyncResult;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.Session;
import org.iplocation.server.exception.FieldNotFoundException;
import org.iplocation.server.exception.InvalidAddressException;
import org.iplocation.server.exception.NoDriverAvailableException;
import org.iplocation.server.json.JacksonMapper;
import org.iplocation.server.location.LocationResolver;
import org.iplocation.server.location.model.LocationContext;
import org.iplocation.server.log.Logger;
import org.iplocation.server.log.LoggerFactory;
import org.iplocation.server.model.Endpoint;
import org.iplocation.server.session.InMemorySessionStore;
import org.iplocation.server.session.SessionStore;
import org.iplocation.server.session.VertxSessionStore;
import org.iplocation.server.util.HttpUtil;

import java.util.Objects;

/**
 * Base for handlers resolving a location. Lookups may block on drivers, so they run on a worker thread.
 */
public abstract class AbstractLocationHandler implements Handler<RoutingContext> {

    private static final Logger logger = LoggerFactory.getLogger(AbstractLocationHandler.class);

    protected final LocationResolver locationResolver;
    private final Vertx vertx;
    private final JacksonMapper mapper;

    protected AbstractLocationHandler(LocationResolver locationResolver, Vertx vertx, JacksonMapper mapper) {
        this.locationResolver = Objects.requireNonNull(locationResolver);
        this.vertx = Objects.requireNonNull(vertx);
        this.mapper = Objects.requireNonNull(mapper);
    }

    @Override
    public void handle(RoutingContext routingContext) {
        final LocationContext context = LocationContext.of(
                sessionStore(routingContext),
                HttpUtil.requestEnvironment(routingContext.request()));

        vertx.executeBlocking(() -> resolve(routingContext, context))
                .onComplete(result -> respond(routingContext, result));
    }

    protected abstract Object resolve(RoutingContext routingContext, LocationContext context);

    protected abstract Endpoint endpoint();

    private static SessionStore sessionStore(RoutingContext routingContext) {
        final Session session = routingContext.session();
        return session != null ? new VertxSessionStore(session) : new InMemorySessionStore();
    }

    private void respond(RoutingContext routingContext, AsyncResult<Object> result) {
        if (result.succeeded()) {
            final String body = mapper.encodeToString(result.result());
            HttpUtil.executeSafely(routingContext, endpoint(), response -> response
                    .putHeader(HttpUtil.CONTENT_TYPE_HEADER, HttpUtil.APPLICATION_JSON_CONTENT_TYPE)
                    .end(body));
            return;
        }

        respondWithError(routingContext, endpoint(), result.cause());
    }

    static void respondWithError(RoutingContext routingContext, Endpoint endpoint, Throwable error) {
        final HttpResponseStatus status = statusFor(error);
        if (status == HttpResponseStatus.INTERNAL_SERVER_ERROR) {
            logger.error("Critical error while resolving location", error);
        } else {
            logger.debug("Location request to {} rejected: {}", endpoint.value(), error.getMessage());
        }

        HttpUtil.executeSafely(routingContext, endpoint, response -> response
                .setStatusCode(status.code())
                .end(Objects.toString(error.getMessage(), status.reasonPhrase())));
    }

    private static HttpResponseStatus statusFor(Throwable error) {
        if (error instanceof InvalidAddressException || error instanceof FieldNotFoundException) {
            return HttpResponseStatus.BAD_REQUEST;
        }
        if (error instanceof NoDriverAvailableException) {
            return HttpResponseStatus.SERVICE_UNAVAILABLE;
        }
        return HttpResponseStatus.INTERNAL_SERVER_ERROR;
    }
}
