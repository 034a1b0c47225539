package org.iplocation.server.handler;

import io.vertx.core.Vertx;
import io.vertx.ext.web.RoutingContext;
import lombok.Value;
import org.iplocation.server.json.JacksonMapper;
import org.iplocation.server.location.LocationResolver;
import org.iplocation.server.location.model.LocationContext;
import org.iplocation.server.model.Endpoint;

/**
 * Answers whether any attribute of the visitor location equals the {@code value} parameter.
 */
public class LocationMatchHandler extends AbstractLocationHandler {

    private static final String VALUE_PARAM = "value";

    public LocationMatchHandler(LocationResolver locationResolver, Vertx vertx, JacksonMapper mapper) {
        super(locationResolver, vertx, mapper);
    }

    @Override
    protected Object resolve(RoutingContext routingContext, LocationContext context) {
        final String value = routingContext.request().getParam(VALUE_PARAM);
        return MatchResponse.of(value, value != null && locationResolver.is(context, value));
    }

    @Override
    protected Endpoint endpoint() {
        return Endpoint.location_is;
    }

    @Value(staticConstructor = "of")
    public static class MatchResponse {

        String value;

        boolean matches;
    }
}
