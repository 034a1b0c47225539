package org.iplocation.server.handler;

import io.vertx.core.Vertx;
import io.vertx.ext.web.RoutingContext;
import org.iplocation.server.json.JacksonMapper;
import org.iplocation.server.location.LocationResolver;
import org.iplocation.server.location.model.LocationContext;
import org.iplocation.server.model.Endpoint;

import java.util.Collections;

/**
 * Handles HTTP request for the location of a visitor, or of the address given in {@code ip} parameter.
 * With {@code field} parameter only that location attribute is returned.
 */
public class LocationHandler extends AbstractLocationHandler {

    private static final String IP_PARAM = "ip";
    private static final String FIELD_PARAM = "field";

    public LocationHandler(LocationResolver locationResolver, Vertx vertx, JacksonMapper mapper) {
        super(locationResolver, vertx, mapper);
    }

    @Override
    protected Object resolve(RoutingContext routingContext, LocationContext context) {
        final String ip = routingContext.request().getParam(IP_PARAM);
        final String field = routingContext.request().getParam(FIELD_PARAM);

        final Object result = locationResolver.get(context, ip, field);
        return field != null ? Collections.singletonMap(field, result) : result;
    }

    @Override
    protected Endpoint endpoint() {
        return Endpoint.location;
    }
}
