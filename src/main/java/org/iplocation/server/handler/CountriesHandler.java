package org.iplocation.server.handler;

import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import org.iplocation.server.exception.FieldNotFoundException;
import org.iplocation.server.json.JacksonMapper;
import org.iplocation.server.location.LocationResolver;
import org.iplocation.server.model.Endpoint;
import org.iplocation.server.util.HttpUtil;

import java.util.Map;
import java.util.Objects;

/**
 * Handles HTTP request for the country list, keyed by {@code value} field and holding {@code name} field.
 */
public class CountriesHandler implements Handler<RoutingContext> {

    private static final String VALUE_PARAM = "value";
    private static final String NAME_PARAM = "name";

    private final LocationResolver locationResolver;
    private final JacksonMapper mapper;

    public CountriesHandler(LocationResolver locationResolver, JacksonMapper mapper) {
        this.locationResolver = Objects.requireNonNull(locationResolver);
        this.mapper = Objects.requireNonNull(mapper);
    }

    @Override
    public void handle(RoutingContext routingContext) {
        final Map<String, String> countries;
        try {
            countries = locationResolver.lists(
                    routingContext.request().getParam(VALUE_PARAM),
                    routingContext.request().getParam(NAME_PARAM));
        } catch (FieldNotFoundException e) {
            AbstractLocationHandler.respondWithError(routingContext, Endpoint.countries, e);
            return;
        }

        final String body = mapper.encodeToString(countries);
        HttpUtil.executeSafely(routingContext, Endpoint.countries, response -> response
                .putHeader(HttpUtil.CONTENT_TYPE_HEADER, HttpUtil.APPLICATION_JSON_CONTENT_TYPE)
                .end(body));
    }
}
