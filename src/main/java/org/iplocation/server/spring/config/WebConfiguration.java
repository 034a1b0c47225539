package org.iplocation.server.spring.config;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.SessionHandler;
import io.vertx.ext.web.sstore.LocalSessionStore;
import jakarta.annotation.PostConstruct;
import org.iplocation.server.LocationVerticle;
import org.iplocation.server.handler.CountriesHandler;
import org.iplocation.server.handler.LocationHandler;
import org.iplocation.server.handler.LocationMatchHandler;
import org.iplocation.server.json.JacksonMapper;
import org.iplocation.server.location.LocationResolver;
import org.iplocation.server.model.Endpoint;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class WebConfiguration {

    private static final long DEPLOYMENT_TIMEOUT_SECONDS = 30;

    @Bean
    Router router(Vertx vertx,
                  SessionHandler sessionHandler,
                  LocationHandler locationHandler,
                  LocationMatchHandler locationMatchHandler,
                  CountriesHandler countriesHandler) {

        final Router router = Router.router(vertx);
        router.route().handler(sessionHandler);
        router.get(Endpoint.location.value()).handler(locationHandler);
        router.get(Endpoint.location_is.value()).handler(locationMatchHandler);
        router.get(Endpoint.countries.value()).handler(countriesHandler);
        return router;
    }

    @Bean
    SessionHandler sessionHandler(Vertx vertx,
                                  @Value("${http.session-timeout-ms}") long sessionTimeoutMs,
                                  @Value("${http.session-cookie-name}") String sessionCookieName) {

        return SessionHandler.create(LocalSessionStore.create(vertx))
                .setSessionTimeout(sessionTimeoutMs)
                .setSessionCookieName(sessionCookieName);
    }

    @Bean
    LocationHandler locationHandler(LocationResolver locationResolver, Vertx vertx, JacksonMapper mapper) {
        return new LocationHandler(locationResolver, vertx, mapper);
    }

    @Bean
    LocationMatchHandler locationMatchHandler(LocationResolver locationResolver, Vertx vertx, JacksonMapper mapper) {
        return new LocationMatchHandler(locationResolver, vertx, mapper);
    }

    @Bean
    CountriesHandler countriesHandler(LocationResolver locationResolver, JacksonMapper mapper) {
        return new CountriesHandler(locationResolver, mapper);
    }

    @Configuration
    public static class HttpServerConfiguration {

        @Autowired
        private Vertx vertx;

        @Autowired
        private Router router;

        @Value("${http.port}")
        private int port;

        @Value("${http.server-instances}")
        private int serverInstances;

        @PostConstruct
        public void startHttpServer() throws Exception {
            vertx.deployVerticle(() -> new LocationVerticle(router, port),
                            new DeploymentOptions().setInstances(serverInstances))
                    .toCompletionStage()
                    .toCompletableFuture()
                    .get(DEPLOYMENT_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        }
    }
}
