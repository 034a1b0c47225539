package org.iplocation.server;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.ext.web.Router;
import org.iplocation.server.log.Logger;
import org.iplocation.server.log.LoggerFactory;

import java.util.Objects;

/**
 * Serves location endpoints over HTTP.
 */
public class LocationVerticle extends AbstractVerticle {

    private static final Logger logger = LoggerFactory.getLogger(LocationVerticle.class);

    private final Router router;
    private final int port;

    public LocationVerticle(Router router, int port) {
        this.router = Objects.requireNonNull(router);
        this.port = port;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        final HttpServerOptions httpServerOptions = new HttpServerOptions()
                .setHandle100ContinueAutomatically(true)
                .setCompressionSupported(true);

        vertx.createHttpServer(httpServerOptions)
                .requestHandler(router)
                .listen(port)
                .onSuccess(server -> logger.info("Successfully started HTTP server on port {}", server.actualPort()))
                .<Void>mapEmpty()
                .onComplete(startPromise);
    }
}
