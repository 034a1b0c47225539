package org.iplocation.server.spring.config;

import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.http.HttpClientOptions;
import org.iplocation.server.json.JacksonMapper;
import org.iplocation.server.json.ObjectMapperProvider;
import org.iplocation.server.vertx.httpclient.BasicHttpClient;
import org.iplocation.server.vertx.httpclient.HttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class VertxConfiguration {

    @Bean(destroyMethod = "close")
    Vertx vertx(@Value("${vertx.worker-pool-size}") int workerPoolSize) {
        return Vertx.vertx(new VertxOptions().setWorkerPoolSize(workerPoolSize));
    }

    @Bean
    JacksonMapper jacksonMapper() {
        return new JacksonMapper(ObjectMapperProvider.mapper());
    }

    @Bean
    HttpClient httpClient(Vertx vertx,
                          @Value("${http-client.max-pool-size}") int maxPoolSize,
                          @Value("${http-client.connect-timeout-ms}") int connectTimeoutMs) {

        final HttpClientOptions options = new HttpClientOptions()
                .setMaxPoolSize(maxPoolSize)
                .setConnectTimeout(connectTimeoutMs)
                .setTryUseCompression(true);

        return new BasicHttpClient(vertx.createHttpClient(options));
    }
}
