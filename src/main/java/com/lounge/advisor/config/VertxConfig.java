package com.lounge.advisor.config;

import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.mongo.MongoClient;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * -@Configuration: Vert.x runtime wiring
 * --Creates the single Vertx instance; its event bus carries the advisor events
 * --Creates the shared MongoClient used by the catalog and profile gateways
 * --Creates the WebClient used for the flight provider, with a bounded
 * connection pool
 * --WithoutIT: none of the async collaborators could be injected;
 * ---the application context would fail to start.
 */
@Configuration
public class VertxConfig {

    @Value("${vertx.worker-pool-size:40}")
    private int workerPoolSize;

    @Value("${vertx.event-loop-pool-size:4}")
    private int eventLoopPoolSize;

    @Autowired
    private MongoDbProperties mongoDbProperties;

    @Autowired
    private FlightProviderProperties flightProviderProperties;

    @Bean
    public Vertx vertx() {
        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(workerPoolSize)
                .setEventLoopPoolSize(eventLoopPoolSize);
        return Vertx.vertx(options);
    }

    @Bean
    public MongoClient mongoClient(Vertx vertx) {
        JsonObject config = new JsonObject()
                .put("host", mongoDbProperties.getHost())
                .put("port", mongoDbProperties.getPort())
                .put("db_name", mongoDbProperties.getDatabase())
                .put("connectTimeoutMS", mongoDbProperties.getConnectTimeoutMs())
                .put("socketTimeoutMS", mongoDbProperties.getSocketTimeoutMs())
                .put("serverSelectionTimeoutMS", mongoDbProperties.getServerSelectionTimeoutMs());

        return MongoClient.createShared(vertx, config);
    }

    /**
     * maxPoolSize caps the number of concurrent provider requests; extra requests
     * wait in the client's queue.
     */
    @Bean
    public WebClient webClient(Vertx vertx) {
        WebClientOptions options = new WebClientOptions()
                .setMaxPoolSize(flightProviderProperties.getMaxConnections())
                .setConnectTimeout((int) flightProviderProperties.getRequestTimeout().toMillis())
                .setUserAgent("lounge-advisor-service");
        return WebClient.create(vertx, options);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
