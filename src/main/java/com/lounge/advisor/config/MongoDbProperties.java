package com.lounge.advisor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * -@ConfigurationProperties(prefix = "spring.data.mongodb"): binds the MongoDB
 * connection block of application.yml onto this bean
 * --Read by VertxConfig when the shared Vert.x MongoClient is created
 * --WithoutIT: the client would always point at localhost with no timeouts;
 * ---a slow catalog database would hold requests indefinitely.
 */
@Data
@Component
@ConfigurationProperties(prefix = "spring.data.mongodb")
public class MongoDbProperties {

    private String host = "localhost";
    private int port = 27017;
    private String database = "lounge_db";

    private int connectTimeoutMs = 5000;
    private int socketTimeoutMs = 5000;
    private int serverSelectionTimeoutMs = 5000;
}
