package com.lounge.advisor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Lounge advisor service: flight-aware lounge recommendations and layover
 * planning over a Vert.x MongoDB catalog and the flight schedule provider.
 */
@SpringBootApplication
public class LoungeAdvisorApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoungeAdvisorApplication.class, args);
    }
}
