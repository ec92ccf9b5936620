package com.lounge.advisor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Settings for the external flight schedule provider and its OAuth token endpoint.
 * <p>
 * The safety margin is subtracted from the token lifetime the provider reports,
 * so a 1799 s token is served for 1500 s with the default of 299 s.
 */
@Data
@Component
@ConfigurationProperties(prefix = "lounge.flight-provider")
public class FlightProviderProperties {

    private String baseUrl = "https://test.api.amadeus.com";
    private String tokenPath = "/v1/security/oauth2/token";
    private String schedulePath = "/v2/schedule/flights";
    private String offersPath = "/v2/shopping/flight-offers";

    /** Name of the secret holding the client id and client secret. */
    private String secretName = "autorescue/amadeus/credentials";

    private Duration credentialsTtl = Duration.ofHours(1);
    private Duration tokenSafetyMargin = Duration.ofSeconds(299);
    private Duration requestTimeout = Duration.ofSeconds(10);

    /** Offers requested per flight search; prices are quoted in {@link #currencyCode}. */
    private int maxOffers = 10;
    private String currencyCode = "USD";

    /** Upper bound on concurrent HTTP connections to the provider. */
    private int maxConnections = 8;
}
