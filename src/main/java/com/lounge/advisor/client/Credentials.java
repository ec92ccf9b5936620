package com.lounge.advisor.client;

import lombok.ToString;
import lombok.Value;

/**
 * OAuth client credentials for the flight data provider.
 */
@Value
public class Credentials {
    String clientId;

    @ToString.Exclude
    String clientSecret;
}
