package com.lounge.advisor.client;

import lombok.ToString;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Bearer token issued by the provider's token endpoint.
 */
@Value
public class Token {

    @ToString.Exclude
    String value;

    Instant expiresAt;

    /**
     * A token is served only while {@code now < expiresAt - safetyMargin}.
     */
    public boolean isUsableAt(Instant now, Duration safetyMargin) {
        return now.isBefore(expiresAt.minus(safetyMargin));
    }
}
