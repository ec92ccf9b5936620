package com.lounge.advisor.model.entity;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * One end of a flight. Estimated and actual times fall back to the scheduled
 * time when the provider does not report them.
 */
@Value
@Builder
public class FlightEndpoint {
    String airport;
    String terminal;
    String gate;
    OffsetDateTime scheduledTime;
    OffsetDateTime estimatedTime;
    OffsetDateTime actualTime;
}
