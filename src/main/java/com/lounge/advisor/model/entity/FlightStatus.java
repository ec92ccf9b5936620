package com.lounge.advisor.model.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Normalized status of one scheduled flight. Created per request and never cached.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlightStatus {
    String carrierCode;
    String flightNumber;
    LocalDate date;
    String operationalSuffix;
    FlightEndpoint departure;
    FlightEndpoint arrival;
    String aircraft;
    String operatingCarrier;

    @JsonIgnore
    public String getDesignator() {
        return carrierCode + flightNumber;
    }
}
