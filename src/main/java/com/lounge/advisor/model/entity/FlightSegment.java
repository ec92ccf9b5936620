package com.lounge.advisor.model.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * One flown segment of an offer. Both endpoints carry the offered time as
 * scheduled and estimated time, plus the terminal used for lounge planning.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlightSegment {
    String carrierCode;
    String flightNumber;
    FlightEndpoint departure;
    FlightEndpoint arrival;

    // ISO-8601 duration as reported, e.g. PT6H30M
    String duration;

    String aircraft;

    @JsonIgnore
    public String getDesignator() {
        return carrierCode + flightNumber;
    }
}
