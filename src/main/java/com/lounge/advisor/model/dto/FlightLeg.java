package com.lounge.advisor.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One leg of an itinerary as supplied by the caller: a raw flight identifier,
 * the scheduled departure date (YYYY-MM-DD) and an optional operational suffix.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FlightLeg {
    private String flightNumber;
    private String date;
    private String operationalSuffix;

    public FlightLeg(String flightNumber, String date) {
        this(flightNumber, date, null);
    }
}
