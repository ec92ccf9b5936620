package com.lounge.advisor.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lounge.advisor.model.entity.FlightOffer;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlightSearchResult {
    private String origin;
    private String destination;
    private LocalDate departureDate;
    private LocalDate returnDate;
    private List<FlightOffer> offers;
    private int totalFound;

    // Set when the provider returned no offers
    private String message;
}
