package com.lounge.advisor.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Lounge plan for one connection between two consecutive legs.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LayoverStrategy {
    private String connectionAirport;
    private String arrivalFlight;
    private String departureFlight;
    private long layoverMinutes;
    private LayoverRecommendation recommendation;
    private List<Recommendation> suggestedLounges = new ArrayList<>();
    private String advice;
}
