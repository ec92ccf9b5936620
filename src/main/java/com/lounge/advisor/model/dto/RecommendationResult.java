package com.lounge.advisor.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lounge.advisor.model.entity.FlightStatus;
import lombok.Data;

import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecommendationResult {
    private FlightStatus flight;
    private String airport;
    private int loungesConsidered;
    private List<Recommendation> recommendations;

    // Set when no lounge could be recommended, or when catalog data came from cache
    private String message;
    private Boolean fromCache;
}
