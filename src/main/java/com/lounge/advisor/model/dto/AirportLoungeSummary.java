package com.lounge.advisor.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AirportLoungeSummary {
    private String airport;
    private int totalLounges;

    // Only when memberships were supplied
    private Integer accessibleLounges;

    private List<String> terminals;
    private List<String> amenities;
    private Double averageRating;
    private boolean fromCache;
}
