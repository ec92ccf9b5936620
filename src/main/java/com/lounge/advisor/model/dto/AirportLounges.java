package com.lounge.advisor.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lounge.advisor.model.entity.Lounge;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Catalog answer for one airport. An airport without lounges yields an empty list.
 */
@Data
public class AirportLounges {
    private String airport;
    private List<Lounge> lounges = new ArrayList<>();

    // Degraded mode metadata
    private boolean fromCache;
    private Instant cacheTimestamp;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<String> fallbackMsg;
}
