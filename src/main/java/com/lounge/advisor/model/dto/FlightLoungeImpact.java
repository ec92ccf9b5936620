package com.lounge.advisor.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lounge.advisor.model.entity.FlightStatus;
import lombok.Data;

/**
 * Flight status plus lounge availability at both ends. Availability is null
 * when the catalog could not be consulted.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlightLoungeImpact {
    private FlightStatus flight;
    private Boolean departureLoungesAvailable;
    private Boolean arrivalLoungesAvailable;
    private Integer departureLoungeCount;
    private Integer arrivalLoungeCount;
}
