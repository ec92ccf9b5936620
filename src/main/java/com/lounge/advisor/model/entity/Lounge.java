package com.lounge.advisor.model.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Lounge {
    private String airport;
    private String loungeId;
    private String name;
    private String terminal;
    private List<String> accessProviders;
    private List<String> amenities;
    private String hours;
    private Integer avgWaitMinutes;
    private String crowdLevel;
    private Double rating;

    // Provider policies merged in by the catalog gateway
    private List<AccessProviderPolicy> accessDetails;
}
