package com.lounge.advisor.model.dto;

import lombok.Data;

import java.time.Instant;
import java.util.Map;

@Data
public class HealthReport {
    private String status;
    private Map<String, String> circuitBreakers;
    private boolean tokenCached;
    private Instant timestamp;
}
