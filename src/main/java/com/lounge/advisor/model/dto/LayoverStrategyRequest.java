package com.lounge.advisor.model.dto;

import lombok.Data;

import java.util.List;

/**
 * Body of the layover strategy endpoint. Memberships come either from the
 * request or, when {@code userId} is set, from the stored user profile.
 */
@Data
public class LayoverStrategyRequest {
    private List<FlightLeg> legs;
    private List<String> memberships;
    private TravelerPreferences preferences;
    private String userId;
}
