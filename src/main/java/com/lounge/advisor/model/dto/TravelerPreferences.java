package com.lounge.advisor.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional amenity preferences. A null or false flag contributes nothing to scoring.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TravelerPreferences {
    private Boolean quiet;
    private Boolean food;
    private Boolean wifi;
    private Boolean showers;
}
