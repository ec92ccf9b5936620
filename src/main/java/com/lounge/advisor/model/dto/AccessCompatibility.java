package com.lounge.advisor.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class AccessCompatibility {
    List<AccessMatch> matches;

    @JsonProperty("hasAccess")
    public boolean hasAccess() {
        return !matches.isEmpty();
    }
}
