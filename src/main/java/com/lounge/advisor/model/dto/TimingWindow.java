package com.lounge.advisor.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * When to arrive at and leave a lounge. Entry and exit are omitted for long
 * layovers, where only the recommended duration is given.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TimingWindow {
    private OffsetDateTime latestEntry;
    private OffsetDateTime latestExit;
    private Integer recommendedDurationMinutes;
}
