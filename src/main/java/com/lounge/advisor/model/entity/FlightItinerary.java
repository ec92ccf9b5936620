package com.lounge.advisor.model.entity;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class FlightItinerary {
    String duration;
    List<FlightSegment> segments;
}
