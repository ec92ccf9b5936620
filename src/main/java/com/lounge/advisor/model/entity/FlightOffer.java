package com.lounge.advisor.model.entity;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A bookable flight option: outbound itinerary first, then the return
 * itinerary for round trips.
 */
@Value
@Builder
public class FlightOffer {
    String id;
    BigDecimal totalPrice;
    String currency;
    List<FlightItinerary> itineraries;
}
