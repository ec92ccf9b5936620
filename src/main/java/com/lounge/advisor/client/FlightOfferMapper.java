package com.lounge.advisor.client;

import com.lounge.advisor.exception.ProviderException;
import com.lounge.advisor.model.entity.FlightEndpoint;
import com.lounge.advisor.model.entity.FlightItinerary;
import com.lounge.advisor.model.entity.FlightOffer;
import com.lounge.advisor.model.entity.FlightSegment;
import com.lounge.advisor.util.DataTypeConverter;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps a flight offers payload onto {@link FlightOffer}s.
 * <p>
 * Expected shape: {@code data[].price.total/currency} and
 * {@code data[].itineraries[].segments[].departure/arrival.iataCode/terminal/at}.
 * Segment times carry no offset and are read as UTC, like every other
 * local timestamp from the provider.
 */
@Component
@Slf4j
public class FlightOfferMapper {

    public List<FlightOffer> toOffers(JsonObject payload, int maxOffers) {
        Object raw = payload.getValue("data");
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof JsonArray)) {
            throw new ProviderException(null, "Flight offers payload has no data array");
        }
        JsonArray data = (JsonArray) raw;

        List<FlightOffer> offers = new ArrayList<>();
        for (int i = 0; i < data.size() && offers.size() < maxOffers; i++) {
            if (!(data.getValue(i) instanceof JsonObject)) {
                throw new ProviderException(null, "Flight offer record is not an object");
            }
            offers.add(toOffer(data.getJsonObject(i)));
        }
        return offers;
    }

    private FlightOffer toOffer(JsonObject record) {
        JsonObject price = objectAt(record, "price");
        List<FlightItinerary> itineraries = new ArrayList<>();
        for (JsonObject itinerary : objectsAt(record, "itineraries")) {
            List<FlightSegment> segments = new ArrayList<>();
            for (JsonObject segment : objectsAt(itinerary, "segments")) {
                segments.add(toSegment(segment));
            }
            itineraries.add(FlightItinerary.builder()
                    .duration(text(itinerary.getValue("duration")))
                    .segments(segments)
                    .build());
        }

        return FlightOffer.builder()
                .id(text(record.getValue("id")))
                .totalPrice(price == null ? null : amount(price.getValue("total")))
                .currency(price == null ? null : text(price.getValue("currency")))
                .itineraries(itineraries)
                .build();
    }

    private FlightSegment toSegment(JsonObject segment) {
        return FlightSegment.builder()
                .carrierCode(text(segment.getValue("carrierCode")))
                .flightNumber(text(segment.getValue("number")))
                .departure(endpoint(objectAt(segment, "departure")))
                .arrival(endpoint(objectAt(segment, "arrival")))
                .duration(text(segment.getValue("duration")))
                .aircraft(text(segment.getValue("aircraft")))
                .build();
    }

    private FlightEndpoint endpoint(JsonObject side) {
        if (side == null) {
            return null;
        }
        OffsetDateTime at = time(side.getValue("at"));
        return FlightEndpoint.builder()
                .airport(text(side.getValue("iataCode")))
                .terminal(text(side.getValue("terminal")))
                .scheduledTime(at)
                .estimatedTime(at)
                .build();
    }

    private BigDecimal amount(Object value) {
        String text = text(value);
        if (text == null) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparseable offer price: {}", text);
            return null;
        }
    }

    // Aircraft arrives as {"code": "738"}; everything else is a plain scalar
    private String text(Object value) {
        if (value instanceof JsonObject) {
            Object code = ((JsonObject) value).getValue("code");
            return code == null ? null : code.toString();
        }
        if (value == null || value instanceof JsonArray) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private OffsetDateTime time(Object value) {
        String text = text(value);
        if (text == null) {
            return null;
        }
        try {
            return DataTypeConverter.toOffsetDateTime(text);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable offer timestamp: {}", text);
            return null;
        }
    }

    private static JsonObject objectAt(JsonObject parent, String key) {
        Object value = parent.getValue(key);
        return value instanceof JsonObject ? (JsonObject) value : null;
    }

    private static List<JsonObject> objectsAt(JsonObject parent, String key) {
        Object value = parent.getValue(key);
        if (!(value instanceof JsonArray)) {
            return List.of();
        }
        List<JsonObject> objects = new ArrayList<>();
        for (Object item : (JsonArray) value) {
            if (item instanceof JsonObject) {
                objects.add((JsonObject) item);
            }
        }
        return objects;
    }
}
