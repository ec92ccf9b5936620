package com.lounge.advisor.client;

import com.lounge.advisor.exception.ProviderException;
import com.lounge.advisor.model.entity.FlightEndpoint;
import com.lounge.advisor.model.entity.FlightIdentifier;
import com.lounge.advisor.model.entity.FlightStatus;
import com.lounge.advisor.util.DataTypeConverter;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Maps a flight schedule payload onto {@link FlightStatus}.
 * <p>
 * Two record shapes are understood:
 * <ul>
 * <li>designator shape: {@code flightDesignator.departure.iataCode/scheduledTime}
 * with operational data under {@code departure.terminal/gate/estimatedTime/actualTime}</li>
 * <li>flight-points shape: {@code flightPoints[].departure.timings[]} qualified
 * STD/ETD/ATD (STA/ETA/ATA on arrival), {@code terminal.code}, {@code gate.mainGate}</li>
 * </ul>
 * Only the first record of {@code data} is used.
 */
@Component
@Slf4j
public class FlightScheduleMapper {

    public Optional<FlightStatus> toFlightStatus(JsonObject payload, FlightIdentifier flight,
            LocalDate date, String operationalSuffix) {
        Object raw = payload.getValue("data");
        if (raw == null) {
            return Optional.empty();
        }
        if (!(raw instanceof JsonArray)) {
            throw new ProviderException(null, "Flight schedule payload has no data array");
        }
        JsonArray data = (JsonArray) raw;
        if (data.isEmpty()) {
            return Optional.empty();
        }
        if (!(data.getValue(0) instanceof JsonObject)) {
            throw new ProviderException(null, "Flight schedule record is not an object");
        }

        JsonObject record = data.getJsonObject(0);
        FlightEndpoint departure;
        FlightEndpoint arrival;
        if (record.containsKey("flightPoints")) {
            departure = fromFlightPoint(record, "departure", "STD", "ETD", "ATD");
            arrival = fromFlightPoint(record, "arrival", "STA", "ETA", "ATA");
        } else {
            departure = fromDesignator(record, "departure");
            arrival = fromDesignator(record, "arrival");
        }

        if (departure == null || departure.getAirport() == null) {
            throw new ProviderException(null, "Flight schedule record for " + flight.getDesignator()
                    + " has no departure airport");
        }

        return Optional.of(FlightStatus.builder()
                .carrierCode(flight.getCarrierCode())
                .flightNumber(flight.getFlightNumber())
                .date(date)
                .operationalSuffix(operationalSuffix)
                .departure(departure)
                .arrival(arrival)
                .aircraft(aircraftOf(record))
                .operatingCarrier(operatingCarrierOf(record))
                .build());
    }

    private FlightEndpoint fromDesignator(JsonObject record, String side) {
        JsonObject designator = objectAt(record, "flightDesignator");
        JsonObject planned = designator == null ? null : objectAt(designator, side);
        JsonObject operational = objectAt(record, side);
        if (planned == null && operational == null) {
            return null;
        }
        planned = planned == null ? new JsonObject() : planned;
        operational = operational == null ? new JsonObject() : operational;

        OffsetDateTime scheduled = time(planned.getValue("scheduledTime"));
        OffsetDateTime estimated = time(operational.getValue("estimatedTime"));
        OffsetDateTime actual = time(operational.getValue("actualTime"));

        return FlightEndpoint.builder()
                .airport(firstNonNull(text(planned.getValue("iataCode")), text(operational.getValue("iataCode"))))
                .terminal(text(operational.getValue("terminal")))
                .gate(text(operational.getValue("gate")))
                .scheduledTime(scheduled)
                .estimatedTime(estimated != null ? estimated : scheduled)
                .actualTime(actual != null ? actual : scheduled)
                .build();
    }

    private FlightEndpoint fromFlightPoint(JsonObject record, String side, String scheduledQualifier,
            String estimatedQualifier, String actualQualifier) {
        JsonArray points = record.getJsonArray("flightPoints");
        if (points == null) {
            return null;
        }
        for (int i = 0; i < points.size(); i++) {
            if (!(points.getValue(i) instanceof JsonObject)) {
                continue;
            }
            JsonObject point = points.getJsonObject(i);
            JsonObject sideInfo = objectAt(point, side);
            if (sideInfo == null) {
                continue;
            }

            OffsetDateTime scheduled = timing(sideInfo, scheduledQualifier);
            OffsetDateTime estimated = timing(sideInfo, estimatedQualifier);
            OffsetDateTime actual = timing(sideInfo, actualQualifier);

            return FlightEndpoint.builder()
                    .airport(text(point.getValue("iataCode")))
                    .terminal(text(sideInfo.getValue("terminal")))
                    .gate(text(sideInfo.getValue("gate")))
                    .scheduledTime(scheduled)
                    .estimatedTime(estimated != null ? estimated : scheduled)
                    .actualTime(actual != null ? actual : scheduled)
                    .build();
        }
        return null;
    }

    private OffsetDateTime timing(JsonObject sideInfo, String qualifier) {
        JsonArray timings = sideInfo.getJsonArray("timings");
        if (timings == null) {
            return null;
        }
        for (int i = 0; i < timings.size(); i++) {
            if (timings.getValue(i) instanceof JsonObject) {
                JsonObject timing = timings.getJsonObject(i);
                if (qualifier.equalsIgnoreCase(timing.getString("qualifier"))) {
                    return time(timing.getValue("value"));
                }
            }
        }
        return null;
    }

    private String aircraftOf(JsonObject record) {
        String aircraft = text(record.getValue("aircraft"));
        if (aircraft != null) {
            return aircraft;
        }
        JsonArray legs = record.getJsonArray("legs");
        if (legs != null && !legs.isEmpty() && legs.getValue(0) instanceof JsonObject) {
            return text(legs.getJsonObject(0).getValue("aircraftEquipment"));
        }
        return null;
    }

    private String operatingCarrierOf(JsonObject record) {
        String carrier = text(record.getValue("operatingCarrier"));
        if (carrier != null) {
            return carrier;
        }
        JsonArray segments = record.getJsonArray("segments");
        if (segments != null && !segments.isEmpty() && segments.getValue(0) instanceof JsonObject) {
            JsonObject partnership = objectAt(segments.getJsonObject(0), "partnership");
            JsonObject operating = partnership == null ? null : objectAt(partnership, "operatingFlight");
            return operating == null ? null : text(operating.getValue("carrierCode"));
        }
        return null;
    }

    /**
     * Reads a scalar, or the code of a nested object. Providers report terminals,
     * gates and aircraft either as plain strings or as small objects.
     */
    private String text(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof JsonObject) {
            JsonObject object = (JsonObject) value;
            for (String key : new String[] { "code", "mainGate", "aircraftType", "carrierCode", "iataCode" }) {
                Object nested = object.getValue(key);
                if (nested != null && !(nested instanceof JsonObject) && !(nested instanceof JsonArray)) {
                    return nested.toString();
                }
            }
            return null;
        }
        if (value instanceof JsonArray) {
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
            log.warn("Ignoring unparseable provider timestamp: {}", text);
            return null;
        }
    }

    private static JsonObject objectAt(JsonObject parent, String key) {
        Object value = parent.getValue(key);
        return value instanceof JsonObject ? (JsonObject) value : null;
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }
}
