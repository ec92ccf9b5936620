package com.lounge.advisor.service;

import com.lounge.advisor.client.FlightDataClient;
import com.lounge.advisor.exception.AuthenticationException;
import com.lounge.advisor.model.entity.FlightOffer;
import com.lounge.advisor.model.entity.FlightStatus;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Flight lookups and offer searches as used by the advisor operations.
 * <p>
 * An {@link AuthenticationException} is retried exactly once; the client has
 * already dropped the rejected token, so the retry runs with a fresh one.
 * A second failure propagates. Other failures are never retried.
 */
@Service
@Slf4j
public class FlightLookupService {

    @Autowired
    private FlightDataClient flightDataClient;

    public Future<Optional<FlightStatus>> lookup(String identifier, String date, String operationalSuffix) {
        return retryOnceOnAuthFailure("flight " + identifier,
                () -> flightDataClient.getFlightStatus(identifier, date, operationalSuffix));
    }

    public Future<List<FlightOffer>> searchFlights(String origin, String destination, String departureDate,
            String returnDate) {
        return retryOnceOnAuthFailure("flight search " + origin + "-" + destination,
                () -> flightDataClient.searchFlights(origin, destination, departureDate, returnDate));
    }

    private <T> Future<T> retryOnceOnAuthFailure(String what, Supplier<Future<T>> call) {
        return call.get()
                .recover(err -> {
                    if (!(err instanceof AuthenticationException)) {
                        return Future.failedFuture(err);
                    }
                    log.warn("Authentication failed for {} - retrying once with a fresh token: {}",
                            what, err.getMessage());
                    return call.get();
                });
    }
}
