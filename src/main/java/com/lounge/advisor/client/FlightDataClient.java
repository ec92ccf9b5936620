package com.lounge.advisor.client;

import com.lounge.advisor.config.FlightProviderProperties;
import com.lounge.advisor.exception.AuthenticationException;
import com.lounge.advisor.exception.ProviderException;
import com.lounge.advisor.exception.ServiceUnavailableException;
import com.lounge.advisor.exception.ValidationException;
import com.lounge.advisor.model.entity.FlightIdentifier;
import com.lounge.advisor.model.entity.FlightOffer;
import com.lounge.advisor.model.entity.FlightStatus;
import com.lounge.advisor.util.DataTypeConverter;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * -@Component: client for the external flight schedule and flight offers APIs
 * --Validates identifiers, airports and dates before any network call
 * --Authenticates with a bearer token from CredentialCache; a 401 drops that token
 * --Normalizes payloads through FlightScheduleMapper and FlightOfferMapper
 * --WithoutIT: no flight-aware recommendation or layover plan is possible.
 * =========
 * Circuit breaker "flightProviderCB" (manual tryAcquirePermission +
 * onSuccess/onError, same as the catalog gateways):
 * --5xx answers, transport failures and malformed payloads count as errors
 * --4xx answers are the caller's fault and count as successful calls
 * --auth failures release the permission without recording an outcome
 * --when OPEN the call fails fast with ServiceUnavailableException; flight data is
 * never cached, so there is no fallback
 */
@Component
@Slf4j
public class FlightDataClient {

    static final String CIRCUIT_BREAKER_NAME = "flightProviderCB";

    private static final Pattern AIRPORT_CODE = Pattern.compile("^[A-Za-z]{3}$");

    @Autowired
    private WebClient webClient;

    @Autowired
    private CredentialCache credentialCache;

    @Autowired
    private FlightProviderProperties properties;

    @Autowired
    private FlightScheduleMapper flightScheduleMapper;

    @Autowired
    private FlightOfferMapper flightOfferMapper;

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    private CircuitBreaker circuitBreaker;

    @jakarta.annotation.PostConstruct
    public void init() {
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME);
        log.info("FlightDataClient Circuit Breaker initialized: {}", circuitBreaker.getName());
    }

    /**
     * Look up one flight.
     *
     * -@param identifier raw flight identifier, e.g. "AA123" or " ua 1234 "
     * -@param date scheduled departure date, YYYY-MM-DD, local to the departure airport
     * -@param operationalSuffix optional suffix such as "A"; blank means none
     * -@return the flight, or an empty Optional when the provider has no such flight.
     * Fails with ValidationException, AuthenticationException or ProviderException.
     */
    public Future<Optional<FlightStatus>> getFlightStatus(String identifier, String date, String operationalSuffix) {
        FlightIdentifier flight;
        LocalDate departureDate;
        try {
            flight = FlightIdentifier.parse(identifier);
            departureDate = DataTypeConverter.toDepartureDate(date);
        } catch (ValidationException e) {
            log.warn("Rejected flight lookup for {} on {}: {}", identifier, date, e.getMessage());
            return Future.failedFuture(e);
        }
        String suffix = operationalSuffix == null || operationalSuffix.isBlank() ? null : operationalSuffix.trim();
        String description = "Flight lookup " + flight.getDesignator() + " on " + departureDate;

        return guarded(description,
                token -> {
                    HttpRequest<Buffer> request = authorized(properties.getSchedulePath(), token)
                            .addQueryParam("carrierCode", flight.getCarrierCode())
                            .addQueryParam("flightNumber", flight.getFlightNumber())
                            .addQueryParam("scheduledDepartureDate", departureDate.toString());
                    if (suffix != null) {
                        request.addQueryParam("operationalSuffix", suffix);
                    }
                    return request.send();
                },
                body -> flightScheduleMapper.toFlightStatus(body, flight, departureDate, suffix))
                .onSuccess(result -> log.info("{}: {}", description, result.isPresent() ? "found" : "not found"));
    }

    /**
     * Search bookable offers between two airports, for planning lounge visits
     * around the flights a traveler might take.
     *
     * -@param origin 3-letter IATA code, any case
     * -@param destination 3-letter IATA code, any case
     * -@param departureDate YYYY-MM-DD
     * -@param returnDate optional YYYY-MM-DD, not before the departure date
     * -@return at most maxOffers offers; an empty list when nothing is offered.
     * Fails with ValidationException, AuthenticationException or ProviderException.
     */
    public Future<List<FlightOffer>> searchFlights(String origin, String destination, String departureDate,
            String returnDate) {
        String from;
        String to;
        LocalDate outbound;
        LocalDate inbound;
        try {
            from = airportCode(origin);
            to = airportCode(destination);
            outbound = DataTypeConverter.toDepartureDate(departureDate);
            inbound = returnDate == null || returnDate.isBlank() ? null : DataTypeConverter.toDepartureDate(returnDate);
            if (inbound != null && inbound.isBefore(outbound)) {
                throw new ValidationException("Return date " + inbound + " is before departure date " + outbound);
            }
        } catch (ValidationException e) {
            log.warn("Rejected flight search {}-{} on {}: {}", origin, destination, departureDate, e.getMessage());
            return Future.failedFuture(e);
        }
        String description = "Flight search " + from + "-" + to + " on " + outbound;

        return guarded(description,
                token -> {
                    HttpRequest<Buffer> request = authorized(properties.getOffersPath(), token)
                            .addQueryParam("originLocationCode", from)
                            .addQueryParam("destinationLocationCode", to)
                            .addQueryParam("departureDate", outbound.toString())
                            .addQueryParam("adults", "1")
                            .addQueryParam("max", String.valueOf(properties.getMaxOffers()))
                            .addQueryParam("currencyCode", properties.getCurrencyCode());
                    if (inbound != null) {
                        request.addQueryParam("returnDate", inbound.toString());
                    }
                    return request.send();
                },
                body -> flightOfferMapper.toOffers(body, properties.getMaxOffers()))
                .onSuccess(offers -> log.info("{}: {} offers", description, offers.size()));
    }

    private static String airportCode(String code) {
        if (code == null || !AIRPORT_CODE.matcher(code.trim()).matches()) {
            throw new ValidationException("Invalid airport code '" + code + "': expected 3 letters");
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }

    private HttpRequest<Buffer> authorized(String path, Token token) {
        return webClient.getAbs(properties.getBaseUrl() + path)
                .bearerTokenAuthentication(token.getValue())
                .timeout(properties.getRequestTimeout().toMillis());
    }

    /**
     * Runs one provider call behind the circuit breaker: fetches a token, sends
     * the request, maps the body and records the outcome.
     */
    private <T> Future<T> guarded(String description, Function<Token, Future<HttpResponse<Buffer>>> send,
            Function<JsonObject, T> mapper) {
        log.info("[CB-BEFORE] {} | State: {}", description, circuitBreaker.getState());

        if (!circuitBreaker.tryAcquirePermission()) {
            log.warn("[CB-REJECTED] Circuit is OPEN - failing fast for {}", description);
            return Future.failedFuture(
                    new ServiceUnavailableException("Flight data provider temporarily unavailable"));
        }

        long start = System.nanoTime();

        return credentialCache.getToken()
                .compose(token -> send.apply(token)
                        .recover(err -> Future.failedFuture(new ProviderException(null,
                                "Flight data provider unreachable: " + err.getMessage(), err)))
                        .compose(response -> handleResponse(response, token, mapper)))
                .andThen(ar -> recordOutcome(ar, start))
                .onFailure(err -> log.error("{} failed: {}", description, err.getMessage()));
    }

    private <T> Future<T> handleResponse(HttpResponse<Buffer> response, Token token, Function<JsonObject, T> mapper) {
        int status = response.statusCode();

        if (status == 401) {
            credentialCache.invalidate(token);
            return Future.failedFuture(new AuthenticationException("Flight data provider rejected the access token"));
        }
        if (status < 200 || status >= 300) {
            return Future.failedFuture(new ProviderException(status,
                    "Flight data provider error: " + ProviderErrors.describe(response)));
        }

        JsonObject body;
        try {
            body = response.bodyAsJsonObject();
        } catch (DecodeException | ClassCastException e) {
            return Future.failedFuture(new ProviderException(null, "Flight data payload is not a JSON object", e));
        }
        if (body == null) {
            return Future.failedFuture(new ProviderException(null, "Flight data payload is empty"));
        }

        try {
            return Future.succeededFuture(mapper.apply(body));
        } catch (ProviderException e) {
            return Future.failedFuture(e);
        } catch (ClassCastException e) {
            return Future.failedFuture(new ProviderException(null,
                    "Flight data payload has an unexpected shape: " + e.getMessage(), e));
        }
    }

    private void recordOutcome(AsyncResult<?> ar, long start) {
        long duration = System.nanoTime() - start;
        if (ar.succeeded()) {
            circuitBreaker.onSuccess(duration, TimeUnit.NANOSECONDS);
            return;
        }
        Throwable cause = ar.cause();
        if (cause instanceof ProviderException && ((ProviderException) cause).isProviderFault()) {
            circuitBreaker.onError(duration, TimeUnit.NANOSECONDS, cause);
        } else if (cause instanceof AuthenticationException) {
            circuitBreaker.releasePermission();
        } else {
            circuitBreaker.onSuccess(duration, TimeUnit.NANOSECONDS);
        }
    }
}
