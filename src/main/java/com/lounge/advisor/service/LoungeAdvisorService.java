package com.lounge.advisor.service;

import com.lounge.advisor.client.CredentialCache;
import com.lounge.advisor.exception.ErrorKind;
import com.lounge.advisor.exception.LoungeAdvisorException;
import com.lounge.advisor.exception.ProviderException;
import com.lounge.advisor.exception.ValidationException;
import com.lounge.advisor.model.dto.AccessCompatibility;
import com.lounge.advisor.model.dto.AdvisorResponse;
import com.lounge.advisor.model.dto.AirportLoungeSummary;
import com.lounge.advisor.model.dto.AirportLounges;
import com.lounge.advisor.model.dto.FlightLeg;
import com.lounge.advisor.model.dto.FlightLoungeImpact;
import com.lounge.advisor.model.dto.FlightSearchResult;
import com.lounge.advisor.model.dto.HealthReport;
import com.lounge.advisor.model.dto.LayoverStrategy;
import com.lounge.advisor.model.dto.Recommendation;
import com.lounge.advisor.model.dto.RecommendationResult;
import com.lounge.advisor.model.dto.TravelerContext;
import com.lounge.advisor.model.dto.TravelerPreferences;
import com.lounge.advisor.model.entity.FlightEndpoint;
import com.lounge.advisor.model.entity.FlightIdentifier;
import com.lounge.advisor.model.entity.FlightStatus;
import com.lounge.advisor.model.entity.Lounge;
import com.lounge.advisor.model.entity.UserProfile;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * -@Service: public entry point of the advisor
 * --Every operation completes with an AdvisorResponse and never fails
 * --Known failures keep their ErrorKind; anything else is logged and reported
 * as INTERNAL without partial data
 * --Publishes "lounge.recommended" and "lounge.layover.planned" on the event bus
 */
@Service
@Slf4j
public class LoungeAdvisorService {

    public static final String RECOMMENDED_ADDRESS = "lounge.recommended";
    public static final String LAYOVER_PLANNED_ADDRESS = "lounge.layover.planned";

    static final List<String> CIRCUIT_BREAKERS = List.of("flightProviderCB", "loungeCatalogCB", "userProfileCB");

    private static final Pattern AIRPORT_PATTERN = Pattern.compile("^[A-Za-z]{3}$");

    @Autowired
    private FlightLookupService flightLookupService;

    @Autowired
    private LoungeCatalogGateway loungeCatalogGateway;

    @Autowired
    private UserProfileGateway userProfileGateway;

    @Autowired
    private AccessCompatibilityMatcher accessCompatibilityMatcher;

    @Autowired
    private RecommendationScorer recommendationScorer;

    @Autowired
    private LayoverStrategyPlanner layoverStrategyPlanner;

    @Autowired
    private CredentialCache credentialCache;

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    @Autowired
    private Vertx vertx;

    /**
     * Rank the lounges at the departure airport of one flight.
     * not_found when the provider has no such flight.
     */
    public Future<AdvisorResponse<RecommendationResult>> getFlightAwareRecommendations(String identifier,
            String date, String operationalSuffix, TravelerContext context) {
        TravelerContext traveler = context == null ? new TravelerContext() : context;
        log.info("Recommendations requested for flight {} on {}", identifier, date);

        return respond("getFlightAwareRecommendations", () -> flightLookupService
                .lookup(identifier, date, operationalSuffix)
                .compose(flight -> {
                    if (flight.isEmpty()) {
                        return Future.succeededFuture(AdvisorResponse.<RecommendationResult>notFound(
                                "No flight found for " + identifier + " on " + date));
                    }
                    return recommendFor(flight.get(), traveler).map(AdvisorResponse::success);
                }));
    }

    public Future<AdvisorResponse<RecommendationResult>> getFlightAwareRecommendationsForUser(String userId,
            String identifier, String date, String operationalSuffix, TravelerPreferences preferences) {
        return withUser(userId, profile -> getFlightAwareRecommendations(identifier, date, operationalSuffix,
                new TravelerContext(membershipsOf(profile), preferences)));
    }

    /**
     * One strategy per resolvable connection, in itinerary order.
     */
    public Future<AdvisorResponse<List<LayoverStrategy>>> planLayoverStrategy(List<FlightLeg> legs,
            TravelerContext context) {
        TravelerContext traveler = context == null ? new TravelerContext() : context;
        log.info("Layover strategy requested for {} leg(s)", legs == null ? 0 : legs.size());

        return respond("planLayoverStrategy", () -> layoverStrategyPlanner
                .plan(legs, membershipsOf(traveler), traveler.getPreferences())
                .map(strategies -> {
                    publishLayoverEvent(strategies);
                    return AdvisorResponse.success(strategies);
                }));
    }

    public Future<AdvisorResponse<List<LayoverStrategy>>> planLayoverStrategyForUser(String userId,
            List<FlightLeg> legs, TravelerPreferences preferences) {
        return withUser(userId, profile -> planLayoverStrategy(legs,
                new TravelerContext(membershipsOf(profile), preferences)));
    }

    /**
     * Flight status plus whether lounges exist at either end of the flight.
     */
    public Future<AdvisorResponse<FlightLoungeImpact>> getFlightLoungeImpact(String identifier, String date,
            String operationalSuffix) {
        return respond("getFlightLoungeImpact", () -> flightLookupService
                .lookup(identifier, date, operationalSuffix)
                .compose(flight -> {
                    if (flight.isEmpty()) {
                        return Future.succeededFuture(AdvisorResponse.<FlightLoungeImpact>notFound(
                                "No flight found for " + identifier + " on " + date));
                    }
                    FlightStatus status = flight.get();
                    Future<Integer> departureCount = loungeCount(status.getDeparture());
                    Future<Integer> arrivalCount = loungeCount(status.getArrival());

                    return Future.all(departureCount, arrivalCount).map(done -> {
                        FlightLoungeImpact impact = new FlightLoungeImpact();
                        impact.setFlight(status);
                        impact.setDepartureLoungeCount(departureCount.result());
                        impact.setArrivalLoungeCount(arrivalCount.result());
                        impact.setDepartureLoungesAvailable(
                                departureCount.result() == null ? null : departureCount.result() > 0);
                        impact.setArrivalLoungesAvailable(
                                arrivalCount.result() == null ? null : arrivalCount.result() > 0);
                        return AdvisorResponse.success(impact);
                    });
                }));
    }

    /**
     * Bookable offers between two airports, so a traveler can pick flights whose
     * terminals and connections suit a lounge visit. No offers is still a success,
     * with a message instead of a NOT_FOUND.
     */
    public Future<AdvisorResponse<FlightSearchResult>> searchFlightsForLoungePlanning(String origin,
            String destination, String departureDate, String returnDate) {
        return respond("searchFlightsForLoungePlanning", () -> flightLookupService
                .searchFlights(origin, destination, departureDate, returnDate)
                .map(offers -> {
                    FlightSearchResult result = new FlightSearchResult();
                    result.setOrigin(origin.trim().toUpperCase(Locale.ROOT));
                    result.setDestination(destination.trim().toUpperCase(Locale.ROOT));
                    result.setDepartureDate(LocalDate.parse(departureDate.trim()));
                    if (returnDate != null && !returnDate.isBlank()) {
                        result.setReturnDate(LocalDate.parse(returnDate.trim()));
                    }
                    result.setOffers(offers);
                    result.setTotalFound(offers.size());
                    if (offers.isEmpty()) {
                        result.setMessage("No flights found");
                    }
                    return AdvisorResponse.success(result);
                }));
    }

    public Future<AdvisorResponse<AirportLoungeSummary>> getAirportLoungeSummary(String airport,
            List<String> memberships) {
        return respond("getAirportLoungeSummary", () -> {
            if (airport == null || !AIRPORT_PATTERN.matcher(airport.trim()).matches()) {
                throw new ValidationException("Invalid airport code '" + airport + "': expected 3 letters");
            }
            return loungeCatalogGateway.getLounges(airport.trim().toUpperCase(Locale.ROOT))
                    .map(lounges -> AdvisorResponse.success(summarize(lounges, memberships)));
        });
    }

    public Future<AdvisorResponse<AccessCompatibility>> checkCompatibility(List<String> memberships,
            List<String> providers) {
        return respond("checkCompatibility", () -> {
            if (memberships == null || providers == null) {
                throw new ValidationException("Both memberships and providers are required");
            }
            return Future.succeededFuture(
                    AdvisorResponse.success(accessCompatibilityMatcher.check(memberships, providers)));
        });
    }

    public Future<AdvisorResponse<FlightIdentifier>> validateFlightNumber(String identifier) {
        return respond("validateFlightNumber",
                () -> Future.succeededFuture(AdvisorResponse.success(FlightIdentifier.parse(identifier))));
    }

    public Future<AdvisorResponse<UserProfile>> getUser(String userId) {
        return respond("getUser", () -> lookupUser(userId).map(profile -> profile
                .map(AdvisorResponse::success)
                .orElseGet(() -> AdvisorResponse.notFound("User not found: " + userId))));
    }

    public Future<AdvisorResponse<HealthReport>> healthCheck() {
        return respond("healthCheck", () -> {
            Map<String, String> states = new LinkedHashMap<>();
            boolean degraded = false;
            for (String name : CIRCUIT_BREAKERS) {
                CircuitBreaker.State state = circuitBreakerRegistry.circuitBreaker(name).getState();
                states.put(name, state.name());
                degraded |= state == CircuitBreaker.State.OPEN || state == CircuitBreaker.State.FORCED_OPEN;
            }

            HealthReport report = new HealthReport();
            report.setStatus(degraded ? "degraded" : "healthy");
            report.setCircuitBreakers(states);
            report.setTokenCached(credentialCache.hasValidToken());
            report.setTimestamp(Instant.now());
            return Future.succeededFuture(AdvisorResponse.success(report));
        });
    }

    private Future<RecommendationResult> recommendFor(FlightStatus flight, TravelerContext traveler) {
        String airport = flight.getDeparture().getAirport();

        return loungeCatalogGateway.getLounges(airport).map(airportLounges -> {
            List<Recommendation> recommendations = recommendationScorer.scoreLounges(flight,
                    airportLounges.getLounges(), membershipsOf(traveler), traveler.getPreferences());

            RecommendationResult result = new RecommendationResult();
            result.setFlight(flight);
            result.setAirport(airportLounges.getAirport());
            result.setLoungesConsidered(airportLounges.getLounges().size());
            result.setRecommendations(recommendations);
            if (airportLounges.isFromCache()) {
                result.setFromCache(true);
            }
            if (recommendations.isEmpty()) {
                result.setMessage(airportLounges.getLounges().isEmpty()
                        ? "No lounges found at " + airport
                        : "No accessible lounges at " + airport + " for the given memberships");
            }

            publishRecommendationEvent(flight, recommendations.size());
            return result;
        });
    }

    private AirportLoungeSummary summarize(AirportLounges airportLounges, List<String> memberships) {
        List<Lounge> lounges = airportLounges.getLounges();
        TreeSet<String> terminals = new TreeSet<>();
        TreeSet<String> amenities = new TreeSet<>();
        double ratingSum = 0;
        int rated = 0;
        int accessible = 0;

        for (Lounge lounge : lounges) {
            if (lounge.getTerminal() != null) {
                terminals.add(lounge.getTerminal());
            }
            if (lounge.getAmenities() != null) {
                lounge.getAmenities().stream().filter(Objects::nonNull).forEach(amenities::add);
            }
            if (lounge.getRating() != null) {
                ratingSum += lounge.getRating();
                rated++;
            }
            if (memberships != null
                    && accessCompatibilityMatcher.check(memberships, lounge.getAccessProviders()).hasAccess()) {
                accessible++;
            }
        }

        AirportLoungeSummary summary = new AirportLoungeSummary();
        summary.setAirport(airportLounges.getAirport());
        summary.setTotalLounges(lounges.size());
        summary.setAccessibleLounges(memberships == null || memberships.isEmpty() ? null : accessible);
        summary.setTerminals(new ArrayList<>(terminals));
        summary.setAmenities(new ArrayList<>(amenities));
        summary.setAverageRating(rated == 0 ? null : Math.round(ratingSum / rated * 100) / 100.0);
        summary.setFromCache(airportLounges.isFromCache());
        return summary;
    }

    /**
     * Number of lounges at the endpoint's airport, or null when unknown.
     */
    private Future<Integer> loungeCount(FlightEndpoint endpoint) {
        if (endpoint == null || endpoint.getAirport() == null) {
            return Future.succeededFuture(null);
        }
        return loungeCatalogGateway.getLounges(endpoint.getAirport())
                .map(lounges -> lounges.getLounges().size())
                .recover(err -> {
                    log.warn("Lounge availability unknown at {}: {}", endpoint.getAirport(), err.getMessage());
                    return Future.succeededFuture(null);
                });
    }

    private Future<Optional<UserProfile>> lookupUser(String userId) {
        if (userId == null || userId.isBlank()) {
            return Future.failedFuture(new ValidationException("User id is required"));
        }
        return userProfileGateway.getUser(userId.trim());
    }

    private <T> Future<AdvisorResponse<T>> withUser(String userId,
            Function<UserProfile, Future<AdvisorResponse<T>>> operation) {
        return respond("userLookup", () -> lookupUser(userId).compose(profile -> profile
                .map(operation)
                .orElseGet(() -> Future.succeededFuture(AdvisorResponse.notFound("User not found: " + userId)))));
    }

    private static List<String> membershipsOf(TravelerContext context) {
        return context.getMemberships() == null ? List.of() : context.getMemberships();
    }

    private static List<String> membershipsOf(UserProfile profile) {
        return profile.getMemberships() == null ? new ArrayList<>() : profile.getMemberships();
    }

    private void publishRecommendationEvent(FlightStatus flight, int count) {
        JsonObject event = new JsonObject()
                .put("flight", flight.getDesignator())
                .put("airport", flight.getDeparture().getAirport())
                .put("recommendations", count)
                .put("timestamp", Instant.now().toString());
        vertx.eventBus().publish(RECOMMENDED_ADDRESS, event);
    }

    private void publishLayoverEvent(List<LayoverStrategy> strategies) {
        JsonObject event = new JsonObject()
                .put("connections", strategies.size())
                .put("timestamp", Instant.now().toString());
        vertx.eventBus().publish(LAYOVER_PLANNED_ADDRESS, event);
    }

    /**
     * Runs an operation and folds every failure into the envelope.
     */
    private <T> Future<AdvisorResponse<T>> respond(String operation, Supplier<Future<AdvisorResponse<T>>> action) {
        Future<AdvisorResponse<T>> result;
        try {
            result = action.get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        return result.recover(err -> Future.succeededFuture(toErrorResponse(operation, err)));
    }

    private <T> AdvisorResponse<T> toErrorResponse(String operation, Throwable err) {
        if (err instanceof LoungeAdvisorException) {
            LoungeAdvisorException known = (LoungeAdvisorException) err;
            Integer providerStatus = known instanceof ProviderException
                    ? ((ProviderException) known).getStatusCode()
                    : null;
            log.warn("{} failed with {}: {}", operation, known.getKind(), known.getMessage());
            return AdvisorResponse.error(known.getKind(), known.getMessage(), providerStatus);
        }
        log.error("{} failed unexpectedly", operation, err);
        return AdvisorResponse.error(ErrorKind.INTERNAL, "An unexpected error occurred", null);
    }
}
