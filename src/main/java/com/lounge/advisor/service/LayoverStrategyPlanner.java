package com.lounge.advisor.service;

import com.lounge.advisor.exception.ProviderException;
import com.lounge.advisor.exception.ValidationException;
import com.lounge.advisor.model.dto.FlightLeg;
import com.lounge.advisor.model.dto.LayoverRecommendation;
import com.lounge.advisor.model.dto.LayoverStrategy;
import com.lounge.advisor.model.dto.Recommendation;
import com.lounge.advisor.model.dto.TimingWindow;
import com.lounge.advisor.model.dto.TravelerPreferences;
import com.lounge.advisor.model.entity.FlightEndpoint;
import com.lounge.advisor.model.entity.FlightIdentifier;
import com.lounge.advisor.model.entity.FlightStatus;
import com.lounge.advisor.model.entity.Lounge;
import com.lounge.advisor.util.DataTypeConverter;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;

/**
 * -@Service: turns a connecting itinerary into one lounge plan per connection
 * --Layover under 90 minutes: no_lounge, the catalog is not consulted
 * --90 to 179 minutes: quick_visit, same terminal as the next departure,
 * low-wait bias, top 3
 * --180 minutes and more: full_experience, standard scoring, top 5, visit capped
 * at 180 minutes
 * =========
 * All legs are looked up in parallel and all connections planned in parallel;
 * the result keeps itinerary order. A connection whose flights cannot be resolved
 * is left out; an authentication failure fails the whole plan.
 */
@Service
@Slf4j
public class LayoverStrategyPlanner {

    public static final int MAX_QUICK_VISIT_SUGGESTIONS = 3;
    static final int MAX_VISIT_MINUTES = 180;

    private static final BiConsumer<Lounge, RecommendationScorer.ScoreCard> LOW_WAIT_BIAS = (lounge, card) -> {
        Integer wait = lounge.getAvgWaitMinutes();
        if (wait == null) {
            return;
        }
        if (wait < 10) {
            card.add(10, "Quick entry suits a short connection");
        } else if (wait > 20) {
            card.add(-10, "Queue may eat into a short connection");
        }
    };

    @Autowired
    private FlightLookupService flightLookupService;

    @Autowired
    private LoungeCatalogGateway loungeCatalogGateway;

    @Autowired
    private RecommendationScorer recommendationScorer;

    public Future<List<LayoverStrategy>> plan(List<FlightLeg> legs, List<String> memberships,
            TravelerPreferences preferences) {
        if (legs == null || legs.isEmpty()) {
            return Future.failedFuture(new ValidationException("At least one flight leg is required"));
        }
        try {
            legs.forEach(LayoverStrategyPlanner::validateLeg);
        } catch (ValidationException e) {
            return Future.failedFuture(e);
        }
        if (legs.size() < 2) {
            log.info("Single-leg itinerary - no connections to plan");
            return Future.succeededFuture(new ArrayList<>());
        }

        log.info("Planning {} connection(s) for {} leg(s)", legs.size() - 1, legs.size());

        List<Future<Optional<FlightStatus>>> lookups = legs.stream()
                .map(this::resolveLeg)
                .collect(Collectors.toList());

        return Future.all(lookups)
                .compose(resolved -> {
                    List<Future<Optional<LayoverStrategy>>> connections = new ArrayList<>();
                    for (int i = 0; i < legs.size() - 1; i++) {
                        connections.add(planConnection(lookups.get(i).result(), lookups.get(i + 1).result(),
                                legs.get(i), legs.get(i + 1), memberships, preferences));
                    }
                    return Future.all(connections).map(done -> connections.stream()
                            .map(Future::result)
                            .filter(Optional::isPresent)
                            .map(Optional::get)
                            .collect(Collectors.toList()));
                })
                .onSuccess(strategies -> log.info("Layover plan ready: {} of {} connection(s) planned",
                        strategies.size(), legs.size() - 1));
    }

    private static void validateLeg(FlightLeg leg) {
        if (leg == null) {
            throw new ValidationException("Flight leg must not be null");
        }
        FlightIdentifier.parse(leg.getFlightNumber());
        DataTypeConverter.toDepartureDate(leg.getDate());
    }

    /**
     * Provider failures make the leg unresolved instead of failing the plan.
     */
    private Future<Optional<FlightStatus>> resolveLeg(FlightLeg leg) {
        return flightLookupService.lookup(leg.getFlightNumber(), leg.getDate(), leg.getOperationalSuffix())
                .recover(err -> {
                    if (err instanceof ProviderException) {
                        log.warn("Could not resolve leg {} on {}: {}", leg.getFlightNumber(), leg.getDate(),
                                err.getMessage());
                        return Future.succeededFuture(Optional.empty());
                    }
                    return Future.failedFuture(err);
                });
    }

    private Future<Optional<LayoverStrategy>> planConnection(Optional<FlightStatus> arriving,
            Optional<FlightStatus> departing, FlightLeg arrivingLeg, FlightLeg departingLeg,
            List<String> memberships, TravelerPreferences preferences) {
        if (arriving.isEmpty() || departing.isEmpty()) {
            log.warn("Skipping connection {} -> {}: flight not found", arrivingLeg.getFlightNumber(),
                    departingLeg.getFlightNumber());
            return Future.succeededFuture(Optional.empty());
        }

        FlightEndpoint arrival = arriving.get().getArrival();
        FlightEndpoint departure = departing.get().getDeparture();
        OffsetDateTime arrivalTime = arrival == null ? null : arrival.getEstimatedTime();
        OffsetDateTime departureTime = departure == null ? null : departure.getEstimatedTime();
        if (arrivalTime == null || departureTime == null) {
            log.warn("Skipping connection {} -> {}: missing arrival or departure time",
                    arriving.get().getDesignator(), departing.get().getDesignator());
            return Future.succeededFuture(Optional.empty());
        }

        long layoverMinutes = Duration.between(arrivalTime, departureTime).toMinutes();
        if (arrival.getAirport() != null && !arrival.getAirport().equalsIgnoreCase(departure.getAirport())) {
            log.warn("Connection {} -> {} changes airport: {} -> {}", arriving.get().getDesignator(),
                    departing.get().getDesignator(), arrival.getAirport(), departure.getAirport());
        }

        LayoverStrategy strategy = new LayoverStrategy();
        strategy.setConnectionAirport(departure.getAirport());
        strategy.setArrivalFlight(arriving.get().getDesignator());
        strategy.setDepartureFlight(departing.get().getDesignator());
        strategy.setLayoverMinutes(layoverMinutes);
        strategy.setRecommendation(LayoverRecommendation.classify(layoverMinutes));

        if (strategy.getRecommendation() == LayoverRecommendation.NO_LOUNGE) {
            strategy.setAdvice(layoverMinutes < 0
                    ? "Next departure leaves before this flight arrives - check the itinerary for a misconnection"
                    : "Only " + layoverMinutes + " minutes to connect - head straight to your next gate");
            return Future.succeededFuture(Optional.of(strategy));
        }

        return loungeCatalogGateway.getLounges(departure.getAirport())
                .map(airportLounges -> {
                    if (strategy.getRecommendation() == LayoverRecommendation.QUICK_VISIT) {
                        fillQuickVisit(strategy, airportLounges.getLounges(), departure, memberships, preferences);
                    } else {
                        fillFullExperience(strategy, airportLounges.getLounges(), departure, memberships,
                                preferences);
                    }
                    return Optional.of(strategy);
                })
                .recover(err -> {
                    log.warn("Lounge catalog unavailable for connection at {}: {}", departure.getAirport(),
                            err.getMessage());
                    strategy.setAdvice("Lounge information for " + departure.getAirport()
                            + " is currently unavailable - you have " + layoverMinutes + " minutes to connect");
                    return Future.succeededFuture(Optional.of(strategy));
                });
    }

    private void fillQuickVisit(LayoverStrategy strategy, List<Lounge> lounges, FlightEndpoint departure,
            List<String> memberships, TravelerPreferences preferences) {
        String terminal = departure.getTerminal();
        List<Lounge> candidates = terminal == null || terminal.isBlank()
                ? lounges
                : lounges.stream()
                        .filter(l -> l.getTerminal() != null && l.getTerminal().trim().equalsIgnoreCase(terminal.trim()))
                        .collect(Collectors.toList());

        int visitMinutes = (int) (strategy.getLayoverMinutes() - RecommendationScorer.GATE_BUFFER_MINUTES);
        TimingWindow timing = RecommendationScorer.timingBefore(departure.getEstimatedTime(), visitMinutes);

        List<Recommendation> suggestions = recommendationScorer.rank(candidates, memberships, preferences, terminal,
                timing, LOW_WAIT_BIAS, MAX_QUICK_VISIT_SUGGESTIONS);
        strategy.setSuggestedLounges(suggestions);
        strategy.setAdvice(suggestions.isEmpty()
                ? "No accessible lounge near your next gate" + (terminal == null ? "" : " in terminal " + terminal)
                : "Time for a quick visit of up to " + visitMinutes + " minutes near your next gate");
    }

    private void fillFullExperience(LayoverStrategy strategy, List<Lounge> lounges, FlightEndpoint departure,
            List<String> memberships, TravelerPreferences preferences) {
        int visitMinutes = (int) Math.min(strategy.getLayoverMinutes() - RecommendationScorer.GATE_BUFFER_MINUTES,
                MAX_VISIT_MINUTES);
        TimingWindow timing = new TimingWindow(null, null, visitMinutes);

        List<Recommendation> suggestions = recommendationScorer.rank(lounges, memberships, preferences,
                departure.getTerminal(), timing, null, RecommendationScorer.MAX_RECOMMENDATIONS);
        strategy.setSuggestedLounges(suggestions);
        strategy.setAdvice(suggestions.isEmpty()
                ? "No accessible lounge at " + departure.getAirport()
                : "Plenty of time - enjoy up to " + visitMinutes + " minutes in the lounge");
    }
}
