package com.lounge.advisor.service;

import com.lounge.advisor.exception.AuthenticationException;
import com.lounge.advisor.exception.ProviderException;
import com.lounge.advisor.exception.ServiceUnavailableException;
import com.lounge.advisor.exception.ValidationException;
import com.lounge.advisor.model.dto.AirportLounges;
import com.lounge.advisor.model.dto.FlightLeg;
import com.lounge.advisor.model.dto.LayoverRecommendation;
import com.lounge.advisor.model.dto.LayoverStrategy;
import com.lounge.advisor.model.dto.Recommendation;
import com.lounge.advisor.model.entity.FlightEndpoint;
import com.lounge.advisor.model.entity.FlightIdentifier;
import com.lounge.advisor.model.entity.FlightStatus;
import com.lounge.advisor.model.entity.Lounge;
import io.vertx.core.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * TestCategory: Unit Test
 *
 * Comprehensive unit tests for LayoverStrategyPlanner
 * Coverage: layover buckets and their boundaries, catalog avoidance for short
 * connections, quick-visit terminal filter and top-3 bound, full-experience
 * duration cap, leg-by-leg degradation, itinerary order
 * RequirementCategorized: Core Requirements (Layover Strategy Planner)
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class LayoverStrategyPlannerTest {

    private static final String DATE = "2025-12-25";
    private static final OffsetDateTime ARRIVAL = OffsetDateTime.of(2025, 12, 25, 10, 0, 0, 0, ZoneOffset.UTC);
    private static final List<String> MEMBERSHIPS = List.of("Priority Pass");

    @Mock
    private FlightLookupService flightLookupService;

    @Mock
    private LoungeCatalogGateway loungeCatalogGateway;

    /**
     * -[@Spy]: real scorer; its matcher is wired in setUp because [@InjectMocks]
     * only fills the class under test
     */
    @Spy
    private RecommendationScorer recommendationScorer = new RecommendationScorer();

    @InjectMocks
    private LayoverStrategyPlanner planner;

    private final FlightLeg inbound = new FlightLeg("AA100", DATE);
    private final FlightLeg outbound = new FlightLeg("AA200", DATE);

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(recommendationScorer, "accessCompatibilityMatcher",
                new AccessCompatibilityMatcher());

        when(loungeCatalogGateway.getLounges("ORD")).thenReturn(Future.succeededFuture(catalog(
                lounge("B Club", "B", 4.6, 5),
                lounge("B Lounge", "B", 4.1, 25),
                lounge("B Suite", "B", 3.5, 12),
                lounge("B Corner", "B", null, null),
                lounge("C Admirals", "C", 4.8, 5),
                lounge("C Centurion", "C", 4.7, 30))));
    }

    /**
     * Input: arrival 10:00, next departure 11:20 (80 minutes)
     * ExpectedOut: no_lounge, no catalog lookup at all
     */
    @Test
    void testPlan_ShortConnection_NoCatalogLookup() {
        // Given
        givenConnection(80, "B");

        // When
        Future<List<LayoverStrategy>> future = planner.plan(List.of(inbound, outbound), MEMBERSHIPS, null);

        // Then
        assertTrue(future.succeeded());
        LayoverStrategy strategy = future.result().get(0);
        assertEquals(LayoverRecommendation.NO_LOUNGE, strategy.getRecommendation());
        assertEquals(80, strategy.getLayoverMinutes());
        assertTrue(strategy.getSuggestedLounges().isEmpty());
        assertTrue(strategy.getAdvice().contains("80 minutes"));
        verify(loungeCatalogGateway, never()).getLounges(anyString());
    }

    /**
     * Input: layovers of 89, 90, 179 and 180 minutes
     * ExpectedOut: no_lounge, quick_visit, quick_visit, full_experience
     */
    @Test
    void testPlan_BucketBoundaries() {
        assertEquals(LayoverRecommendation.NO_LOUNGE, planSingleConnection(89).getRecommendation());
        assertEquals(LayoverRecommendation.QUICK_VISIT, planSingleConnection(90).getRecommendation());
        assertEquals(LayoverRecommendation.QUICK_VISIT, planSingleConnection(179).getRecommendation());
        assertEquals(LayoverRecommendation.FULL_EXPERIENCE, planSingleConnection(180).getRecommendation());
    }

    /**
     * Input: 120-minute connection, next departure from terminal B; four accessible
     * lounges in B and two in C
     * ExpectedOut: quick_visit with at most 3 lounges, all in B; 60-minute visit
     * ending one hour before departure; low-wait bias applied
     */
    @Test
    void testPlan_QuickVisit_SameTerminalTopThree() {
        // Given
        givenConnection(120, "B");

        // When
        LayoverStrategy strategy = planner.plan(List.of(inbound, outbound), MEMBERSHIPS, null).result().get(0);

        // Then
        assertEquals(LayoverRecommendation.QUICK_VISIT, strategy.getRecommendation());
        List<Recommendation> lounges = strategy.getSuggestedLounges();
        assertEquals(LayoverStrategyPlanner.MAX_QUICK_VISIT_SUGGESTIONS, lounges.size());
        lounges.forEach(r -> assertEquals("B", r.getLounge().getTerminal()));

        Recommendation best = lounges.get(0);
        assertEquals("B Club", best.getLounge().getName());
        // terminal 50 + short wait 15 + excellent rating 20 + quick entry 10
        assertEquals(95, best.getScore());
        assertTrue(best.getReasons().contains("Quick entry suits a short connection"));
        assertEquals(60, best.getTiming().getRecommendedDurationMinutes());
        assertEquals(ARRIVAL.plusMinutes(120).minusMinutes(60), best.getTiming().getLatestExit());
        assertTrue(strategy.getAdvice().contains("60 minutes"));
    }

    /**
     * Input: 120-minute connection departing from terminal D, where no lounge is
     * ExpectedOut: quick_visit with no suggestions and advice naming the terminal
     */
    @Test
    void testPlan_QuickVisit_NoLoungeInTerminal() {
        givenConnection(120, "D");

        LayoverStrategy strategy = planner.plan(List.of(inbound, outbound), MEMBERSHIPS, null).result().get(0);

        assertTrue(strategy.getSuggestedLounges().isEmpty());
        assertEquals("No accessible lounge near your next gate in terminal D", strategy.getAdvice());
    }

    /**
     * Input: 300-minute connection
     * ExpectedOut: full_experience, up to 5 lounges from every terminal, duration
     * capped at 180 minutes, no entry/exit times
     */
    @Test
    void testPlan_FullExperience_DurationCapped() {
        // Given
        givenConnection(300, "B");

        // When
        LayoverStrategy strategy = planner.plan(List.of(inbound, outbound), MEMBERSHIPS, null).result().get(0);

        // Then
        assertEquals(LayoverRecommendation.FULL_EXPERIENCE, strategy.getRecommendation());
        assertEquals(5, strategy.getSuggestedLounges().size());
        assertTrue(strategy.getSuggestedLounges().stream().anyMatch(r -> "C".equals(r.getLounge().getTerminal())));
        strategy.getSuggestedLounges().forEach(r -> {
            assertEquals(180, r.getTiming().getRecommendedDurationMinutes());
            assertNull(r.getTiming().getLatestEntry());
            assertNull(r.getTiming().getLatestExit());
        });
    }

    /**
     * Input: 200-minute connection
     * ExpectedOut: recommended duration 200 - 60 = 140 minutes
     */
    @Test
    void testPlan_FullExperience_DurationFromLayover() {
        givenConnection(200, "B");

        LayoverStrategy strategy = planner.plan(List.of(inbound, outbound), MEMBERSHIPS, null).result().get(0);

        assertEquals(140, strategy.getSuggestedLounges().get(0).getTiming().getRecommendedDurationMinutes());
    }

    /**
     * Input: three legs; the third cannot be resolved (provider error)
     * ExpectedOut: only the first connection is returned; no failure
     */
    @Test
    void testPlan_UnresolvedLegSkipsConnection() {
        // Given
        FlightLeg third = new FlightLeg("AA300", DATE);
        givenConnection(120, "B");
        when(flightLookupService.lookup("AA300", DATE, null))
                .thenReturn(Future.failedFuture(new ProviderException(500, "Flight data provider error")));

        // When
        Future<List<LayoverStrategy>> future = planner.plan(List.of(inbound, outbound, third), MEMBERSHIPS, null);

        // Then
        assertTrue(future.succeeded());
        assertEquals(1, future.result().size());
        assertEquals("AA100", future.result().get(0).getArrivalFlight());
    }

    /**
     * Input: three legs; the first comes back as a malformed provider payload
     * (ProviderException without status, data not an array)
     * ExpectedOut: that connection is skipped, the second one is still planned
     */
    @Test
    void testPlan_MalformedPayloadLegSkipsConnection() {
        // Given
        OffsetDateTime secondArrival = ARRIVAL.plusMinutes(100).plusHours(2);
        when(flightLookupService.lookup("AA100", DATE, null)).thenReturn(Future.failedFuture(
                new ProviderException(null, "Flight schedule payload has no data array")));
        when(flightLookupService.lookup("AA200", DATE, null)).thenReturn(Future.succeededFuture(Optional.of(
                flight("AA200", "ORD", "B", ARRIVAL.plusMinutes(100), "DFW", secondArrival))));
        when(flightLookupService.lookup("AA300", DATE, null)).thenReturn(Future.succeededFuture(Optional.of(
                flight("AA300", "DFW", "D", secondArrival.plusMinutes(240), "LHR", secondArrival.plusHours(13)))));
        when(loungeCatalogGateway.getLounges("DFW")).thenReturn(Future.succeededFuture(catalog(
                lounge("D Club", "D", 4.5, 5))));

        // When
        Future<List<LayoverStrategy>> future = planner.plan(
                List.of(inbound, outbound, new FlightLeg("AA300", DATE)), MEMBERSHIPS, null);

        // Then
        assertTrue(future.succeeded());
        assertEquals(1, future.result().size());
        assertEquals("DFW", future.result().get(0).getConnectionAirport());
        assertEquals("AA200", future.result().get(0).getArrivalFlight());
        verify(loungeCatalogGateway, never()).getLounges("ORD");
    }

    /**
     * Input: second leg not found
     * ExpectedOut: empty plan, no failure
     */
    @Test
    void testPlan_LegNotFound() {
        when(flightLookupService.lookup("AA100", DATE, null))
                .thenReturn(Future.succeededFuture(Optional.of(flight("AA100", "JFK", null, ARRIVAL.minusHours(3),
                        "ORD", ARRIVAL))));
        when(flightLookupService.lookup("AA200", DATE, null)).thenReturn(Future.succeededFuture(Optional.empty()));

        Future<List<LayoverStrategy>> future = planner.plan(List.of(inbound, outbound), MEMBERSHIPS, null);

        assertTrue(future.succeeded());
        assertTrue(future.result().isEmpty());
    }

    /**
     * Input: three legs with connections of 100 and 240 minutes
     * ExpectedOut: two strategies in itinerary order
     */
    @Test
    void testPlan_ItineraryOrderPreserved() {
        // Given
        OffsetDateTime secondArrival = ARRIVAL.plusMinutes(100).plusHours(2);
        when(flightLookupService.lookup("AA100", DATE, null)).thenReturn(Future.succeededFuture(Optional.of(
                flight("AA100", "JFK", "8", ARRIVAL.minusHours(3), "ORD", ARRIVAL))));
        when(flightLookupService.lookup("AA200", DATE, null)).thenReturn(Future.succeededFuture(Optional.of(
                flight("AA200", "ORD", "B", ARRIVAL.plusMinutes(100), "DFW", secondArrival))));
        when(flightLookupService.lookup("AA300", DATE, null)).thenReturn(Future.succeededFuture(Optional.of(
                flight("AA300", "DFW", "D", secondArrival.plusMinutes(240), "LHR", secondArrival.plusHours(13)))));
        when(loungeCatalogGateway.getLounges("DFW")).thenReturn(Future.succeededFuture(catalog(
                lounge("D Club", "D", 4.5, 5))));

        // When
        List<LayoverStrategy> strategies = planner.plan(
                List.of(inbound, outbound, new FlightLeg("AA300", DATE)), MEMBERSHIPS, null).result();

        // Then
        assertEquals(2, strategies.size());
        assertEquals("ORD", strategies.get(0).getConnectionAirport());
        assertEquals(LayoverRecommendation.QUICK_VISIT, strategies.get(0).getRecommendation());
        assertEquals("DFW", strategies.get(1).getConnectionAirport());
        assertEquals(LayoverRecommendation.FULL_EXPERIENCE, strategies.get(1).getRecommendation());
        assertEquals("AA200", strategies.get(1).getArrivalFlight());
        assertEquals("AA300", strategies.get(1).getDepartureFlight());
    }

    /**
     * Input: lounge catalog unavailable for a 150-minute connection
     * ExpectedOut: strategy still returned, with advice explaining the outage
     */
    @Test
    void testPlan_CatalogUnavailable_Degrades() {
        givenConnection(150, "B");
        when(loungeCatalogGateway.getLounges("ORD"))
                .thenReturn(Future.failedFuture(new ServiceUnavailableException("Lounge catalog temporarily unavailable")));

        Future<List<LayoverStrategy>> future = planner.plan(List.of(inbound, outbound), MEMBERSHIPS, null);

        assertTrue(future.succeeded());
        LayoverStrategy strategy = future.result().get(0);
        assertEquals(LayoverRecommendation.QUICK_VISIT, strategy.getRecommendation());
        assertTrue(strategy.getSuggestedLounges().isEmpty());
        assertTrue(strategy.getAdvice().contains("currently unavailable"));
    }

    /**
     * Input: next flight leaves 30 minutes before the inbound lands
     * ExpectedOut: no_lounge with misconnection advice
     */
    @Test
    void testPlan_NegativeLayover() {
        givenConnection(-30, "B");

        LayoverStrategy strategy = planner.plan(List.of(inbound, outbound), MEMBERSHIPS, null).result().get(0);

        assertEquals(LayoverRecommendation.NO_LOUNGE, strategy.getRecommendation());
        assertEquals(-30, strategy.getLayoverMinutes());
        assertTrue(strategy.getAdvice().contains("misconnection"));
    }

    /**
     * Input: token failure while resolving a leg
     * ExpectedOut: the whole plan fails with AuthenticationException
     */
    @Test
    void testPlan_AuthFailurePropagates() {
        givenConnection(120, "B");
        when(flightLookupService.lookup("AA200", DATE, null))
                .thenReturn(Future.failedFuture(new AuthenticationException("Token request rejected (401)")));

        Future<List<LayoverStrategy>> future = planner.plan(List.of(inbound, outbound), MEMBERSHIPS, null);

        assertTrue(future.failed());
        assertInstanceOf(AuthenticationException.class, future.cause());
    }

    /**
     * Input: null legs, empty legs, an invalid leg
     * ExpectedOut: ValidationException, no lookups
     */
    @Test
    void testPlan_InvalidItinerary() {
        assertInstanceOf(ValidationException.class, planner.plan(null, MEMBERSHIPS, null).cause());
        assertInstanceOf(ValidationException.class, planner.plan(List.of(), MEMBERSHIPS, null).cause());
        assertInstanceOf(ValidationException.class,
                planner.plan(List.of(inbound, new FlightLeg("A1", DATE)), MEMBERSHIPS, null).cause());
        assertInstanceOf(ValidationException.class,
                planner.plan(List.of(inbound, new FlightLeg("AA200", "25-12-2025")), MEMBERSHIPS, null).cause());
        verify(flightLookupService, never()).lookup(anyString(), anyString(), any());
    }

    /**
     * Input: a single leg
     * ExpectedOut: empty list, nothing looked up
     */
    @Test
    void testPlan_SingleLeg() {
        Future<List<LayoverStrategy>> future = planner.plan(List.of(inbound), MEMBERSHIPS, null);

        assertTrue(future.succeeded());
        assertTrue(future.result().isEmpty());
        verify(flightLookupService, never()).lookup(anyString(), anyString(), any());
    }

    private LayoverStrategy planSingleConnection(int layoverMinutes) {
        givenConnection(layoverMinutes, "B");
        return planner.plan(List.of(inbound, outbound), MEMBERSHIPS, null).result().get(0);
    }

    private void givenConnection(int layoverMinutes, String departureTerminal) {
        when(flightLookupService.lookup("AA100", DATE, null)).thenReturn(Future.succeededFuture(Optional.of(
                flight("AA100", "JFK", "8", ARRIVAL.minusHours(3), "ORD", ARRIVAL))));
        when(flightLookupService.lookup("AA200", DATE, null)).thenReturn(Future.succeededFuture(Optional.of(
                flight("AA200", "ORD", departureTerminal, ARRIVAL.plusMinutes(layoverMinutes), "SFO",
                        ARRIVAL.plusMinutes(layoverMinutes).plusHours(4)))));
    }

    private static FlightStatus flight(String designator, String from, String terminal, OffsetDateTime departs,
            String to, OffsetDateTime arrives) {
        FlightIdentifier id = FlightIdentifier.parse(designator);
        return FlightStatus.builder()
                .carrierCode(id.getCarrierCode())
                .flightNumber(id.getFlightNumber())
                .date(LocalDate.of(2025, 12, 25))
                .departure(FlightEndpoint.builder().airport(from).terminal(terminal)
                        .scheduledTime(departs).estimatedTime(departs).actualTime(departs).build())
                .arrival(FlightEndpoint.builder().airport(to)
                        .scheduledTime(arrives).estimatedTime(arrives).actualTime(arrives).build())
                .build();
    }

    private static AirportLounges catalog(Lounge... lounges) {
        AirportLounges airportLounges = new AirportLounges();
        airportLounges.setAirport(lounges[0].getAirport());
        airportLounges.setLounges(new ArrayList<>(List.of(lounges)));
        return airportLounges;
    }

    private static Lounge lounge(String name, String terminal, Double rating, Integer waitMinutes) {
        Lounge lounge = new Lounge();
        lounge.setAirport(name.startsWith("D ") ? "DFW" : "ORD");
        lounge.setName(name);
        lounge.setTerminal(terminal);
        lounge.setAccessProviders(List.of("Priority Pass"));
        lounge.setAmenities(List.of());
        lounge.setRating(rating);
        lounge.setAvgWaitMinutes(waitMinutes);
        return lounge;
    }
}
