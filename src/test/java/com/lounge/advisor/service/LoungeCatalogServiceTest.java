package com.lounge.advisor.service;

import com.lounge.advisor.exception.ServiceUnavailableException;
import com.lounge.advisor.model.dto.AirportLounges;
import com.lounge.advisor.model.entity.AccessProviderPolicy;
import com.lounge.advisor.model.entity.Lounge;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.mongo.MongoClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * TestCategory: Unit Test
 *
 * Comprehensive unit tests for LoungeCatalogService
 * Coverage: MongoDB reads of lounges and access providers, policy merge, cache
 * refresh, cache fallback, circuit breaker states
 * RequirementCategorized: Core Requirements (Lounge Catalog Gateway) & Bonus
 * Requirements (Circuit Breaking, Caching)
 */
/**
 * -[@ExtendWith](MockitoExtension.class): Integrates Mockito with JUnit 5.
 * --Initializes [@Mock] and [@InjectMocks] fields before each test
 * --WithoutIT: mocks would be null, causing NullPointerException in tests.
 */
/**
 * -[@MockitoSettings](strictness = Strictness.LENIENT): the circuit breaker and
 * cache stubs in setUp are shared by every test, including those that never
 * reach MongoDB
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class LoungeCatalogServiceTest {

    /**
     * -[@Mock]: MongoClient whose callback-style find() is answered by doAnswer
     * --WithoutIT: tests would need a running MongoDB.
     */
    @Mock
    private MongoClient mongoClient;

    @Mock
    private CacheManager cacheManager;

    @Mock
    private Cache cache;

    @Mock
    private CircuitBreakerRegistry circuitBreakerRegistry;

    @Mock
    private CircuitBreaker circuitBreaker;

    @InjectMocks
    private LoungeCatalogService loungeCatalogService;

    private List<JsonObject> jfkLounges;
    private List<JsonObject> providerPolicies;

    @BeforeEach
    void setUp() {
        when(circuitBreakerRegistry.circuitBreaker("loungeCatalogCB")).thenReturn(circuitBreaker);
        when(circuitBreaker.getName()).thenReturn("loungeCatalogCB");
        when(circuitBreaker.getState()).thenReturn(CircuitBreaker.State.CLOSED);
        when(circuitBreaker.tryAcquirePermission()).thenReturn(true);
        when(cacheManager.getCache("lounges")).thenReturn(cache);

        loungeCatalogService.init();

        jfkLounges = new ArrayList<>(List.of(
                new JsonObject()
                        .put("airport", "JFK")
                        .put("lounge_id", "jfk-centurion")
                        .put("name", "The Centurion Lounge")
                        .put("terminal", "4")
                        .put("access_providers", new JsonArray().add("Amex Platinum").add("Amex Centurion"))
                        .put("amenities", new JsonArray().add("Premium Bar").add("Shower Suites"))
                        .put("hours", "05:00-23:00")
                        .put("avg_wait_minutes", 12.0)
                        .put("crowd_level", "busy")
                        .put("rating", 5),
                new JsonObject()
                        .put("airport", "JFK")
                        .put("lounge_id", 1042)
                        .put("name", "Primeclass Lounge")
                        .put("terminal", 1)
                        .put("access_providers", new JsonArray().add("Priority Pass"))
                        .put("rating", 3.9)));

        providerPolicies = new ArrayList<>(List.of(
                new JsonObject()
                        .put("provider_name", "Amex Platinum")
                        .put("guest_policy", "2 guests free")
                        .put("conditions", "Same-day boarding pass required"),
                new JsonObject()
                        .put("provider_name", "Priority Pass")
                        .put("guest_policy", "Guests charged")
                        .put("notes", "Subject to capacity")));
    }

    /**
     * Input: airport "jfk" with two lounges and matching provider policies
     * ExpectedOut: AirportLounges for JFK with mapped fields and merged access
     * details; success recorded; cache refreshed
     */
    @Test
    void testGetLounges_Success() {
        // Given
        givenLounges(Future.succeededFuture(jfkLounges));
        givenProviders(Future.succeededFuture(providerPolicies));

        // When
        Future<AirportLounges> future = loungeCatalogService.getLounges("jfk");

        // Then
        assertTrue(future.succeeded());
        AirportLounges result = future.result();
        assertEquals("JFK", result.getAirport());
        assertFalse(result.isFromCache());
        assertEquals(2, result.getLounges().size());

        Lounge centurion = result.getLounges().get(0);
        assertEquals("jfk-centurion", centurion.getLoungeId());
        assertEquals("4", centurion.getTerminal());
        assertEquals(12, centurion.getAvgWaitMinutes());
        assertEquals(5.0, centurion.getRating());
        assertEquals(List.of("Premium Bar", "Shower Suites"), centurion.getAmenities());

        List<AccessProviderPolicy> details = centurion.getAccessDetails();
        assertEquals(2, details.size());
        assertEquals("2 guests free", details.get(0).getGuestPolicy());
        assertEquals("Amex Centurion", details.get(1).getProviderName());
        assertNull(details.get(1).getGuestPolicy());

        Lounge primeclass = result.getLounges().get(1);
        assertEquals("1042", primeclass.getLoungeId());
        assertEquals("1", primeclass.getTerminal());
        assertNull(primeclass.getAvgWaitMinutes());
        assertTrue(primeclass.getAmenities().isEmpty());
        assertEquals("Subject to capacity", primeclass.getAccessDetails().get(0).getNotes());

        verify(circuitBreaker).onSuccess(anyLong(), eq(TimeUnit.NANOSECONDS));
        verify(cache).put("JFK", result);
    }

    /**
     * Input: lounges found
     * ExpectedOut: one access_providers query with $in over the distinct providers
     */
    @Test
    void testGetLounges_ProviderQuery() {
        // Given
        givenLounges(Future.succeededFuture(jfkLounges));
        givenProviders(Future.succeededFuture(providerPolicies));
        ArgumentCaptor<JsonObject> query = ArgumentCaptor.forClass(JsonObject.class);

        // When
        loungeCatalogService.getLounges("JFK");

        // Then
        verify(mongoClient).find(eq("lounges"), eq(new JsonObject().put("airport", "JFK")), any());
        verify(mongoClient).find(eq("access_providers"), query.capture(), any());
        JsonArray in = query.getValue().getJsonObject("provider_name").getJsonArray("$in");
        assertEquals(new JsonArray().add("Amex Platinum").add("Amex Centurion").add("Priority Pass"), in);
    }

    /**
     * Input: airport without lounges
     * ExpectedOut: empty list (not an error), no provider query
     */
    @Test
    void testGetLounges_NoLounges() {
        givenLounges(Future.succeededFuture(new ArrayList<>()));

        Future<AirportLounges> future = loungeCatalogService.getLounges("BOS");

        assertTrue(future.succeeded());
        assertEquals("BOS", future.result().getAirport());
        assertTrue(future.result().getLounges().isEmpty());
        verify(mongoClient, never()).find(eq("access_providers"), any(JsonObject.class), any());
        verify(circuitBreaker).onSuccess(anyLong(), eq(TimeUnit.NANOSECONDS));
    }

    /**
     * Input: MongoDB failure, cached catalog for JFK available
     * ExpectedOut: cached catalog flagged fromCache with fallback messages; error
     * recorded on the circuit breaker
     */
    @Test
    void testGetLounges_MongoDbError_WithCache() {
        // Given
        AirportLounges cached = new AirportLounges();
        cached.setAirport("JFK");
        cached.setLounges(new ArrayList<>(List.of(new Lounge())));
        when(cache.get("JFK", AirportLounges.class)).thenReturn(cached);
        givenLounges(Future.failedFuture(new RuntimeException("Connection refused")));

        // When
        Future<AirportLounges> future = loungeCatalogService.getLounges("JFK");

        // Then
        assertTrue(future.succeeded());
        assertTrue(future.result().isFromCache());
        assertNotNull(future.result().getCacheTimestamp());
        assertEquals(2, future.result().getFallbackMsg().size());
        verify(circuitBreaker).onError(anyLong(), eq(TimeUnit.NANOSECONDS), any(RuntimeException.class));
    }

    /**
     * Input: MongoDB failure, nothing cached
     * ExpectedOut: ServiceUnavailableException
     */
    @Test
    void testGetLounges_MongoDbError_NoCache() {
        when(cache.get("JFK", AirportLounges.class)).thenReturn(null);
        givenLounges(Future.failedFuture(new RuntimeException("Connection refused")));

        Future<AirportLounges> future = loungeCatalogService.getLounges("JFK");

        assertTrue(future.failed());
        assertInstanceOf(ServiceUnavailableException.class, future.cause());
        assertEquals("Lounge catalog temporarily unavailable", future.cause().getMessage());
    }

    /**
     * Input: lounges read, access_providers query fails, nothing cached
     * ExpectedOut: treated as a catalog failure
     */
    @Test
    void testGetLounges_ProviderQueryError() {
        givenLounges(Future.succeededFuture(jfkLounges));
        givenProviders(Future.failedFuture(new RuntimeException("Socket timeout")));

        Future<AirportLounges> future = loungeCatalogService.getLounges("JFK");

        assertInstanceOf(ServiceUnavailableException.class, future.cause());
        verify(circuitBreaker).onError(anyLong(), eq(TimeUnit.NANOSECONDS), any(RuntimeException.class));
        verify(cache, never()).put(anyString(), any());
    }

    /**
     * Input: circuit breaker OPEN, cached catalog available
     * ExpectedOut: cached catalog, MongoDB never queried
     */
    @Test
    void testGetLounges_CircuitOpen_UsesCache() {
        // Given
        when(circuitBreaker.tryAcquirePermission()).thenReturn(false);
        when(circuitBreaker.getState()).thenReturn(CircuitBreaker.State.OPEN);
        AirportLounges cached = new AirportLounges();
        cached.setAirport("JFK");
        when(cache.get("JFK", AirportLounges.class)).thenReturn(cached);

        // When
        Future<AirportLounges> future = loungeCatalogService.getLounges("JFK");

        // Then
        assertTrue(future.succeeded());
        assertTrue(future.result().isFromCache());
        verify(mongoClient, never()).find(anyString(), any(JsonObject.class), any());
    }

    /**
     * Input: cache write fails
     * ExpectedOut: catalog still returned
     */
    @Test
    void testGetLounges_CacheWriteFailure_Ignored() {
        givenLounges(Future.succeededFuture(new ArrayList<>()));
        doThrow(new IllegalStateException("Redis down")).when(cache).put(anyString(), any());

        Future<AirportLounges> future = loungeCatalogService.getLounges("JFK");

        assertTrue(future.succeeded());
    }

    private void givenLounges(AsyncResult<List<JsonObject>> result) {
        answerFind("lounges", result);
    }

    private void givenProviders(AsyncResult<List<JsonObject>> result) {
        answerFind("access_providers", result);
    }

    private void answerFind(String collection, AsyncResult<List<JsonObject>> result) {
        doAnswer(invocation -> {
            Handler<AsyncResult<List<JsonObject>>> handler = invocation.getArgument(2);
            handler.handle(result);
            return null;
        }).when(mongoClient).find(eq(collection), any(JsonObject.class), any());
    }
}
