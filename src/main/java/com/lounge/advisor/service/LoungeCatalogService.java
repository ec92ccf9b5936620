package com.lounge.advisor.service;

import com.lounge.advisor.config.CacheConfig;
import com.lounge.advisor.exception.ServiceUnavailableException;
import com.lounge.advisor.model.dto.AirportLounges;
import com.lounge.advisor.model.entity.AccessProviderPolicy;
import com.lounge.advisor.model.entity.Lounge;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.mongo.MongoClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * -@Service: MongoDB-backed lounge catalog
 * --Reads the "lounges" collection by airport and merges the matching
 * "access_providers" policies onto each lounge as accessDetails
 * --WithoutIT: no lounge can be recommended.
 * =========
 * Circuit breaker "loungeCatalogCB" with the Redis "lounges" cache as fallback.
 * Every successful read refreshes the cache entry for the airport.
 */
@Service
@Slf4j
public class LoungeCatalogService implements LoungeCatalogGateway {

    static final String LOUNGES_COLLECTION = "lounges";
    static final String PROVIDERS_COLLECTION = "access_providers";

    @Autowired
    private MongoClient mongoClient;

    @Autowired
    private CacheManager cacheManager;

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    private CircuitBreaker circuitBreaker;

    @jakarta.annotation.PostConstruct
    public void init() {
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("loungeCatalogCB");
        log.info("LoungeCatalogService Circuit Breaker initialized: {}", circuitBreaker.getName());
    }

    @Override
    public Future<AirportLounges> getLounges(String airport) {
        String code = airport.trim().toUpperCase(Locale.ROOT);
        log.info("[CB-BEFORE] Lounge catalog lookup for airport: {} | State: {}", code, circuitBreaker.getState());

        if (!circuitBreaker.tryAcquirePermission()) {
            log.warn("[CB-REJECTED] Circuit is OPEN - calling fallback for airport: {}", code);
            return getLoungesFallback(code, new Exception("Circuit breaker is OPEN"));
        }

        long start = System.nanoTime();
        Promise<AirportLounges> promise = Promise.promise();

        JsonObject query = new JsonObject().put("airport", code);
        mongoClient.find(LOUNGES_COLLECTION, query, ar -> onLoungesResult(ar, code, start, promise));

        return promise.future();
    }

    private void onLoungesResult(AsyncResult<List<JsonObject>> ar, String airport, long start,
            Promise<AirportLounges> promise) {
        if (ar.failed()) {
            onCatalogError(ar.cause(), airport, start, promise);
            return;
        }

        List<Lounge> lounges = new ArrayList<>();
        for (JsonObject doc : ar.result()) {
            lounges.add(mapToLounge(doc));
        }

        if (lounges.isEmpty()) {
            log.info("No lounges found at airport: {}", airport);
            circuitBreaker.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS);
            promise.complete(cacheAndWrap(airport, lounges));
            return;
        }

        Set<String> providerNames = new LinkedHashSet<>();
        lounges.forEach(l -> providerNames.addAll(l.getAccessProviders()));

        JsonObject providerQuery = new JsonObject()
                .put("provider_name", new JsonObject().put("$in", new JsonArray(new ArrayList<>(providerNames))));

        mongoClient.find(PROVIDERS_COLLECTION, providerQuery, providersAr -> {
            if (providersAr.failed()) {
                onCatalogError(providersAr.cause(), airport, start, promise);
                return;
            }

            Map<String, JsonObject> policies = new HashMap<>();
            for (JsonObject doc : providersAr.result()) {
                policies.put(doc.getString("provider_name"), doc);
            }
            lounges.forEach(l -> l.setAccessDetails(mergePolicies(l.getAccessProviders(), policies)));

            circuitBreaker.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS);
            log.info("Loaded {} lounge(s) for airport: {}", lounges.size(), airport);
            promise.complete(cacheAndWrap(airport, lounges));
        });
    }

    private void onCatalogError(Throwable cause, String airport, long start, Promise<AirportLounges> promise) {
        log.error("MongoDB error loading lounges for airport: {}", airport, cause);
        circuitBreaker.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, cause);

        getLoungesFallback(airport, new Exception(cause)).onComplete(fallbackResult -> {
            if (fallbackResult.succeeded()) {
                promise.complete(fallbackResult.result());
            } else {
                promise.fail(fallbackResult.cause());
            }
        });
    }

    private AirportLounges cacheAndWrap(String airport, List<Lounge> lounges) {
        AirportLounges result = new AirportLounges();
        result.setAirport(airport);
        result.setLounges(lounges);
        result.setFromCache(false);

        Cache cache = cacheManager.getCache(CacheConfig.LOUNGES_CACHE);
        if (cache != null) {
            try {
                cache.put(airport, result);
                log.debug("Cached lounges for airport: {}", airport);
            } catch (RuntimeException e) {
                log.warn("Could not cache lounges for airport {}: {}", airport, e.getMessage());
            }
        }
        return result;
    }

    /**
     * Fallback used when MongoDB fails or the circuit is OPEN.
     * Returns the last cached catalog for the airport, otherwise fails with
     * ServiceUnavailableException.
     */
    private Future<AirportLounges> getLoungesFallback(String airport, Exception ex) {
        log.warn("Lounge catalog unavailable - using fallback for airport: {}. Reason: {}", airport, ex.getMessage());

        Cache cache = cacheManager.getCache(CacheConfig.LOUNGES_CACHE);
        if (cache != null) {
            AirportLounges cached;
            try {
                cached = cache.get(airport, AirportLounges.class);
            } catch (RuntimeException e) {
                log.warn("Lounge cache read failed for airport {}: {}", airport, e.getMessage());
                cached = null;
            }

            if (cached != null) {
                log.info("Returning cached lounges for airport: {}", airport);
                Instant cacheTime = Instant.now();
                cached.setFromCache(true);
                cached.setCacheTimestamp(cacheTime);
                cached.setFallbackMsg(List.of(
                        "Lounge data from cache - catalog unavailable",
                        "Cache timestamp: " + cacheTime));
                return Future.succeededFuture(cached);
            }
        }

        log.error("No cached lounges available for airport: {}", airport);
        return Future.failedFuture(new ServiceUnavailableException("Lounge catalog temporarily unavailable"));
    }

    private Lounge mapToLounge(JsonObject doc) {
        Lounge lounge = new Lounge();
        lounge.setAirport(doc.getString("airport"));
        lounge.setLoungeId(text(doc.getValue("lounge_id")));
        lounge.setName(doc.getString("name"));
        lounge.setTerminal(text(doc.getValue("terminal")));
        lounge.setAccessProviders(strings(doc.getValue("access_providers")));
        lounge.setAmenities(strings(doc.getValue("amenities")));
        lounge.setHours(text(doc.getValue("hours")));
        lounge.setCrowdLevel(text(doc.getValue("crowd_level")));

        Object wait = doc.getValue("avg_wait_minutes");
        lounge.setAvgWaitMinutes(wait instanceof Number ? ((Number) wait).intValue() : null);
        Object rating = doc.getValue("rating");
        lounge.setRating(rating instanceof Number ? ((Number) rating).doubleValue() : null);
        return lounge;
    }

    private List<AccessProviderPolicy> mergePolicies(List<String> providers, Map<String, JsonObject> policies) {
        List<AccessProviderPolicy> details = new ArrayList<>();
        for (String provider : providers) {
            JsonObject rule = policies.getOrDefault(provider, new JsonObject());
            details.add(new AccessProviderPolicy(
                    provider,
                    text(rule.getValue("guest_policy")),
                    text(rule.getValue("conditions")),
                    text(rule.getValue("notes"))));
        }
        return details;
    }

    private static List<String> strings(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof JsonArray) {
            for (Object item : (JsonArray) value) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        }
        return result;
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
