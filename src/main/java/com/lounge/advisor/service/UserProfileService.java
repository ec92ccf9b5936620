package com.lounge.advisor.service;

import com.lounge.advisor.config.CacheConfig;
import com.lounge.advisor.exception.ServiceUnavailableException;
import com.lounge.advisor.model.entity.UserProfile;
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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * -@Service: MongoDB-backed traveler profiles ("user_profiles" collection)
 * --Circuit breaker "userProfileCB", Redis "users" cache as fallback
 * --A missing profile is an empty Optional, never an error
 */
@Service
@Slf4j
public class UserProfileService implements UserProfileGateway {

    static final String USERS_COLLECTION = "user_profiles";

    @Autowired
    private MongoClient mongoClient;

    @Autowired
    private CacheManager cacheManager;

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    private CircuitBreaker circuitBreaker;

    @jakarta.annotation.PostConstruct
    public void init() {
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("userProfileCB");
        log.info("UserProfileService Circuit Breaker initialized: {}", circuitBreaker.getName());
    }

    @Override
    public Future<Optional<UserProfile>> getUser(String userId) {
        log.info("[CB-BEFORE] User profile lookup for user: {} | State: {}", userId, circuitBreaker.getState());

        if (!circuitBreaker.tryAcquirePermission()) {
            log.warn("[CB-REJECTED] Circuit is OPEN - calling fallback for user: {}", userId);
            return getUserFallback(userId, new Exception("Circuit breaker is OPEN"));
        }

        long start = System.nanoTime();
        Promise<Optional<UserProfile>> promise = Promise.promise();

        JsonObject query = new JsonObject().put("user_id", userId);
        mongoClient.findOne(USERS_COLLECTION, query, null, ar -> onUserResult(ar, userId, start, promise));

        return promise.future();
    }

    private void onUserResult(AsyncResult<JsonObject> ar, String userId, long start,
            Promise<Optional<UserProfile>> promise) {
        long duration = System.nanoTime() - start;

        if (ar.failed()) {
            log.error("MongoDB error fetching user profile: {}", userId, ar.cause());
            circuitBreaker.onError(duration, TimeUnit.NANOSECONDS, ar.cause());
            getUserFallback(userId, new Exception(ar.cause())).onComplete(fallbackResult -> {
                if (fallbackResult.succeeded()) {
                    promise.complete(fallbackResult.result());
                } else {
                    promise.fail(fallbackResult.cause());
                }
            });
            return;
        }

        circuitBreaker.onSuccess(duration, TimeUnit.NANOSECONDS);

        if (ar.result() == null) {
            log.info("User profile not found: {}", userId);
            promise.complete(Optional.empty());
            return;
        }

        UserProfile profile = mapToUser(ar.result());
        Cache cache = cacheManager.getCache(CacheConfig.USERS_CACHE);
        if (cache != null) {
            try {
                cache.put(userId, profile);
            } catch (RuntimeException e) {
                log.warn("Could not cache user profile {}: {}", userId, e.getMessage());
            }
        }
        log.info("User profile fetched: {}", userId);
        promise.complete(Optional.of(profile));
    }

    private Future<Optional<UserProfile>> getUserFallback(String userId, Exception ex) {
        log.warn("User profile store unavailable - using fallback for user: {}. Reason: {}", userId, ex.getMessage());

        Cache cache = cacheManager.getCache(CacheConfig.USERS_CACHE);
        if (cache != null) {
            UserProfile cached;
            try {
                cached = cache.get(userId, UserProfile.class);
            } catch (RuntimeException e) {
                log.warn("User cache read failed for {}: {}", userId, e.getMessage());
                cached = null;
            }
            if (cached != null) {
                log.info("Returning cached user profile: {}", userId);
                return Future.succeededFuture(Optional.of(cached));
            }
        }

        log.error("No cached user profile available: {}", userId);
        return Future.failedFuture(new ServiceUnavailableException("User profile service temporarily unavailable"));
    }

    private UserProfile mapToUser(JsonObject doc) {
        UserProfile profile = new UserProfile();
        profile.setUserId(doc.getString("user_id"));
        profile.setName(doc.getString("name"));
        profile.setHomeAirport(doc.getString("home_airport"));

        List<String> memberships = new ArrayList<>();
        JsonArray raw = doc.getJsonArray("memberships");
        if (raw != null) {
            for (Object item : raw) {
                if (item != null) {
                    memberships.add(item.toString());
                }
            }
        }
        profile.setMemberships(memberships);
        return profile;
    }
}
