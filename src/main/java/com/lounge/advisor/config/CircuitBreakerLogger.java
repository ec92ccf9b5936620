package com.lounge.advisor.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.circuitbreaker.event.CircuitBreakerEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.HashSet;
import java.util.Set;

/**
 * -@Component: logs the lifecycle of every downstream circuit breaker
 * (flightProviderCB, loungeCatalogCB, userProfileCB)
 * --Attaches listeners to breakers that already exist and to any breaker the
 * registry creates later
 * --WithoutIT: state transitions would only be visible through the health
 * endpoint.
 */
@Component
@Slf4j
public class CircuitBreakerLogger {

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    private final Set<String> registered = new HashSet<>();

    @PostConstruct
    public void registerEventListeners() {
        circuitBreakerRegistry.getAllCircuitBreakers().forEach(this::registerListeners);
        circuitBreakerRegistry.getEventPublisher()
                .onEntryAdded(event -> registerListeners(event.getAddedEntry()));
    }

    synchronized void registerListeners(CircuitBreaker circuitBreaker) {
        String cbName = circuitBreaker.getName();
        if (!registered.add(cbName)) {
            return;
        }

        circuitBreaker.getEventPublisher().onSuccess(event -> logOutcome(circuitBreaker, event, "SUCCESS"));

        circuitBreaker.getEventPublisher().onError(event -> {
            logOutcome(circuitBreaker, event, "ERROR");
            log.debug("[{}] Recorded error: {}", cbName, event.getThrowable().toString());
        });

        circuitBreaker.getEventPublisher().onStateTransition(event -> {
            log.warn("[{}] STATE TRANSITION: {} -> {}",
                    cbName,
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState());
            logDetailedMetrics(circuitBreaker);
        });

        circuitBreaker.getEventPublisher().onCallNotPermitted(event ->
                log.warn("[{}] CALL REJECTED - Circuit is {}", cbName, circuitBreaker.getState()));

        log.info("Circuit breaker event logging enabled for {}", cbName);
    }

    private void logOutcome(CircuitBreaker circuitBreaker, CircuitBreakerEvent event, String outcome) {
        CircuitBreaker.Metrics metrics = circuitBreaker.getMetrics();
        log.debug("[{}] {} | State: {} | Failures: {}/{} | Failure Rate: {}% | At: {}",
                event.getCircuitBreakerName(),
                outcome,
                circuitBreaker.getState(),
                metrics.getNumberOfFailedCalls(),
                metrics.getNumberOfBufferedCalls(),
                String.format("%.2f", metrics.getFailureRate()),
                event.getCreationTime());
    }

    private void logDetailedMetrics(CircuitBreaker circuitBreaker) {
        CircuitBreaker.Metrics metrics = circuitBreaker.getMetrics();
        var config = circuitBreaker.getCircuitBreakerConfig();

        log.warn("[{}] Buffered: {} | Failed: {} | Not Permitted: {} | Failure Threshold: {}% | Window: {}",
                circuitBreaker.getName(),
                metrics.getNumberOfBufferedCalls(),
                metrics.getNumberOfFailedCalls(),
                metrics.getNumberOfNotPermittedCalls(),
                config.getFailureRateThreshold(),
                config.getSlidingWindowSize());
    }

    synchronized boolean isRegistered(String name) {
        return registered.contains(name);
    }
}
