package com.lounge.advisor.controller;

import com.lounge.advisor.exception.ErrorKind;
import com.lounge.advisor.model.dto.AdvisorResponse;
import com.lounge.advisor.model.dto.CompatibilityRequest;
import com.lounge.advisor.model.dto.ErrorDetail;
import com.lounge.advisor.model.dto.LayoverStrategyRequest;
import com.lounge.advisor.model.dto.TravelerContext;
import com.lounge.advisor.model.dto.TravelerPreferences;
import com.lounge.advisor.service.LoungeAdvisorService;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.constraints.Pattern;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * -@RestController: HTTP surface of the lounge advisor
 * --Every handler returns the AdvisorResponse envelope; the HTTP status mirrors
 * the envelope status and error kind
 * =========
 * -@RequestMapping("/api"): all endpoints live under /api
 * =========
 * -@Validated: enables the [@Pattern] checks on path variables and user ids;
 * failures raise ConstraintViolationException, answered with 400 by
 * handleValidationException
 * =========
 * Status mapping:
 * --success 200, not_found 404
 * --VALIDATION 400, AUTH 502, PROVIDER 502 (503 when the provider said 503),
 * INTERNAL 500
 */
@RestController
@RequestMapping("/api")
@Validated
@Slf4j
public class LoungeAdvisorController {

    private static final String USER_ID_PATTERN = "^[A-Za-z0-9_-]{1,64}$";
    private static final String USER_ID_MESSAGE = "User id must be 1-64 characters (A-Z, a-z, 0-9, _ or -)";

    @Autowired
    private LoungeAdvisorService loungeAdvisorService;

    /**
     * Lounge recommendations for one flight.
     *
     * Memberships come from repeated membership parameters, or from the stored
     * profile when userId is given.
     * Example: /api/recommendations?flight=AA123&date=2025-12-25&membership=Amex%20Platinum&quiet=true
     */
    @GetMapping("/recommendations")
    public CompletableFuture<ResponseEntity<?>> getRecommendations(
            @RequestParam("flight") String flight,
            @RequestParam("date") String date,
            @RequestParam(value = "suffix", required = false) String suffix,
            @RequestParam(value = "membership", required = false) List<String> memberships,
            @RequestParam(value = "userId", required = false) @Pattern(regexp = USER_ID_PATTERN, message = USER_ID_MESSAGE) String userId,
            @RequestParam(value = "quiet", required = false) Boolean quiet,
            @RequestParam(value = "food", required = false) Boolean food,
            @RequestParam(value = "wifi", required = false) Boolean wifi,
            @RequestParam(value = "showers", required = false) Boolean showers) {
        log.info("Received recommendation request for flight {} on {}", flight, date);

        TravelerPreferences preferences = quiet == null && food == null && wifi == null && showers == null
                ? null
                : new TravelerPreferences(quiet, food, wifi, showers);

        if (userId != null) {
            return toResponse(loungeAdvisorService.getFlightAwareRecommendationsForUser(userId, flight, date, suffix,
                    preferences));
        }
        return toResponse(loungeAdvisorService.getFlightAwareRecommendations(flight, date, suffix,
                new TravelerContext(memberships == null ? List.of() : memberships, preferences)));
    }

    @PostMapping("/layover-strategy")
    public CompletableFuture<ResponseEntity<?>> planLayoverStrategy(@RequestBody LayoverStrategyRequest request) {
        log.info("Received layover strategy request for {} leg(s)",
                request.getLegs() == null ? 0 : request.getLegs().size());

        if (request.getUserId() != null) {
            if (!request.getUserId().matches(USER_ID_PATTERN)) {
                return CompletableFuture.completedFuture(ResponseEntity.badRequest()
                        .body(AdvisorResponse.error(ErrorKind.VALIDATION, USER_ID_MESSAGE, null)));
            }
            return toResponse(loungeAdvisorService.planLayoverStrategyForUser(request.getUserId(), request.getLegs(),
                    request.getPreferences()));
        }
        return toResponse(loungeAdvisorService.planLayoverStrategy(request.getLegs(),
                new TravelerContext(request.getMemberships() == null ? List.of() : request.getMemberships(),
                        request.getPreferences())));
    }

    /**
     * Flight status with lounge availability at both airports.
     */
    @GetMapping("/flights/{identifier}")
    public CompletableFuture<ResponseEntity<?>> getFlightLoungeImpact(
            @PathVariable String identifier,
            @RequestParam("date") String date,
            @RequestParam(value = "suffix", required = false) String suffix) {
        return toResponse(loungeAdvisorService.getFlightLoungeImpact(identifier, date, suffix));
    }

    @GetMapping("/flights/{identifier}/validation")
    public CompletableFuture<ResponseEntity<?>> validateFlightNumber(@PathVariable String identifier) {
        return toResponse(loungeAdvisorService.validateFlightNumber(identifier));
    }

    /**
     * Flight offers between two airports for lounge planning; returnDate makes it a round trip.
     */
    @GetMapping("/flight-offers")
    public CompletableFuture<ResponseEntity<?>> searchFlights(
            @RequestParam("origin") String origin,
            @RequestParam("destination") String destination,
            @RequestParam("date") String date,
            @RequestParam(value = "returnDate", required = false) String returnDate) {
        return toResponse(loungeAdvisorService.searchFlightsForLoungePlanning(origin, destination, date, returnDate));
    }

    @GetMapping("/airports/{airport}/lounges")
    public CompletableFuture<ResponseEntity<?>> getAirportLoungeSummary(
            @PathVariable @Pattern(regexp = "^[A-Za-z]{3}$", message = "Airport code must be exactly 3 letters") String airport,
            @RequestParam(value = "membership", required = false) List<String> memberships) {
        return toResponse(loungeAdvisorService.getAirportLoungeSummary(airport, memberships));
    }

    @PostMapping("/compatibility")
    public CompletableFuture<ResponseEntity<?>> checkCompatibility(@RequestBody CompatibilityRequest request) {
        return toResponse(loungeAdvisorService.checkCompatibility(request.getMemberships(), request.getProviders()));
    }

    @GetMapping("/users/{userId}")
    public CompletableFuture<ResponseEntity<?>> getUser(
            @PathVariable @Pattern(regexp = USER_ID_PATTERN, message = USER_ID_MESSAGE) String userId) {
        return toResponse(loungeAdvisorService.getUser(userId));
    }

    @GetMapping("/health")
    public CompletableFuture<ResponseEntity<?>> health() {
        return toResponse(loungeAdvisorService.healthCheck());
    }

    private <T> CompletableFuture<ResponseEntity<?>> toResponse(Future<AdvisorResponse<T>> result) {
        CompletableFuture<ResponseEntity<?>> future = new CompletableFuture<>();

        result.onSuccess(response -> future.complete(ResponseEntity.status(statusOf(response)).body(response)))
                .onFailure(error -> {
                    log.error("Advisor operation failed outside the response envelope", error);
                    future.complete(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                            .body(errorBody("Internal Server Error", "An unexpected error occurred")));
                });

        return future;
    }

    static HttpStatus statusOf(AdvisorResponse<?> response) {
        if (AdvisorResponse.SUCCESS.equals(response.getStatus())) {
            return HttpStatus.OK;
        }
        if (AdvisorResponse.NOT_FOUND.equals(response.getStatus())) {
            return HttpStatus.NOT_FOUND;
        }

        ErrorDetail error = response.getError();
        if (error == null || error.getKind() == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        switch (error.getKind()) {
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case AUTH:
                return HttpStatus.BAD_GATEWAY;
            case PROVIDER:
                return Integer.valueOf(503).equals(error.getProviderStatus())
                        ? HttpStatus.SERVICE_UNAVAILABLE
                        : HttpStatus.BAD_GATEWAY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    /**
     * Handle validation exceptions raised by [@Pattern] parameters.
     */
    @ExceptionHandler(jakarta.validation.ConstraintViolationException.class)
    public ResponseEntity<?> handleValidationException(jakarta.validation.ConstraintViolationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        String message = ex.getConstraintViolations().stream()
                .map(v -> v.getMessage())
                .findFirst()
                .orElse("Invalid request");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(AdvisorResponse.error(ErrorKind.VALIDATION, message, null));
    }

    @ExceptionHandler({ MissingServletRequestParameterException.class, HttpMessageNotReadableException.class })
    public ResponseEntity<?> handleBadRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(AdvisorResponse.error(ErrorKind.VALIDATION, "Malformed request: " + ex.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<?> handleException(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("Internal Server Error", "An unexpected error occurred"));
    }

    private static Map<String, Object> errorBody(String error, String message) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", error);
        errorResponse.put("message", message);
        errorResponse.put("timestamp", Instant.now().toString());
        return errorResponse;
    }
}
