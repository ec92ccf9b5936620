package com.lounge.advisor.service;

import com.lounge.advisor.model.dto.AccessCompatibility;
import com.lounge.advisor.model.dto.AccessMatch;
import com.lounge.advisor.model.dto.Recommendation;
import com.lounge.advisor.model.dto.TimingWindow;
import com.lounge.advisor.model.dto.TravelerPreferences;
import com.lounge.advisor.model.entity.FlightEndpoint;
import com.lounge.advisor.model.entity.FlightStatus;
import com.lounge.advisor.model.entity.Lounge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;

/**
 * Ranks the lounges of the departure airport for one flight.
 * <p>
 * Points are additive:
 * <ul>
 * <li>terminal: +50 same as departure terminal, +20 other known terminal</li>
 * <li>preferences: quiet +15, food +15, wifi +10, showers +20</li>
 * <li>wait: +15 under 10 minutes, -10 over 20 minutes</li>
 * <li>rating: +20 from 4.5, +10 from 4.0</li>
 * </ul>
 * Lounges the traveler cannot enter are dropped first. Results are ordered by
 * score, then rating, then name, and capped at {@link #MAX_RECOMMENDATIONS}.
 */
@Component
@Slf4j
public class RecommendationScorer {

    public static final int MAX_RECOMMENDATIONS = 5;

    static final int GATE_BUFFER_MINUTES = 60;
    static final int ENTRY_WINDOW_MINUTES = 30;
    static final int DEFAULT_VISIT_MINUTES = 30;

    private static final List<String> QUIET_KEYWORDS = List.of("quiet");
    private static final List<String> FOOD_KEYWORDS = List.of("dining", "food", "restaurant");
    private static final List<String> WIFI_KEYWORDS = List.of("wifi", "wi-fi");
    private static final List<String> SHOWER_KEYWORDS = List.of("shower");

    private static final Comparator<Recommendation> RANKING = Comparator
            .comparingInt(Recommendation::getScore).reversed()
            .thenComparing(r -> ratingOf(r.getLounge()), Comparator.<Double>reverseOrder())
            .thenComparing(r -> r.getLounge().getName(), Comparator.nullsLast(Comparator.<String>naturalOrder()));

    @Autowired
    private AccessCompatibilityMatcher accessCompatibilityMatcher;

    public List<Recommendation> scoreLounges(FlightStatus flight, List<Lounge> lounges, List<String> memberships,
            TravelerPreferences preferences) {
        FlightEndpoint departure = flight.getDeparture();
        String terminal = departure == null ? null : departure.getTerminal();
        OffsetDateTime departureTime = departure == null ? null : departure.getEstimatedTime();

        List<Recommendation> ranked = rank(lounges, memberships, preferences, terminal,
                timingBefore(departureTime, DEFAULT_VISIT_MINUTES), null, MAX_RECOMMENDATIONS);

        log.debug("Scored {} lounge(s) for flight {}: {} recommended", lounges == null ? 0 : lounges.size(),
                flight.getDesignator(), ranked.size());
        return ranked;
    }

    /**
     * Shared ranking used by the scorer and the layover planner.
     *
     * @param timing     template copied onto every recommendation; null for none
     * @param adjustment extra points applied after the standard rules; null for none
     */
    List<Recommendation> rank(List<Lounge> lounges, List<String> memberships, TravelerPreferences preferences,
            String departureTerminal, TimingWindow timing, BiConsumer<Lounge, ScoreCard> adjustment, int limit) {
        if (lounges == null || lounges.isEmpty()) {
            return new ArrayList<>();
        }

        List<Recommendation> candidates = new ArrayList<>();
        for (Lounge lounge : lounges) {
            AccessCompatibility access = accessCompatibilityMatcher.check(memberships, lounge.getAccessProviders());
            if (!access.hasAccess()) {
                continue;
            }

            ScoreCard card = new ScoreCard();
            scoreTerminal(card, lounge, departureTerminal);
            if (preferences != null) {
                scorePreferences(card, lounge, preferences);
            }
            scoreWait(card, lounge);
            scoreRating(card, lounge);
            if (adjustment != null) {
                adjustment.accept(lounge, card);
            }

            Recommendation recommendation = new Recommendation();
            recommendation.setLounge(lounge);
            recommendation.setAccessMethods(accessMethods(access));
            recommendation.setScore(card.getPoints());
            recommendation.setReasons(card.getReasons());
            recommendation.setTiming(copyOf(timing));
            candidates.add(recommendation);
        }

        return candidates.stream()
                .sorted(RANKING)
                .limit(limit)
                .collect(Collectors.toList());
    }

    /**
     * Exit one gate buffer before departure, enter one entry window before that.
     */
    static TimingWindow timingBefore(OffsetDateTime departureTime, int recommendedDurationMinutes) {
        if (departureTime == null) {
            return new TimingWindow(null, null, recommendedDurationMinutes);
        }
        OffsetDateTime latestExit = departureTime.minusMinutes(GATE_BUFFER_MINUTES);
        OffsetDateTime latestEntry = latestExit.minusMinutes(ENTRY_WINDOW_MINUTES);
        return new TimingWindow(latestEntry, latestExit, recommendedDurationMinutes);
    }

    private void scoreTerminal(ScoreCard card, Lounge lounge, String departureTerminal) {
        String terminal = lounge.getTerminal();
        if (terminal == null || terminal.isBlank()) {
            return;
        }
        if (departureTerminal != null && terminal.trim().equalsIgnoreCase(departureTerminal.trim())) {
            card.add(50, "Same terminal as your departure (" + terminal + ")");
        } else {
            card.add(20, "Located in terminal " + terminal);
        }
    }

    private void scorePreferences(ScoreCard card, Lounge lounge, TravelerPreferences preferences) {
        List<String> amenities = lounge.getAmenities();
        if (Boolean.TRUE.equals(preferences.getQuiet()) && hasAmenity(amenities, QUIET_KEYWORDS)) {
            card.add(15, "Quiet zone available");
        }
        if (Boolean.TRUE.equals(preferences.getFood()) && hasAmenity(amenities, FOOD_KEYWORDS)) {
            card.add(15, "Dining available");
        }
        if (Boolean.TRUE.equals(preferences.getWifi()) && hasAmenity(amenities, WIFI_KEYWORDS)) {
            card.add(10, "WiFi available");
        }
        if (Boolean.TRUE.equals(preferences.getShowers()) && hasAmenity(amenities, SHOWER_KEYWORDS)) {
            card.add(20, "Showers available");
        }
    }

    private void scoreWait(ScoreCard card, Lounge lounge) {
        Integer wait = lounge.getAvgWaitMinutes();
        if (wait == null) {
            return;
        }
        if (wait < 10) {
            card.add(15, "Short wait (" + wait + " min)");
        } else if (wait > 20) {
            card.add(-10, "Long wait (" + wait + " min)");
        }
    }

    private void scoreRating(ScoreCard card, Lounge lounge) {
        Double rating = lounge.getRating();
        if (rating == null) {
            return;
        }
        if (rating >= 4.5) {
            card.add(20, "Excellent rating (" + rating + ")");
        } else if (rating >= 4.0) {
            card.add(10, "Good rating (" + rating + ")");
        }
    }

    private static boolean hasAmenity(List<String> amenities, List<String> keywords) {
        if (amenities == null) {
            return false;
        }
        for (String amenity : amenities) {
            if (amenity == null) {
                continue;
            }
            String value = amenity.toLowerCase(Locale.ROOT);
            for (String keyword : keywords) {
                if (value.contains(keyword)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static List<String> accessMethods(AccessCompatibility access) {
        Set<String> providers = new LinkedHashSet<>();
        for (AccessMatch match : access.getMatches()) {
            providers.add(match.getProvider());
        }
        return new ArrayList<>(providers);
    }

    private static TimingWindow copyOf(TimingWindow timing) {
        if (timing == null) {
            return null;
        }
        return new TimingWindow(timing.getLatestEntry(), timing.getLatestExit(),
                timing.getRecommendedDurationMinutes());
    }

    private static double ratingOf(Lounge lounge) {
        return lounge.getRating() == null ? 0.0 : lounge.getRating();
    }

    /**
     * Running total and human-readable reasons for one lounge.
     */
    static final class ScoreCard {
        private int points;
        private final List<String> reasons = new ArrayList<>();

        void add(int delta, String reason) {
            points += delta;
            reasons.add(reason);
        }

        int getPoints() {
            return points;
        }

        List<String> getReasons() {
            return reasons;
        }
    }
}
