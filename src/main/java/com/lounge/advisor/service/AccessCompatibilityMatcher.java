package com.lounge.advisor.service;

import com.lounge.advisor.model.dto.AccessCompatibility;
import com.lounge.advisor.model.dto.AccessMatch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Decides whether a traveler's memberships grant access to a lounge.
 * <p>
 * A membership matches a provider when, after trimming, case folding and
 * expanding well-known abbreviations ("amex" reads as "american express"),
 * either string contains the other. Matching is loose: "Priority Pass Select"
 * matches "Priority Pass" and "Amex Platinum" matches "American Express
 * Platinum Card", but "Gold" also matches "Amex Gold" and "Gold Card Lounge".
 * Null or blank entries never match.
 * <p>
 * Matches are returned in membership order, then provider order.
 */
@Component
public class AccessCompatibilityMatcher {

    private static final Map<Pattern, String> ABBREVIATIONS = new LinkedHashMap<>();

    static {
        ABBREVIATIONS.put(Pattern.compile("\\bamex\\b"), "american express");
    }

    public AccessCompatibility check(List<String> memberships, List<String> providers) {
        List<AccessMatch> matches = new ArrayList<>();
        if (memberships == null || providers == null) {
            return new AccessCompatibility(matches);
        }

        for (String membership : memberships) {
            String m = normalize(membership);
            if (m == null) {
                continue;
            }
            for (String provider : providers) {
                String p = normalize(provider);
                if (p != null && (m.contains(p) || p.contains(m))) {
                    matches.add(new AccessMatch(membership, provider));
                }
            }
        }
        return new AccessCompatibility(matches);
    }

    private static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<Pattern, String> abbreviation : ABBREVIATIONS.entrySet()) {
            normalized = abbreviation.getKey().matcher(normalized).replaceAll(abbreviation.getValue());
        }
        return normalized;
    }
}
