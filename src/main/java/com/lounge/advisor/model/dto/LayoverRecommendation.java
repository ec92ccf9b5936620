package com.lounge.advisor.model.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Layover bucket. Boundaries are inclusive on the lower side: 90 minutes is a
 * quick visit, 180 minutes a full experience.
 */
public enum LayoverRecommendation {
    NO_LOUNGE("no_lounge"),
    QUICK_VISIT("quick_visit"),
    FULL_EXPERIENCE("full_experience");

    public static final long QUICK_VISIT_MINUTES = 90;
    public static final long FULL_EXPERIENCE_MINUTES = 180;

    private final String value;

    LayoverRecommendation(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static LayoverRecommendation classify(long layoverMinutes) {
        if (layoverMinutes < QUICK_VISIT_MINUTES) {
            return NO_LOUNGE;
        }
        if (layoverMinutes < FULL_EXPERIENCE_MINUTES) {
            return QUICK_VISIT;
        }
        return FULL_EXPERIENCE;
    }
}
