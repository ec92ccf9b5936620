package com.lounge.advisor.model.dto;

import lombok.Value;

/**
 * A traveler membership paired with the lounge access provider it was matched against.
 */
@Value
public class AccessMatch {
    String membership;
    String provider;
}
