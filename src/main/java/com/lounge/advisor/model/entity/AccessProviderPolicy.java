package com.lounge.advisor.model.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Access rules of one provider (card, alliance or membership programme) as
 * shown next to a lounge.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AccessProviderPolicy {
    private String providerName;
    private String guestPolicy;
    private String conditions;
    private String notes;
}
