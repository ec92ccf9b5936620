package com.lounge.advisor.model.dto;

import lombok.Data;

import java.util.List;

@Data
public class CompatibilityRequest {
    private List<String> memberships;
    private List<String> providers;
}
