package com.lounge.advisor.model.entity;

import lombok.Data;

import java.util.List;

@Data
public class UserProfile {
    private String userId;
    private String name;
    private String homeAirport;
    private List<String> memberships;
}
