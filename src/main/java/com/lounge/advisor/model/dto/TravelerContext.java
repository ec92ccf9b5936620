package com.lounge.advisor.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TravelerContext {
    private List<String> memberships = new ArrayList<>();
    private TravelerPreferences preferences;
}
