package com.lounge.advisor.model.dto;

import com.lounge.advisor.model.entity.Lounge;
import lombok.Data;

import java.util.List;

@Data
public class Recommendation {
    private Lounge lounge;
    private List<String> accessMethods;
    private int score;
    private List<String> reasons;
    private TimingWindow timing;
}
