package com.whereq.arbiter.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A feasible runner with its preference score
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RankedRunner {
    private String runnerKey;
    private double preferenceScore;
    private double costPerMinute;
}
