package com.whereq.arbiter.dto;

import com.whereq.arbiter.model.BanditAlgorithm;
import com.whereq.arbiter.model.RunnerStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for the bandit statistics snapshot.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatsResponse {

    private BanditAlgorithm algorithm;

    private String backend;

    private long totalObservations;

    private Map<String, RunnerStats> runners;

    /**
     * Runner keys by mean reward, best first
     */
    private List<String> ranking;
}
