package com.whereq.arbiter.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Accumulated performance of one runner (bandit arm).
 *
 * Counters only grow; there is no operation that corrects a past observation.
 * Fields added after the first release default to zero when an older document is loaded.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArmStatistics {

    private long pulls;

    @JsonProperty("total_reward")
    @JsonAlias("totalReward")
    private double totalReward;

    private long successes;

    private long failures;

    /**
     * Sum of observed job durations in seconds
     */
    @JsonProperty("total_duration")
    @JsonAlias("totalDuration")
    private double totalDuration;

    /**
     * Fold one observation into the counters
     */
    public void record(double reward, boolean success, double durationSeconds) {
        pulls++;
        totalReward += reward;
        totalDuration += durationSeconds;
        if (success) {
            successes++;
        } else {
            failures++;
        }
    }

    /**
     * Mean reward; only meaningful when {@code pulls > 0}
     */
    public double meanReward() {
        return pulls > 0 ? totalReward / pulls : 0.0;
    }

    /**
     * Observed success rate, 0.5 when nothing has been observed yet
     */
    public double successRate() {
        long total = successes + failures;
        return total > 0 ? (double) successes / total : 0.5;
    }

    public double avgDuration() {
        return pulls > 0 ? totalDuration / pulls : 0.0;
    }

    public ArmStatistics copy() {
        return toBuilder().build();
    }
}
