package com.whereq.arbiter.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The persisted bandit document: one {@link ArmStatistics} per runner key.
 * Serializes as a plain JSON object keyed by runner key.
 */
@EqualsAndHashCode
@ToString
public class BanditState {

    private final TreeMap<String, ArmStatistics> arms = new TreeMap<>();

    public BanditState() {
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public BanditState(Map<String, ArmStatistics> arms) {
        if (arms != null) {
            arms.forEach((key, stats) -> this.arms.put(key, stats != null ? stats : new ArmStatistics()));
        }
    }

    public static BanditState empty() {
        return new BanditState();
    }

    @JsonValue
    public SortedMap<String, ArmStatistics> getArms() {
        return arms;
    }

    public Optional<ArmStatistics> arm(String runnerKey) {
        return Optional.ofNullable(arms.get(runnerKey));
    }

    /**
     * Statistics for the runner, created on first access
     */
    public ArmStatistics armOrCreate(String runnerKey) {
        return arms.computeIfAbsent(runnerKey, k -> new ArmStatistics());
    }

    public long pulls(String runnerKey) {
        return arm(runnerKey).map(ArmStatistics::getPulls).orElse(0L);
    }

    /**
     * Sum of pulls over the given runner keys
     */
    public long totalPulls(Collection<String> runnerKeys) {
        return runnerKeys.stream().mapToLong(this::pulls).sum();
    }

    public long totalPulls() {
        return arms.values().stream().mapToLong(ArmStatistics::getPulls).sum();
    }

    public double totalReward() {
        return arms.values().stream().mapToDouble(ArmStatistics::getTotalReward).sum();
    }

    public BanditState copy() {
        BanditState copy = new BanditState();
        arms.forEach((key, stats) -> copy.arms.put(key, stats.copy()));
        return copy;
    }
}
