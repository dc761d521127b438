package com.whereq.arbiter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;

/**
 * Result of probing the fleet status feed.
 * An UNKNOWN snapshot means the probe failed and must not be read as "fleet down".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AvailabilitySnapshot {

    public enum Status {
        KNOWN,
        UNKNOWN
    }

    private Status status;

    @Builder.Default
    private Set<String> onlineRunners = new TreeSet<>();

    @Builder.Default
    private Set<String> offlineRunners = new TreeSet<>();

    /**
     * Why the status is unknown
     */
    private String reason;

    private Instant probedAt;

    public static AvailabilitySnapshot known(Set<String> online, Set<String> offline) {
        return AvailabilitySnapshot.builder()
            .status(Status.KNOWN)
            .onlineRunners(new TreeSet<>(online))
            .offlineRunners(new TreeSet<>(offline))
            .probedAt(Instant.now())
            .build();
    }

    public static AvailabilitySnapshot unknown(String reason) {
        return AvailabilitySnapshot.builder()
            .status(Status.UNKNOWN)
            .reason(reason)
            .probedAt(Instant.now())
            .build();
    }

    public boolean isUnknown() {
        return status == Status.UNKNOWN;
    }
}
