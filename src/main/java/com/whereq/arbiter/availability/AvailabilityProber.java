package com.whereq.arbiter.availability;

import com.whereq.arbiter.model.AvailabilitySnapshot;
import reactor.core.publisher.Mono;

/**
 * Queries the fleet status feed for the runners that are currently online
 */
public interface AvailabilityProber {

    /**
     * Probe the fleet
     *
     * @return Mono with a snapshot; never errors, a failed probe yields an UNKNOWN snapshot
     */
    Mono<AvailabilitySnapshot> probe();
}
