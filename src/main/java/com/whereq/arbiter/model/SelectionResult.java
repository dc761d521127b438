package com.whereq.arbiter.model;

import com.whereq.arbiter.lifecycle.CapacityOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one runner selection. {@code runnerKey} is null when no runner can run the job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SelectionResult {

    private String runnerKey;

    private Explanation explanation;

    private AvailabilitySnapshot.Status availability;

    /**
     * Set only when on-demand capacity had to be requested
     */
    private CapacityOutcome capacity;

    public boolean isSelected() {
        return runnerKey != null;
    }
}
