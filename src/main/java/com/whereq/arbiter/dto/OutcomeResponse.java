package com.whereq.arbiter.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for an outcome report or a completion event.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutcomeResponse {

    private OutcomeStatus status;

    private String runnerKey;

    private Double reward;

    /**
     * Why an event was ignored or rejected
     */
    private String reason;

    public static OutcomeResponse updated(String runnerKey, double reward) {
        return OutcomeResponse.builder()
            .status(OutcomeStatus.UPDATED)
            .runnerKey(runnerKey)
            .reward(Math.round(reward * 10000) / 10000.0)
            .build();
    }

    public static OutcomeResponse ignored(String reason) {
        return OutcomeResponse.builder()
            .status(OutcomeStatus.IGNORED)
            .reason(reason)
            .build();
    }

    public static OutcomeResponse rejected(String reason) {
        return OutcomeResponse.builder()
            .status(OutcomeStatus.REJECTED)
            .reason(reason)
            .build();
    }

    public enum OutcomeStatus {
        UPDATED,
        IGNORED,
        REJECTED
    }
}
