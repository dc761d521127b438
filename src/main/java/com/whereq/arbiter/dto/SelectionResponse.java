package com.whereq.arbiter.dto;

import com.whereq.arbiter.lifecycle.CapacityOutcome;
import com.whereq.arbiter.model.AvailabilitySnapshot;
import com.whereq.arbiter.model.Explanation;
import com.whereq.arbiter.model.SelectionResult;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a runner selection.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Selected runner and the reasoning behind it")
public class SelectionResponse {

    @Schema(description = "Selected runner key, null when the job is infeasible", example = "linux-docker")
    private String runnerKey;

    @Schema(description = "True when a runner was selected")
    private boolean selected;

    @Schema(description = "Fleet status feed result: KNOWN or UNKNOWN")
    private AvailabilitySnapshot.Status availability;

    @Schema(description = "On-demand capacity action taken, if any")
    private CapacityOutcome capacity;

    private Explanation explanation;

    @Schema(description = "Human readable rendering of the explanation")
    private String summary;

    public static SelectionResponse of(SelectionResult result) {
        return SelectionResponse.builder()
            .runnerKey(result.getRunnerKey())
            .selected(result.isSelected())
            .availability(result.getAvailability())
            .capacity(result.getCapacity())
            .explanation(result.getExplanation())
            .summary(result.getExplanation().render())
            .build();
    }
}
