package com.whereq.arbiter.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for reporting a finished job.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of a job that ran on a runner")
public class OutcomeRequest {

    @NotBlank(message = "Runner key is required")
    @Schema(description = "Runner the job ran on", example = "linux-docker")
    private String runnerKey;

    @NotNull(message = "Success flag is required")
    @Schema(description = "Whether the job succeeded", example = "true")
    private Boolean success;

    @NotNull(message = "Duration is required")
    @PositiveOrZero(message = "Duration must not be negative")
    @Schema(description = "Job duration in seconds", example = "95.5")
    private Double durationSeconds;

    @PositiveOrZero(message = "Cost must not be negative")
    @Schema(description = "Cost per minute of runner time; defaults to the runner's registered cost", example = "0.0")
    private Double costPerMinute;

    @Schema(description = "Job name, informational", example = "build")
    private String jobName;

    @JsonIgnore
    @AssertTrue(message = "Duration and cost must be finite numbers")
    public boolean isFinite() {
        return (durationSeconds == null || Double.isFinite(durationSeconds))
            && (costPerMinute == null || Double.isFinite(costPerMinute));
    }
}
