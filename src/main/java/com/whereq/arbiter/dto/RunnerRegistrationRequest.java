package com.whereq.arbiter.dto;

import com.whereq.arbiter.model.ExecutorClass;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for registering or re-registering a runner.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Runner registration")
public class RunnerRegistrationRequest {

    @Schema(description = "Display name, as shown in the CI system", example = "Linux Yoga Docker Runner")
    private String name;

    @Schema(description = "Runner tags as configured in the CI system", example = "[\"linux-docker\"]")
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Schema(description = "Declared capabilities before implication closure", example = "[\"docker\", \"linux\"]")
    @Builder.Default
    private List<String> capabilities = new ArrayList<>();

    @PositiveOrZero(message = "Cost must not be negative")
    @Schema(description = "Cost per minute of runner time", example = "0.0")
    private double costPerMinute;

    @Schema(description = "Executor class", example = "CONTAINER")
    @Builder.Default
    private ExecutorClass executorClass = ExecutorClass.CONTAINER;

    @Schema(description = "GitLab runner id used for availability checks", example = "51337426")
    private Long gitlabRunnerId;

    @Schema(description = "True when the runner lives on on-demand capacity")
    private boolean onDemand;
}
