package com.bank.bakeoff.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One candidate configuration entered into a bake-off")
public class CandidateConfig {

    @Schema(description = "Algorithm code", example = "random_forest")
    private Algorithm algorithm;

    @Schema(description = "Algorithm hyperparameters; unspecified keys fall back to trainer defaults",
            example = "{\"nEstimators\": 20, \"maxDepth\": 10}")
    private Map<String, Object> hyperparams;
}
