package com.bank.bakeoff.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Champion selection rubric: hard constraints plus weighted metrics")
public class RubricConfig {

    private RubricConstraints constraints;

    @Schema(description = "Metric key to non-negative weight; weights sum to 1.0",
            example = "{\"recallAtReviewRate\": 0.4, \"prAuc\": 0.25, \"precisionAtReviewRate\": 0.15, \"stability\": 0.1, \"explainability\": 0.1}")
    @Builder.Default
    private Map<String, Double> weights = new LinkedHashMap<>();
}
