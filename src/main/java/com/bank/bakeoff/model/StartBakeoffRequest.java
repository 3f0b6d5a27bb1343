package com.bank.bakeoff.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to start a bake-off")
public class StartBakeoffRequest {

    @Schema(description = "Labeled dataset to train and evaluate on", requiredMode = Schema.RequiredMode.REQUIRED)
    private String datasetId;

    @Schema(description = "Model that will own the candidate versions", requiredMode = Schema.RequiredMode.REQUIRED)
    private String modelId;

    @Schema(description = "Candidates in evaluation order", requiredMode = Schema.RequiredMode.REQUIRED)
    private List<CandidateConfig> candidates;

    @Schema(description = "Rubric; defaults to the configured rubric when omitted")
    private RubricConfig rubric;

    @Schema(description = "Label column; defaults to the column detected at upload", example = "IsAnomaly")
    private String labelColumn;

    @Schema(description = "Fraction of rows an analyst can review, in (0,1]", example = "0.005")
    private Double reviewRate;

    @Schema(description = "BATCH (default) or INCREMENTAL", example = "BATCH")
    private ExecutionMode executionMode;
}
