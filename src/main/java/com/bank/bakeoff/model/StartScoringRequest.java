package com.bank.bakeoff.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to score a dataset with a model version")
public class StartScoringRequest {

    @Schema(description = "Dataset to score", requiredMode = Schema.RequiredMode.REQUIRED)
    private String datasetId;

    @Schema(description = "Model whose champion is used when no version is given")
    private String modelId;

    @Schema(description = "Explicit model version")
    private String modelVersionId;

    @Schema(description = "Fraction of rows to flag", example = "0.01")
    private Double reviewRate;

    @Schema(description = "Explicit score threshold; overrides the review rate for flagging", example = "0.8")
    private Double threshold;

    @Schema(description = "Maximum number of findings to persist", example = "200")
    private Integer previewLimit;
}
