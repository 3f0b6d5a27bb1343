package com.bank.bakeoff.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One execution of a model version against a dataset")
public class ScoringRun {

    private String id;
    private String datasetId;
    private String modelVersionId;

    @Schema(description = "Run status", example = "SCORED")
    private RunStatus status;

    @Schema(description = "Location of the scored CSV")
    private String outputsBlobUrl;

    private ScoringSummary summary;
    private String errorMessage;
    private long createdAt;
    private long updatedAt;
}
