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
@Schema(description = "Result of training one bake-off candidate")
public class CandidateSummary {
    private String bakeoffId;
    private int candidateIndex;
    private String versionId;
    private Algorithm algorithm;
    private CandidateMetrics metrics;
    private boolean failed;
    private String errorMessage;

    @Schema(description = "Candidates attempted so far, including this one", example = "2")
    private int trainedCount;

    @Schema(description = "Total candidates in the bake-off", example = "3")
    private int totalCandidates;
}
