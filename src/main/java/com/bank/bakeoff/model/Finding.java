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
@Schema(description = "A flagged row of a scoring run")
public class Finding {

    private String runId;

    @Schema(description = "Wire identifier from the dataset, or row-<index>", example = "W-000123")
    private String wireId;

    @Schema(description = "1-based rank by descending score", example = "1")
    private int rank;

    @Schema(description = "Anomaly score in [0,1]", example = "0.912345")
    private double score;

    private int predictedLabel;

    private List<ReasonCode> reasonCodes;

    @Schema(description = "Per-finding explanation blob; not produced by this service")
    private String localExplainBlobUrl;
}
