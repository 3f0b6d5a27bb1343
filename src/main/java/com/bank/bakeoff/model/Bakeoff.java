package com.bank.bakeoff.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A comparison of candidate model configurations on one labeled dataset")
public class Bakeoff {

    @Schema(description = "Bake-off identifier", example = "7f3c1a9e-3d2b-4a51-9a77-0c1d2e3f4a5b")
    private String id;

    @Schema(description = "Model the candidates are registered under")
    private String modelId;

    @Schema(description = "Labeled training dataset")
    private String datasetId;

    private RubricConfig rubric;

    @Schema(description = "Lifecycle status", example = "RUNNING")
    private BakeoffStatus status;

    @Schema(description = "Model version ids in candidate order; append-only")
    @Builder.Default
    private List<String> candidateVersionIds = new ArrayList<>();

    @Schema(description = "Champion version id, set once the bake-off completes")
    private String championVersionId;

    private String narrativeShort;
    private String narrativeLong;

    @Schema(description = "Failure message when status is FAILED")
    private String error;

    private BakeoffProgress progress;

    private long createdAt;
    private long updatedAt;

    /** Aerospike record generation read with this bake-off; used for conditional writes. */
    @JsonIgnore
    private int generation;

    @JsonIgnore
    public int getTrainedCount() {
        return candidateVersionIds == null ? 0 : candidateVersionIds.size();
    }

    @JsonIgnore
    public int getCandidateCount() {
        return progress == null || progress.getCandidateConfigs() == null
                ? 0 : progress.getCandidateConfigs().size();
    }
}
