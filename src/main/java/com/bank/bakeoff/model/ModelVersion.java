package com.bank.bakeoff.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A trained (or failed) candidate persisted under a model")
public class ModelVersion {

    private String id;
    private String modelId;
    private String bakeoffId;

    @Schema(description = "Position of the candidate in its bake-off", example = "0")
    private int candidateIndex;

    private Algorithm algorithm;
    private Map<String, Object> hyperparams;
    private String trainedDatasetId;

    @Schema(description = "Location of the serialized model artifact; null for failed candidates")
    private String artifactBlobUrl;

    private CandidateMetrics metrics;
    private List<FeatureWeight> importance;
    private boolean failed;
    private String errorMessage;

    @Schema(description = "Whether this version is the model's current champion")
    private boolean champion;

    private long createdAt;
}
