package com.bank.bakeoff.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Outcome of training and evaluating one candidate. Failed candidates keep zeroed
 * metrics and no artifact; they are reported but never eligible as champion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateResult {
    private int candidateIndex;
    private Algorithm algorithm;
    private Map<String, Object> hyperparams;
    private CandidateMetrics metrics;
    private List<FeatureWeight> importance;     // descending by weight
    private String serializedArtifact;          // JSON of ModelArtifact, null when failed
    private boolean failed;
    private String errorMessage;
    private long trainingTimeMs;
}
