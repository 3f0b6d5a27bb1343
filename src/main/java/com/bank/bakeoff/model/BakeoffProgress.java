package com.bank.bakeoff.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Durable working state of a bake-off, kept apart from the error field.
 * Candidate indices are positions in {@code candidateConfigs}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BakeoffProgress {
    private String featuresBlobUrl;     // null until the feature matrix is uploaded
    private List<CandidateConfig> candidateConfigs;
    private String labelColumn;
    private double reviewRate;
    private ExecutionMode executionMode;
    private int featureCount;
    private int rowCount;
}
