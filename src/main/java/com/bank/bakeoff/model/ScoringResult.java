package com.bank.bakeoff.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * In-memory output of the scoring pipeline before anything is persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoringResult {
    private byte[] scoredCsv;
    private List<Finding> findings;
    private ScoringSummary summary;
}
