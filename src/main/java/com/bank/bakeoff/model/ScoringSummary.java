package com.bank.bakeoff.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScoringSummary {
    private double reviewRate;
    private double thresholdUsed;
    private int flaggedCount;
    private int rowCount;
    private int findingCount;           // flagged rows persisted as findings (capped)
    private LabelMetrics labelMetrics;  // null when the dataset has no labels

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LabelMetrics {
        private double precision;
        private double recall;
        private double f1;
        private int truePositives;
        private int positives;
    }
}
