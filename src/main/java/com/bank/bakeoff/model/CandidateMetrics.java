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
@Schema(description = "Evaluation metrics of one candidate, all on a [0,1] scale")
public class CandidateMetrics {

    @Schema(description = "Precision within the top review-rate fraction of rows", example = "0.12")
    private double precisionAtReviewRate;

    @Schema(description = "Recall within the top review-rate fraction of rows", example = "0.70")
    private double recallAtReviewRate;

    @Schema(description = "Area under the precision-recall curve", example = "0.45")
    private double prAuc;

    @Schema(description = "1 minus the std of recall@RR across folds", example = "0.93")
    private double stability;

    @Schema(description = "F1 of precision and recall at the review rate", example = "0.21")
    private double f1;

    @Schema(description = "Explainability heuristic for the algorithm family", example = "0.8")
    private double explainability;

    public static CandidateMetrics zero() {
        return new CandidateMetrics();
    }

    public double get(RubricMetric metric) {
        return switch (metric) {
            case RECALL_AT_REVIEW_RATE -> recallAtReviewRate;
            case PRECISION_AT_REVIEW_RATE -> precisionAtReviewRate;
            case PR_AUC -> prAuc;
            case STABILITY -> stability;
            case F1 -> f1;
            case EXPLAINABILITY -> explainability;
        };
    }
}
