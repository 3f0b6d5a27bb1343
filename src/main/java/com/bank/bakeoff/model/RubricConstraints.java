package com.bank.bakeoff.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Minimums a candidate must meet to be eligible. A null minimum is not checked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RubricConstraints {

    @Schema(description = "Minimum recall at the review rate", example = "0.65")
    private Double minRecallAtReviewRate;

    @Schema(description = "Minimum precision at the review rate", example = "0.08")
    private Double minPrecisionAtReviewRate;

    @Schema(description = "Minimum PR-AUC", example = "0.2")
    private Double minPrAuc;

    public boolean isSatisfiedBy(CandidateMetrics m) {
        if (minRecallAtReviewRate != null && m.getRecallAtReviewRate() < minRecallAtReviewRate) return false;
        if (minPrecisionAtReviewRate != null && m.getPrecisionAtReviewRate() < minPrecisionAtReviewRate) return false;
        return minPrAuc == null || m.getPrAuc() >= minPrAuc;
    }
}
