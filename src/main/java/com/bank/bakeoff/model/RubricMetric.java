package com.bank.bakeoff.model;

/**
 * Metric names usable as rubric weight keys.
 */
public enum RubricMetric {

    RECALL_AT_REVIEW_RATE("recallAtReviewRate", "Recall @ Review Rate"),
    PR_AUC("prAuc", "PR-AUC"),
    PRECISION_AT_REVIEW_RATE("precisionAtReviewRate", "Precision @ Review Rate"),
    STABILITY("stability", "Stability"),
    EXPLAINABILITY("explainability", "Explainability"),
    F1("f1", "F1 Score");

    private final String key;
    private final String label;

    RubricMetric(String key, String label) {
        this.key = key;
        this.label = label;
    }

    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    public static RubricMetric fromKey(String key) {
        for (RubricMetric metric : values()) {
            if (metric.key.equals(key)) return metric;
        }
        return null;
    }
}
