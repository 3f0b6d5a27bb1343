package com.bank.bakeoff.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Candidate algorithms known to the trainer registry.
 * The explainability value is a fixed heuristic per algorithm family.
 */
public enum Algorithm {

    LOG_REG("log_reg", "Logistic Regression", 1.0),
    DECISION_TREE("decision_tree", "Decision Tree", 1.0),
    RANDOM_FOREST("random_forest", "Random Forest", 0.8),
    EXTRA_TREES("extra_trees", "Extra-Trees", 0.8),
    GRADIENT_BOOSTED("gradient_boosted", "Gradient Boosted Trees", 0.9),
    ISOLATION_FOREST("isolation_forest", "Isolation Forest", 0.7);

    private final String code;
    private final String displayName;
    private final double explainability;

    Algorithm(String code, String displayName, double explainability) {
        this.code = code;
        this.displayName = displayName;
        this.explainability = explainability;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public double getExplainability() {
        return explainability;
    }

    @JsonCreator
    public static Algorithm fromCode(String value) {
        if (value == null) return null;
        for (Algorithm algorithm : values()) {
            if (algorithm.code.equalsIgnoreCase(value) || algorithm.name().equalsIgnoreCase(value)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown algorithm: " + value);
    }
}
