package com.bank.bakeoff.config;

import com.bank.bakeoff.model.RubricConfig;
import com.bank.bakeoff.model.RubricConstraints;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "bakeoff")
public class BakeoffConfig {

    private double defaultReviewRate = 0.005;
    private double weightTotal = 1.0;
    private long trainingTimeoutSeconds = 55;
    private int workerPoolSize = 2;
    private RubricConfig defaultRubric = builtInRubric();
    private Recovery recovery = new Recovery();

    @Data
    public static class Recovery {
        private boolean enabled = true;
        private int checkIntervalSeconds = 60;
        private long staleAfterSeconds = 300;
    }

    /**
     * Each bake-off stores its own rubric, so callers get a detached copy.
     */
    public RubricConfig copyOfDefaultRubric() {
        RubricConstraints c = defaultRubric.getConstraints();
        RubricConstraints constraints = c == null ? new RubricConstraints() : RubricConstraints.builder()
                .minRecallAtReviewRate(c.getMinRecallAtReviewRate())
                .minPrecisionAtReviewRate(c.getMinPrecisionAtReviewRate())
                .minPrAuc(c.getMinPrAuc())
                .build();
        return RubricConfig.builder()
                .constraints(constraints)
                .weights(new LinkedHashMap<>(defaultRubric.getWeights()))
                .build();
    }

    private static RubricConfig builtInRubric() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("recallAtReviewRate", 0.40);
        weights.put("prAuc", 0.25);
        weights.put("precisionAtReviewRate", 0.15);
        weights.put("stability", 0.10);
        weights.put("explainability", 0.10);
        return RubricConfig.builder()
                .constraints(RubricConstraints.builder()
                        .minRecallAtReviewRate(0.65)
                        .minPrecisionAtReviewRate(0.08)
                        .build())
                .weights(weights)
                .build();
    }
}
