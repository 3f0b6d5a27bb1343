package com.bank.bakeoff.engine.scoring;

import com.bank.bakeoff.engine.trainer.TrainedModel;
import com.bank.bakeoff.model.ReasonCode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Local explanation by occlusion: each feature is reset to its training mean and the
 * resulting change in score is attributed to it. A positive change means the row's
 * value pushed the score up ("increase").
 */
public final class ReasonCodeGenerator {

    private static final double MIN_CONTRIBUTION = 1e-9;

    private ReasonCodeGenerator() {}

    public static List<ReasonCode> explain(TrainedModel model, double[] point, List<String> featureNames,
                                           double[] featureMeans, int maxCodes) {
        double baseScore = model.predict(point);
        List<ReasonCode> codes = new ArrayList<>();
        double[] modified = point.clone();

        for (int j = 0; j < point.length; j++) {
            modified[j] = featureMeans[j];
            double contribution = baseScore - model.predict(modified);
            modified[j] = point[j];
            if (Math.abs(contribution) < MIN_CONTRIBUTION) continue;

            String feature = featureNames.get(j);
            String direction = contribution > 0 ? "increase" : "decrease";
            ReasonCodeTemplate template = ReasonCodeTemplate.match(feature);
            codes.add(ReasonCode.builder()
                    .code(template != null ? template.getCode() : "Feature_" + feature)
                    .description(template != null ? template.getDescription()
                            : feature + (point[j] >= featureMeans[j] ? " above" : " below") + " typical value")
                    .feature(feature)
                    .direction(direction)
                    .contribution(contribution)
                    .featureValue(point[j])
                    .build());
        }

        // Stable sort keeps feature order among equal contributions
        codes.sort(Comparator.comparingDouble((ReasonCode c) -> Math.abs(c.getContribution())).reversed());
        return codes.size() > maxCodes ? new ArrayList<>(codes.subList(0, maxCodes)) : codes;
    }
}
