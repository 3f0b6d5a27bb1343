package com.bank.bakeoff.engine.trainer;

import com.bank.bakeoff.engine.features.FeatureMatrix;
import com.bank.bakeoff.engine.features.FeatureMatrixBuilder;
import com.bank.bakeoff.engine.features.SchemaInferrer;
import com.bank.bakeoff.exception.ValidationException;
import com.bank.bakeoff.model.Algorithm;
import com.bank.bakeoff.model.TabularData;
import com.bank.bakeoff.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateTrainersTest {

    private static FeatureMatrix matrix;

    private final TrainerRegistry registry = new TrainerRegistry(List.of(
            new LogisticRegressionTrainer(),
            new DecisionTreeTrainer(),
            new RandomForestTrainer(),
            new ExtraTreesTrainer(),
            new GradientBoostedTrainer(),
            new IsolationForestTrainer()));

    @BeforeAll
    static void buildMatrix() {
        TabularData data = TestDataFactory.wires(300, 10);
        matrix = FeatureMatrixBuilder.buildForTraining(data, SchemaInferrer.infer(data), "IsAnomaly");
    }

    @ParameterizedTest
    @EnumSource(Algorithm.class)
    void everyTrainer_ranksAnomaliesAboveNormalWires(Algorithm algorithm) {
        TrainedModel model = registry.get(algorithm).train(matrix.getX(), matrix.getY(), Map.of());

        double[] scores = model.predictAll(matrix.getX());
        double positives = 0;
        double negatives = 0;
        int positiveCount = 0;
        for (int i = 0; i < scores.length; i++) {
            assertThat(scores[i]).isBetween(0.0, 1.0);
            if (matrix.getY()[i] == 1) {
                positives += scores[i];
                positiveCount++;
            } else {
                negatives += scores[i];
            }
        }
        assertThat(positives / positiveCount).isGreaterThan(negatives / (scores.length - positiveCount));
    }

    @ParameterizedTest
    @EnumSource(Algorithm.class)
    void trainedModel_survivesJsonRoundTrip(Algorithm algorithm) throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        TrainedModel model = registry.get(algorithm).train(matrix.getX(), matrix.getY(), Map.of("seed", 11));

        String json = mapper.writerFor(TrainedModel.class).writeValueAsString(model);
        TrainedModel restored = mapper.readValue(json, TrainedModel.class);

        assertThat(restored.predictAll(matrix.getX())).containsExactly(model.predictAll(matrix.getX()));
    }

    @Test
    void sameSeed_trainsIdenticalModel() {
        CandidateTrainer trainer = registry.get(Algorithm.RANDOM_FOREST);

        double[] first = trainer.train(matrix.getX(), matrix.getY(), Map.of("seed", 3)).predictAll(matrix.getX());
        double[] second = trainer.train(matrix.getX(), matrix.getY(), Map.of("seed", 3)).predictAll(matrix.getX());

        assertThat(first).containsExactly(second);
    }

    @Test
    void nonNumericHyperparameter_rejected() {
        CandidateTrainer trainer = registry.get(Algorithm.DECISION_TREE);

        assertThatThrownBy(() -> trainer.train(matrix.getX(), matrix.getY(), Map.of("maxDepth", "deep")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("maxDepth");
    }

    @ParameterizedTest
    @EnumSource(Algorithm.class)
    void validate_acceptsDefaultsAndRejectsNonNumericSeed(Algorithm algorithm) {
        CandidateTrainer trainer = registry.get(algorithm);

        trainer.validate(Map.of());
        assertThatThrownBy(() -> trainer.validate(Map.of("seed", "random")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("seed");
    }

    @Test
    void validate_rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> registry.get(Algorithm.GRADIENT_BOOSTED).validate(Map.of("learningRate", 0)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("learningRate must be greater than 0");
        assertThatThrownBy(() -> registry.get(Algorithm.EXTRA_TREES).validate(Map.of("nEstimators", -5)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("nEstimators must be at least 1");
        assertThatThrownBy(() -> registry.get(Algorithm.LOG_REG).validate(Map.of("epochs", 0)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> registry.get(Algorithm.RANDOM_FOREST).validate(Map.of("maxFeatures", "most")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("maxFeatures");
        assertThatThrownBy(() -> registry.get(Algorithm.ISOLATION_FOREST).validate(Map.of("numTrees", 0)))
                .isInstanceOf(ValidationException.class);
    }

    @ParameterizedTest
    @EnumSource(Algorithm.class)
    void train_onInterruptedThread_abortsWithCancellation(Algorithm algorithm) {
        CandidateTrainer trainer = registry.get(algorithm);
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> trainer.train(matrix.getX(), matrix.getY(), Map.of()))
                    .isInstanceOf(CancellationException.class);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void registry_reportsSupportedAlgorithms() {
        assertThat(registry.supportedAlgorithms()).containsExactlyInAnyOrder(Algorithm.values());
        assertThat(registry.supports(null)).isFalse();
        assertThatThrownBy(() -> new TrainerRegistry(List.of()).get(Algorithm.LOG_REG))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void maxFeatures_resolvesNamedAndFractionalValues() {
        assertThat(Hyperparams.resolveMaxFeatures(Map.of(), 16, "sqrt")).isEqualTo(4);
        assertThat(Hyperparams.resolveMaxFeatures(Map.of("maxFeatures", "0.5"), 10, "sqrt")).isEqualTo(5);
        assertThat(Hyperparams.resolveMaxFeatures(Map.of("maxFeatures", 3), 10, "sqrt")).isEqualTo(3);
        assertThat(Hyperparams.resolveMaxFeatures(Map.of("maxFeatures", "all"), 10, "sqrt")).isEqualTo(10);
    }
}
