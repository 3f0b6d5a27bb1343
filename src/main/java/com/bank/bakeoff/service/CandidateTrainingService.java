package com.bank.bakeoff.service;

import com.bank.bakeoff.config.BakeoffConfig;
import com.bank.bakeoff.engine.ModelArtifact;
import com.bank.bakeoff.engine.features.FeatureMatrix;
import com.bank.bakeoff.engine.metrics.MetricsCalculator;
import com.bank.bakeoff.engine.metrics.PermutationImportance;
import com.bank.bakeoff.engine.trainer.CandidateTrainer;
import com.bank.bakeoff.engine.trainer.TrainedModel;
import com.bank.bakeoff.engine.trainer.TrainerRegistry;
import com.bank.bakeoff.model.CandidateConfig;
import com.bank.bakeoff.model.CandidateMetrics;
import com.bank.bakeoff.model.CandidateResult;
import com.bank.bakeoff.model.FeatureWeight;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Trains and evaluates one candidate. A training error or a timeout never escapes:
 * it comes back as a failed {@link CandidateResult} with zeroed metrics.
 */
@Service
public class CandidateTrainingService {

    private static final Logger log = LoggerFactory.getLogger(CandidateTrainingService.class);

    private final TrainerRegistry trainerRegistry;
    private final AsyncTaskExecutor trainingExecutor;
    private final BakeoffConfig bakeoffConfig;
    private final ObjectMapper objectMapper;

    public CandidateTrainingService(TrainerRegistry trainerRegistry,
                                    @Qualifier("trainingExecutor") AsyncTaskExecutor trainingExecutor,
                                    BakeoffConfig bakeoffConfig,
                                    ObjectMapper objectMapper) {
        this.trainerRegistry = trainerRegistry;
        this.trainingExecutor = trainingExecutor;
        this.bakeoffConfig = bakeoffConfig;
        this.objectMapper = objectMapper;
    }

    public CandidateResult train(FeatureMatrix matrix, CandidateConfig config, int candidateIndex, double reviewRate) {
        Map<String, Object> hyperparams = config.getHyperparams() != null
                ? config.getHyperparams() : new HashMap<>();
        long start = System.currentTimeMillis();

        try {
            CandidateTrainer trainer = trainerRegistry.get(config.getAlgorithm());
            // Fit, evaluation and importance all run on the worker so the budget bounds the whole candidate
            Future<CandidateResult> future = trainingExecutor.submit(
                    () -> fitAndEvaluate(trainer, matrix, config, hyperparams, candidateIndex, reviewRate));
            CandidateResult result = awaitResult(future, config);

            long elapsed = System.currentTimeMillis() - start;
            result.setTrainingTimeMs(elapsed);
            log.info("Candidate {} ({}) trained in {}ms: recall@RR={}, precision@RR={}, prAuc={}",
                    candidateIndex, config.getAlgorithm().getCode(), elapsed,
                    result.getMetrics().getRecallAtReviewRate(), result.getMetrics().getPrecisionAtReviewRate(),
                    result.getMetrics().getPrAuc());
            return result;
        } catch (Exception e) {
            long elapsed = System.currentTimeMillis() - start;
            log.warn("Candidate {} ({}) failed after {}ms: {}",
                    candidateIndex, config.getAlgorithm(), elapsed, e.getMessage());
            return CandidateResult.builder()
                    .candidateIndex(candidateIndex)
                    .algorithm(config.getAlgorithm())
                    .hyperparams(hyperparams)
                    .metrics(CandidateMetrics.zero())
                    .importance(List.of())
                    .failed(true)
                    .errorMessage(describe(e))
                    .trainingTimeMs(elapsed)
                    .build();
        }
    }

    private CandidateResult fitAndEvaluate(CandidateTrainer trainer, FeatureMatrix matrix, CandidateConfig config,
                                           Map<String, Object> hyperparams, int candidateIndex,
                                           double reviewRate) throws JsonProcessingException {
        TrainedModel model = trainer.train(matrix.getX(), matrix.getY(), hyperparams);

        double[] scores = model.predictAll(matrix.getX());
        CandidateMetrics metrics = MetricsCalculator.evaluate(
                config.getAlgorithm(), scores, matrix.getY(), reviewRate);
        List<FeatureWeight> importance = PermutationImportance.compute(
                model, matrix.getX(), matrix.getY(), matrix.getFeatureNames());

        ModelArtifact artifact = ModelArtifact.builder()
                .algorithm(config.getAlgorithm())
                .hyperparams(hyperparams)
                .featureNames(matrix.getFeatureNames())
                .encodings(matrix.getEncodings())
                .featureMeans(matrix.featureMeans())
                .model(model)
                .trainingRows(matrix.getRowCount())
                .trainedAt(System.currentTimeMillis())
                .build();

        return CandidateResult.builder()
                .candidateIndex(candidateIndex)
                .algorithm(config.getAlgorithm())
                .hyperparams(hyperparams)
                .metrics(metrics)
                .importance(importance)
                .serializedArtifact(objectMapper.writeValueAsString(artifact))
                .build();
    }

    private CandidateResult awaitResult(Future<CandidateResult> future, CandidateConfig config) throws Exception {
        long timeout = bakeoffConfig.getTrainingTimeoutSeconds();
        try {
            return future.get(timeout, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException("Training " + config.getAlgorithm().getCode()
                    + " exceeded " + timeout + "s budget");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) throw (Exception) cause;
            throw e;
        }
    }

    private static String describe(Exception e) {
        if (e instanceof JsonProcessingException) {
            return "Failed to serialize model artifact: " + ((JsonProcessingException) e).getOriginalMessage();
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
