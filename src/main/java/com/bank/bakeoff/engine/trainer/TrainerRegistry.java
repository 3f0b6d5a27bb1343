package com.bank.bakeoff.engine.trainer;

import com.bank.bakeoff.exception.ValidationException;
import com.bank.bakeoff.model.Algorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Looks up the trainer for a candidate's algorithm.
 * Uses the Strategy pattern: every CandidateTrainer bean registers itself by algorithm.
 */
@Component
public class TrainerRegistry {

    private static final Logger log = LoggerFactory.getLogger(TrainerRegistry.class);

    private final Map<Algorithm, CandidateTrainer> trainers;

    public TrainerRegistry(List<CandidateTrainer> trainerBeans) {
        this.trainers = new EnumMap<>(Algorithm.class);
        for (CandidateTrainer trainer : trainerBeans) {
            trainers.put(trainer.getSupportedAlgorithm(), trainer);
            log.info("Registered candidate trainer: {} -> {}",
                    trainer.getSupportedAlgorithm().getCode(), trainer.getClass().getSimpleName());
        }
    }

    public CandidateTrainer get(Algorithm algorithm) {
        CandidateTrainer trainer = algorithm == null ? null : trainers.get(algorithm);
        if (trainer == null) {
            throw new ValidationException("No trainer registered for algorithm: " + algorithm);
        }
        return trainer;
    }

    public boolean supports(Algorithm algorithm) {
        return algorithm != null && trainers.containsKey(algorithm);
    }

    public Set<Algorithm> supportedAlgorithms() {
        return trainers.keySet();
    }
}
