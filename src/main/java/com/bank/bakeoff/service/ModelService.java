package com.bank.bakeoff.service;

import com.bank.bakeoff.exception.ConflictException;
import com.bank.bakeoff.exception.NotFoundException;
import com.bank.bakeoff.exception.ValidationException;
import com.bank.bakeoff.model.Model;
import com.bank.bakeoff.model.ModelVersion;
import com.bank.bakeoff.repository.ModelRepository;
import com.bank.bakeoff.repository.ModelVersionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
public class ModelService {

    private static final Logger log = LoggerFactory.getLogger(ModelService.class);
    private static final int CHAMPION_ATTEMPTS = 5;

    private final ModelRepository modelRepository;
    private final ModelVersionRepository versionRepository;

    public ModelService(ModelRepository modelRepository,
                        ModelVersionRepository versionRepository) {
        this.modelRepository = modelRepository;
        this.versionRepository = versionRepository;
    }

    public Model createModel(String name, String description) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Model name is required");
        }
        long now = System.currentTimeMillis();
        Model model = Model.builder()
                .id(UUID.randomUUID().toString())
                .name(name.trim())
                .description(description)
                .createdAt(now)
                .updatedAt(now)
                .build();
        modelRepository.save(model);
        log.info("Created model {} ({})", model.getId(), model.getName());
        return model;
    }

    public Model getModel(String modelId) {
        Model model = modelRepository.findById(modelId);
        if (model == null) {
            throw NotFoundException.of("Model", modelId);
        }
        return model;
    }

    public List<Model> listModels() {
        return modelRepository.findAll();
    }

    public List<ModelVersion> listVersions(String modelId) {
        getModel(modelId);
        return versionRepository.findByModelId(modelId);
    }

    public ModelVersion getVersion(String versionId) {
        ModelVersion version = versionRepository.findById(versionId);
        if (version == null) {
            throw NotFoundException.of("Model version", versionId);
        }
        return version;
    }

    /**
     * Make {@code versionId} the model's champion. The model's champion pointer is written
     * with a generation check and is the source of truth; the per-version flags are then
     * synced to whatever the pointer says, so racing promotions leave exactly one flag set.
     */
    public Model setChampion(String modelId, String versionId) {
        getModel(modelId);
        ModelVersion version = getVersion(versionId);
        if (!modelId.equals(version.getModelId())) {
            throw new ValidationException("Version " + versionId + " does not belong to model " + modelId);
        }
        if (version.isFailed()) {
            throw new ValidationException("Version " + versionId + " failed training and cannot be champion");
        }

        boolean written = false;
        for (int attempt = 1; attempt <= CHAMPION_ATTEMPTS && !written; attempt++) {
            written = modelRepository.compareAndSetChampion(getModel(modelId), versionId);
        }
        if (!written) {
            throw new ConflictException("Model " + modelId + " champion kept changing; retry the promotion");
        }

        Model synced = syncChampionFlags(modelId);
        log.info("Model {} champion set to version {} ({})", modelId, versionId, version.getAlgorithm());
        return synced;
    }

    /**
     * Sets the champion flag on the version the model points at and clears it everywhere else.
     * Repeats when the pointer moved while flags were being written.
     */
    private Model syncChampionFlags(String modelId) {
        Model before = getModel(modelId);
        for (int attempt = 1; attempt <= CHAMPION_ATTEMPTS; attempt++) {
            String championId = before.getChampionVersionId();
            for (ModelVersion v : versionRepository.findByModelId(modelId)) {
                boolean shouldBeChampion = v.getId().equals(championId);
                if (v.isChampion() != shouldBeChampion) {
                    versionRepository.updateChampionFlag(v.getId(), shouldBeChampion);
                }
            }
            Model after = getModel(modelId);
            if (after.getGeneration() == before.getGeneration()) {
                return after;
            }
            before = after;
        }
        log.warn("Model {} champion flags may lag the pointer after {} sync attempts", modelId, CHAMPION_ATTEMPTS);
        return before;
    }
}
