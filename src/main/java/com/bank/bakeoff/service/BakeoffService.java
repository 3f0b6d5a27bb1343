package com.bank.bakeoff.service;

import com.bank.bakeoff.config.BakeoffConfig;
import com.bank.bakeoff.config.MetricsConfig;
import com.bank.bakeoff.engine.features.FeatureMatrix;
import com.bank.bakeoff.engine.features.FeatureMatrixBuilder;
import com.bank.bakeoff.engine.rubric.NarrativeGenerator;
import com.bank.bakeoff.engine.rubric.RubricEngine;
import com.bank.bakeoff.engine.trainer.TrainerRegistry;
import com.bank.bakeoff.exception.ConflictException;
import com.bank.bakeoff.exception.NotFoundException;
import com.bank.bakeoff.exception.PipelineException;
import com.bank.bakeoff.exception.ValidationException;
import com.bank.bakeoff.model.Bakeoff;
import com.bank.bakeoff.model.BakeoffProgress;
import com.bank.bakeoff.model.BakeoffStatus;
import com.bank.bakeoff.model.CandidateConfig;
import com.bank.bakeoff.model.CandidateMetrics;
import com.bank.bakeoff.model.CandidateResult;
import com.bank.bakeoff.model.CandidateSummary;
import com.bank.bakeoff.model.ColumnSchema;
import com.bank.bakeoff.model.Dataset;
import com.bank.bakeoff.model.ExecutionMode;
import com.bank.bakeoff.model.FinalizeResult;
import com.bank.bakeoff.model.ModelVersion;
import com.bank.bakeoff.model.Narrative;
import com.bank.bakeoff.model.RubricConfig;
import com.bank.bakeoff.model.RubricConstraints;
import com.bank.bakeoff.model.RubricOutcome;
import com.bank.bakeoff.model.StartBakeoffRequest;
import com.bank.bakeoff.model.TabularData;
import com.bank.bakeoff.repository.BakeoffRepository;
import com.bank.bakeoff.repository.ModelVersionRepository;
import com.bank.bakeoff.storage.BlobStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Orchestrates a bake-off: several candidate configurations trained on one dataset,
 * ranked by a rubric, with the winner promoted to model champion.
 *
 * Lifecycle: QUEUED -> RUNNING -> COMPLETED, or FAILED from either non-terminal state.
 * 1. start: validate, persist QUEUED, hand the id to the background worker (batch mode)
 *    or build features right away (incremental mode)
 * 2. begin: encode the dataset once, upload the feature matrix, move to RUNNING
 * 3. trainOne: train the next candidate in order and append its version id
 * 4. finalize: rank the persisted versions, write the narrative, promote the champion
 *
 * Every state change after creation is a generation-checked write, so a racing or
 * repeated call ends in a ConflictException instead of a lost update.
 */
@Service
public class BakeoffService {

    private static final Logger log = LoggerFactory.getLogger(BakeoffService.class);

    private static final int FAIL_ATTEMPTS = 3;

    private final BakeoffRepository bakeoffRepository;
    private final ModelVersionRepository versionRepository;
    private final DatasetService datasetService;
    private final ModelService modelService;
    private final CandidateTrainingService trainingService;
    private final TrainerRegistry trainerRegistry;
    private final RubricEngine rubricEngine;
    private final NarrativeGenerator narrativeGenerator;
    private final BlobStore blobStore;
    private final BakeoffConfig bakeoffConfig;
    private final MetricsConfig metricsConfig;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;

    public BakeoffService(BakeoffRepository bakeoffRepository,
                          ModelVersionRepository versionRepository,
                          DatasetService datasetService,
                          ModelService modelService,
                          CandidateTrainingService trainingService,
                          TrainerRegistry trainerRegistry,
                          RubricEngine rubricEngine,
                          NarrativeGenerator narrativeGenerator,
                          BlobStore blobStore,
                          BakeoffConfig bakeoffConfig,
                          MetricsConfig metricsConfig,
                          ObjectMapper objectMapper,
                          ApplicationEventPublisher eventPublisher) {
        this.bakeoffRepository = bakeoffRepository;
        this.versionRepository = versionRepository;
        this.datasetService = datasetService;
        this.modelService = modelService;
        this.trainingService = trainingService;
        this.trainerRegistry = trainerRegistry;
        this.rubricEngine = rubricEngine;
        this.narrativeGenerator = narrativeGenerator;
        this.blobStore = blobStore;
        this.bakeoffConfig = bakeoffConfig;
        this.metricsConfig = metricsConfig;
        this.objectMapper = objectMapper;
        this.eventPublisher = eventPublisher;
    }

    @Observed(name = "bakeoff.start", contextualName = "start-bakeoff")
    public Bakeoff start(StartBakeoffRequest request) {
        if (request.getDatasetId() == null || request.getDatasetId().isBlank()) {
            throw new ValidationException("datasetId is required");
        }
        if (request.getModelId() == null || request.getModelId().isBlank()) {
            throw new ValidationException("modelId is required");
        }
        List<CandidateConfig> candidates = normalizeCandidates(request.getCandidates());

        Dataset dataset = datasetService.getDataset(request.getDatasetId());
        modelService.getModel(request.getModelId());

        String labelColumn = request.getLabelColumn() != null ? request.getLabelColumn() : dataset.getLabelColumn();
        if (labelColumn == null || labelColumn.isBlank()) {
            throw new ValidationException("No label column given and none detected in dataset " + dataset.getId());
        }
        boolean labelKnown = dataset.getSchema() != null && dataset.getSchema().stream()
                .map(ColumnSchema::getName)
                .anyMatch(labelColumn::equals);
        if (!labelKnown) {
            throw new ValidationException("Label column not found in dataset: " + labelColumn);
        }

        double reviewRate = request.getReviewRate() != null
                ? request.getReviewRate() : bakeoffConfig.getDefaultReviewRate();
        if (!(reviewRate > 0 && reviewRate <= 1)) {
            throw new ValidationException("reviewRate must be in (0, 1], got " + reviewRate);
        }

        RubricConfig rubric = resolveRubric(request.getRubric());
        rubricEngine.validate(rubric, bakeoffConfig.getWeightTotal());

        ExecutionMode mode = request.getExecutionMode() != null ? request.getExecutionMode() : ExecutionMode.BATCH;
        long now = System.currentTimeMillis();
        Bakeoff bakeoff = Bakeoff.builder()
                .id(UUID.randomUUID().toString())
                .modelId(request.getModelId())
                .datasetId(dataset.getId())
                .rubric(rubric)
                .status(BakeoffStatus.QUEUED)
                .progress(BakeoffProgress.builder()
                        .candidateConfigs(candidates)
                        .labelColumn(labelColumn)
                        .reviewRate(reviewRate)
                        .executionMode(mode)
                        .build())
                .createdAt(now)
                .updatedAt(now)
                .build();
        bakeoffRepository.create(bakeoff);
        metricsConfig.recordBakeoffStarted(mode.name());

        log.info("Bakeoff {} queued: model={}, dataset={}, candidates={}, mode={}",
                bakeoff.getId(), bakeoff.getModelId(), dataset.getId(), candidates.size(), mode);

        if (mode == ExecutionMode.INCREMENTAL) {
            try {
                return begin(bakeoff.getId());
            } catch (ConflictException e) {
                throw e;
            } catch (RuntimeException e) {
                markFailed(bakeoff.getId(), e.getMessage());
                throw e;
            }
        }

        eventPublisher.publishEvent(new BakeoffQueuedEvent(bakeoff.getId()));
        return bakeoff;
    }

    /**
     * Encode the dataset once and move QUEUED to RUNNING. Already RUNNING is a no-op.
     */
    public Bakeoff begin(String bakeoffId) {
        Bakeoff bakeoff = getBakeoff(bakeoffId);
        if (bakeoff.getStatus() == BakeoffStatus.RUNNING) {
            return bakeoff;
        }
        if (bakeoff.getStatus() != BakeoffStatus.QUEUED) {
            throw new ConflictException("Bakeoff " + bakeoffId + " is " + bakeoff.getStatus() + ", expected QUEUED");
        }

        BakeoffProgress progress = bakeoff.getProgress();
        Dataset dataset = datasetService.getDataset(bakeoff.getDatasetId());
        TabularData data = datasetService.loadRows(dataset);
        if (data.size() == 0) {
            throw new ValidationException("Dataset has no rows");
        }

        FeatureMatrix matrix = FeatureMatrixBuilder.buildForTraining(data, dataset.getSchema(), progress.getLabelColumn());
        int positives = matrix.getPositiveCount();
        if (positives == 0) {
            throw new ValidationException("Label column \"" + progress.getLabelColumn() + "\" has no positive (1) labels");
        }
        if (positives == matrix.getRowCount()) {
            throw new ValidationException("Label column \"" + progress.getLabelColumn() + "\" has no negative (0) labels");
        }

        String featuresUrl = blobStore.upload("bakeoff/" + bakeoffId + "/features.json", toJson(matrix));

        Bakeoff running = bakeoff.toBuilder()
                .status(BakeoffStatus.RUNNING)
                .progress(progress.toBuilder()
                        .featuresBlobUrl(featuresUrl)
                        .featureCount(matrix.getFeatureNames().size())
                        .rowCount(matrix.getRowCount())
                        .build())
                .updatedAt(System.currentTimeMillis())
                .build();
        if (!bakeoffRepository.compareAndSet(running)) {
            throw new ConflictException("Bakeoff " + bakeoffId + " was modified while building features");
        }

        log.info("Bakeoff {} running: {} features, {} rows ({} positive)",
                bakeoffId, matrix.getFeatureNames().size(), matrix.getRowCount(), positives);
        return getBakeoff(bakeoffId);
    }

    /**
     * Train the candidate at {@code candidateIndex}, which must be the next untrained one.
     * Out-of-order and repeated calls are rejected before anything is written.
     */
    @Observed(name = "bakeoff.train_candidate", contextualName = "train-candidate")
    public CandidateSummary trainOne(String bakeoffId, int candidateIndex) {
        Bakeoff bakeoff = getBakeoff(bakeoffId);
        if (bakeoff.getStatus() != BakeoffStatus.RUNNING) {
            throw new ConflictException("Bakeoff " + bakeoffId + " is " + bakeoff.getStatus() + ", expected RUNNING");
        }
        BakeoffProgress progress = bakeoff.getProgress();
        List<CandidateConfig> configs = progress.getCandidateConfigs();
        int trained = bakeoff.getTrainedCount();
        if (trained >= configs.size()) {
            throw new ConflictException("All " + configs.size() + " candidates of bakeoff " + bakeoffId + " are already trained");
        }
        if (candidateIndex != trained) {
            throw new ConflictException("Candidate " + candidateIndex + " cannot be trained now; next expected index is "
                    + trained + " of " + configs.size());
        }

        FeatureMatrix matrix = loadFeatures(progress.getFeaturesBlobUrl());
        CandidateConfig config = configs.get(candidateIndex);
        CandidateResult result = trainingService.train(matrix, config, candidateIndex, progress.getReviewRate());

        String artifactUrl = null;
        if (!result.isFailed()) {
            artifactUrl = blobStore.upload(
                    "models/" + bakeoffId + "/" + candidateIndex + "-" + config.getAlgorithm().getCode() + ".json",
                    result.getSerializedArtifact().getBytes(StandardCharsets.UTF_8));
        }

        ModelVersion version = ModelVersion.builder()
                .id(versionIdFor(bakeoffId, candidateIndex))
                .modelId(bakeoff.getModelId())
                .bakeoffId(bakeoffId)
                .candidateIndex(candidateIndex)
                .algorithm(config.getAlgorithm())
                .hyperparams(result.getHyperparams())
                .trainedDatasetId(bakeoff.getDatasetId())
                .artifactBlobUrl(artifactUrl)
                .metrics(result.getMetrics())
                .importance(result.getImportance())
                .failed(result.isFailed())
                .errorMessage(result.getErrorMessage())
                .createdAt(System.currentTimeMillis())
                .build();
        versionRepository.save(version);

        List<String> versionIds = new ArrayList<>(bakeoff.getCandidateVersionIds());
        versionIds.add(version.getId());
        Bakeoff updated = bakeoff.toBuilder()
                .candidateVersionIds(versionIds)
                .updatedAt(System.currentTimeMillis())
                .build();
        if (!bakeoffRepository.compareAndSet(updated)) {
            throw new ConflictException("Bakeoff " + bakeoffId + " changed while candidate " + candidateIndex + " was training");
        }

        metricsConfig.recordCandidateTrained(config.getAlgorithm().getCode(), result.isFailed(), result.getTrainingTimeMs());
        log.info("Bakeoff {} candidate {}/{} ({}) recorded as version {}{}",
                bakeoffId, candidateIndex + 1, configs.size(), config.getAlgorithm().getCode(), version.getId(),
                result.isFailed() ? " [failed: " + result.getErrorMessage() + "]" : "");

        return toSummary(bakeoffId, version, versionIds.size(), configs.size());
    }

    /**
     * Rank every trained candidate, promote the champion and complete the bake-off.
     */
    @Observed(name = "bakeoff.finalize", contextualName = "finalize-bakeoff")
    public FinalizeResult finalizeBakeoff(String bakeoffId) {
        Bakeoff bakeoff = getBakeoff(bakeoffId);
        if (bakeoff.getStatus() != BakeoffStatus.RUNNING) {
            throw new ConflictException("Bakeoff " + bakeoffId + " is " + bakeoff.getStatus() + ", expected RUNNING");
        }
        int total = bakeoff.getCandidateCount();
        if (bakeoff.getTrainedCount() < total) {
            throw new ConflictException("Only " + bakeoff.getTrainedCount() + " of " + total
                    + " candidates trained for bakeoff " + bakeoffId);
        }

        List<ModelVersion> versions = versionRepository.findByIds(bakeoff.getCandidateVersionIds());
        if (versions.size() != total) {
            throw new PipelineException("Bakeoff " + bakeoffId + " references " + total
                    + " versions but only " + versions.size() + " were found");
        }

        List<CandidateResult> candidates = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            candidates.add(toCandidateResult(i, versions.get(i)));
        }

        RubricOutcome outcome = rubricEngine.apply(candidates, bakeoff.getRubric());
        if (outcome.getChampionIndex() < 0) {
            String message = "All " + total + " candidates failed to train";
            markFailed(bakeoffId, message);
            throw new PipelineException(message);
        }

        ModelVersion champion = versions.get(outcome.getChampionIndex());
        Narrative narrative = narrativeGenerator.generate(candidates, outcome, bakeoff.getRubric());

        Bakeoff completed = bakeoff.toBuilder()
                .status(BakeoffStatus.COMPLETED)
                .championVersionId(champion.getId())
                .narrativeShort(narrative.getNarrativeShort())
                .narrativeLong(narrative.getNarrativeLong())
                .updatedAt(System.currentTimeMillis())
                .build();
        if (!bakeoffRepository.compareAndSet(completed)) {
            throw new ConflictException("Bakeoff " + bakeoffId + " was modified during finalize");
        }

        modelService.setChampion(bakeoff.getModelId(), champion.getId());
        deleteFeaturesQuietly(bakeoffId, bakeoff.getProgress());
        metricsConfig.recordBakeoffFinished(BakeoffStatus.COMPLETED.name());

        log.info("Bakeoff {} completed: {}", bakeoffId, narrative.getNarrativeShort());

        return FinalizeResult.builder()
                .bakeoffId(bakeoffId)
                .championVersionId(champion.getId())
                .narrativeShort(narrative.getNarrativeShort())
                .narrativeLong(narrative.getNarrativeLong())
                .build();
    }

    /**
     * Background entry point: begin, train every remaining candidate, finalize.
     * Losing a race to another worker is not a failure of the bake-off.
     */
    public void runBatch(String bakeoffId) {
        try {
            Bakeoff bakeoff = begin(bakeoffId);
            for (int i = bakeoff.getTrainedCount(); i < bakeoff.getCandidateCount(); i++) {
                trainOne(bakeoffId, i);
            }
            finalizeBakeoff(bakeoffId);
        } catch (ConflictException e) {
            log.warn("Bakeoff {} batch run stopped on a concurrent update: {}", bakeoffId, e.getMessage());
        } catch (NotFoundException e) {
            log.warn("Bakeoff {} batch run skipped: {}", bakeoffId, e.getMessage());
        } catch (Exception e) {
            log.error("Bakeoff {} batch run failed: {}", bakeoffId, e.getMessage(), e);
            markFailed(bakeoffId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * Manual champion override for a completed bake-off.
     */
    public Bakeoff selectChampion(String bakeoffId, String versionId) {
        Bakeoff bakeoff = getBakeoff(bakeoffId);
        if (bakeoff.getStatus() != BakeoffStatus.COMPLETED) {
            throw new ConflictException("Bakeoff " + bakeoffId + " is " + bakeoff.getStatus() + ", expected COMPLETED");
        }
        if (versionId == null || !bakeoff.getCandidateVersionIds().contains(versionId)) {
            throw new ConflictException("Version " + versionId + " is not a candidate of bakeoff " + bakeoffId);
        }
        ModelVersion version = modelService.getVersion(versionId);
        if (version.isFailed()) {
            throw new ValidationException("Version " + versionId + " failed training and cannot be champion");
        }

        Bakeoff updated = bakeoff.toBuilder()
                .championVersionId(versionId)
                .updatedAt(System.currentTimeMillis())
                .build();
        if (!bakeoffRepository.compareAndSet(updated)) {
            throw new ConflictException("Bakeoff " + bakeoffId + " was modified concurrently");
        }
        modelService.setChampion(bakeoff.getModelId(), versionId);

        log.info("Bakeoff {} champion manually set to version {} ({})", bakeoffId, versionId, version.getAlgorithm());
        return getBakeoff(bakeoffId);
    }

    public Bakeoff fail(String bakeoffId, String reason) {
        Bakeoff bakeoff = getBakeoff(bakeoffId);
        if (bakeoff.getStatus().isTerminal()) {
            throw new ConflictException("Bakeoff " + bakeoffId + " is already " + bakeoff.getStatus());
        }
        String message = reason != null && !reason.isBlank() ? reason : "Marked failed by operator";
        if (!markFailed(bakeoffId, message)) {
            throw new ConflictException("Bakeoff " + bakeoffId + " could not be marked failed");
        }
        return getBakeoff(bakeoffId);
    }

    public Bakeoff getBakeoff(String bakeoffId) {
        Bakeoff bakeoff = bakeoffRepository.findById(bakeoffId);
        if (bakeoff == null) {
            throw NotFoundException.of("Bakeoff", bakeoffId);
        }
        return bakeoff;
    }

    public List<Bakeoff> listBakeoffs(String modelId) {
        return bakeoffRepository.findAll(modelId);
    }

    public List<CandidateSummary> listCandidates(String bakeoffId) {
        Bakeoff bakeoff = getBakeoff(bakeoffId);
        List<ModelVersion> versions = versionRepository.findByIds(bakeoff.getCandidateVersionIds());
        List<CandidateSummary> summaries = new ArrayList<>(versions.size());
        for (ModelVersion version : versions) {
            summaries.add(toSummary(bakeoffId, version, bakeoff.getTrainedCount(), bakeoff.getCandidateCount()));
        }
        return summaries;
    }

    /**
     * Moves a non-terminal bake-off to FAILED, re-reading on a lost generation check.
     *
     * @return true when this call wrote the FAILED state
     */
    boolean markFailed(String bakeoffId, String message) {
        for (int attempt = 1; attempt <= FAIL_ATTEMPTS; attempt++) {
            Bakeoff current = bakeoffRepository.findById(bakeoffId);
            if (current == null || current.getStatus().isTerminal()) {
                return false;
            }
            Bakeoff failed = current.toBuilder()
                    .status(BakeoffStatus.FAILED)
                    .error(message)
                    .updatedAt(System.currentTimeMillis())
                    .build();
            if (bakeoffRepository.compareAndSet(failed)) {
                metricsConfig.recordBakeoffFinished(BakeoffStatus.FAILED.name());
                log.error("Bakeoff {} failed: {}", bakeoffId, message);
                deleteFeaturesQuietly(bakeoffId, current.getProgress());
                return true;
            }
        }
        log.warn("Bakeoff {} could not be marked failed after {} attempts", bakeoffId, FAIL_ATTEMPTS);
        return false;
    }

    /**
     * Deterministic per (bake-off, index) so a retried candidate replaces its own orphan.
     */
    static String versionIdFor(String bakeoffId, int candidateIndex) {
        return UUID.nameUUIDFromBytes((bakeoffId + ":" + candidateIndex).getBytes(StandardCharsets.UTF_8)).toString();
    }

    private List<CandidateConfig> normalizeCandidates(List<CandidateConfig> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new ValidationException("At least one candidate is required");
        }
        List<CandidateConfig> normalized = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            CandidateConfig c = candidates.get(i);
            if (c == null || c.getAlgorithm() == null) {
                throw new ValidationException("Candidate " + i + " has no algorithm");
            }
            if (!trainerRegistry.supports(c.getAlgorithm())) {
                throw new ValidationException("Candidate " + i + " uses unsupported algorithm " + c.getAlgorithm().getCode());
            }
            Map<String, Object> hyperparams = c.getHyperparams() != null ? new HashMap<>(c.getHyperparams()) : new HashMap<>();
            try {
                trainerRegistry.get(c.getAlgorithm()).validate(hyperparams);
            } catch (ValidationException e) {
                throw new ValidationException("Candidate " + i + " (" + c.getAlgorithm().getCode() + "): " + e.getMessage());
            }
            normalized.add(new CandidateConfig(c.getAlgorithm(), hyperparams));
        }
        return normalized;
    }

    private RubricConfig resolveRubric(RubricConfig requested) {
        RubricConfig defaults = bakeoffConfig.copyOfDefaultRubric();
        if (requested == null) {
            return defaults;
        }
        return RubricConfig.builder()
                .constraints(requested.getConstraints() != null ? requested.getConstraints() : new RubricConstraints())
                .weights(requested.getWeights() != null && !requested.getWeights().isEmpty()
                        ? new LinkedHashMap<>(requested.getWeights()) : defaults.getWeights())
                .build();
    }

    private CandidateResult toCandidateResult(int index, ModelVersion version) {
        return CandidateResult.builder()
                .candidateIndex(index)
                .algorithm(version.getAlgorithm())
                .hyperparams(version.getHyperparams())
                .metrics(version.getMetrics() != null ? version.getMetrics() : CandidateMetrics.zero())
                .importance(version.getImportance() != null ? version.getImportance() : List.of())
                .failed(version.isFailed())
                .errorMessage(version.getErrorMessage())
                .build();
    }

    private CandidateSummary toSummary(String bakeoffId, ModelVersion version, int trainedCount, int total) {
        return CandidateSummary.builder()
                .bakeoffId(bakeoffId)
                .candidateIndex(version.getCandidateIndex())
                .versionId(version.getId())
                .algorithm(version.getAlgorithm())
                .metrics(version.getMetrics())
                .failed(version.isFailed())
                .errorMessage(version.getErrorMessage())
                .trainedCount(trainedCount)
                .totalCandidates(total)
                .build();
    }

    private FeatureMatrix loadFeatures(String featuresUrl) {
        if (featuresUrl == null) {
            throw new PipelineException("Feature matrix has not been built");
        }
        try {
            return objectMapper.readValue(blobStore.download(featuresUrl), FeatureMatrix.class);
        } catch (IOException e) {
            throw new PipelineException("Failed to read feature matrix " + featuresUrl, e);
        }
    }

    private byte[] toJson(FeatureMatrix matrix) {
        try {
            return objectMapper.writeValueAsBytes(matrix);
        } catch (JsonProcessingException e) {
            throw new PipelineException("Failed to serialize feature matrix", e);
        }
    }

    private void deleteFeaturesQuietly(String bakeoffId, BakeoffProgress progress) {
        if (progress == null || progress.getFeaturesBlobUrl() == null) return;
        try {
            blobStore.delete(progress.getFeaturesBlobUrl());
        } catch (RuntimeException e) {
            log.warn("Could not delete feature matrix of bakeoff {}: {}", bakeoffId, e.getMessage());
        }
    }
}
