package com.bank.bakeoff.service;

import com.bank.bakeoff.config.MetricsConfig;
import com.bank.bakeoff.config.ScoringConfig;
import com.bank.bakeoff.exception.NotFoundException;
import com.bank.bakeoff.exception.ValidationException;
import com.bank.bakeoff.model.Finding;
import com.bank.bakeoff.model.Model;
import com.bank.bakeoff.model.RunStatus;
import com.bank.bakeoff.model.ScoringResult;
import com.bank.bakeoff.model.ScoringRun;
import com.bank.bakeoff.model.StartScoringRequest;
import com.bank.bakeoff.repository.FindingRepository;
import com.bank.bakeoff.repository.RunRepository;
import com.bank.bakeoff.storage.BlobStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Scoring runs: CREATED -> SCORING -> SCORED, or FAILED with the error message.
 * Input problems are rejected before the run record is created.
 */
@Service
public class ScoringRunService {

    private static final Logger log = LoggerFactory.getLogger(ScoringRunService.class);

    private final ScoringPipelineService pipelineService;
    private final ModelService modelService;
    private final RunRepository runRepository;
    private final FindingRepository findingRepository;
    private final BlobStore blobStore;
    private final ScoringConfig scoringConfig;
    private final MetricsConfig metricsConfig;

    public ScoringRunService(ScoringPipelineService pipelineService,
                             ModelService modelService,
                             RunRepository runRepository,
                             FindingRepository findingRepository,
                             BlobStore blobStore,
                             ScoringConfig scoringConfig,
                             MetricsConfig metricsConfig) {
        this.pipelineService = pipelineService;
        this.modelService = modelService;
        this.runRepository = runRepository;
        this.findingRepository = findingRepository;
        this.blobStore = blobStore;
        this.scoringConfig = scoringConfig;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "scoring.start", contextualName = "start-scoring")
    public ScoringRun startScoring(StartScoringRequest request) {
        if (request.getDatasetId() == null || request.getDatasetId().isBlank()) {
            throw new ValidationException("datasetId is required");
        }
        String versionId = resolveVersionId(request);
        double reviewRate = request.getReviewRate() != null
                ? request.getReviewRate() : scoringConfig.getDefaultReviewRate();
        if (!(reviewRate > 0 && reviewRate <= 1)) {
            throw new ValidationException("reviewRate must be in (0, 1], got " + reviewRate);
        }
        if (request.getThreshold() != null && !(request.getThreshold() >= 0 && request.getThreshold() <= 1)) {
            throw new ValidationException("threshold must be in [0, 1], got " + request.getThreshold());
        }
        int previewLimit = resolvePreviewLimit(request.getPreviewLimit());

        ScoringPipelineService.ScoringInput input = pipelineService.prepare(request.getDatasetId(), versionId);

        long now = System.currentTimeMillis();
        ScoringRun run = ScoringRun.builder()
                .id(UUID.randomUUID().toString())
                .datasetId(request.getDatasetId())
                .modelVersionId(versionId)
                .status(RunStatus.CREATED)
                .createdAt(now)
                .updatedAt(now)
                .build();
        runRepository.save(run);

        run = transition(run.toBuilder().status(RunStatus.SCORING));
        try {
            ScoringResult result = pipelineService.execute(input, run.getId(), reviewRate,
                    request.getThreshold(), previewLimit);
            String outputsUrl = blobStore.upload("runs/" + run.getId() + "/scored.csv", result.getScoredCsv());
            findingRepository.saveAll(run.getId(), result.getFindings());

            run = transition(run.toBuilder()
                    .status(RunStatus.SCORED)
                    .outputsBlobUrl(outputsUrl)
                    .summary(result.getSummary()));
            metricsConfig.recordScoringRun(RunStatus.SCORED.name());
            metricsConfig.recordFlagged(result.getSummary().getFlaggedCount(), result.getSummary().getRowCount());
            log.info("Run {} scored: {} of {} rows flagged", run.getId(),
                    result.getSummary().getFlaggedCount(), result.getSummary().getRowCount());
            return run;
        } catch (RuntimeException e) {
            log.error("Run {} failed: {}", run.getId(), e.getMessage(), e);
            run = transition(run.toBuilder()
                    .status(RunStatus.FAILED)
                    .errorMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            metricsConfig.recordScoringRun(RunStatus.FAILED.name());
            return run;
        }
    }

    public ScoringRun getRun(String runId) {
        ScoringRun run = runRepository.findById(runId);
        if (run == null) {
            throw NotFoundException.of("Run", runId);
        }
        return run;
    }

    public List<ScoringRun> listRuns() {
        return runRepository.findAll();
    }

    public List<Finding> listFindings(String runId) {
        getRun(runId);
        return findingRepository.findByRunId(runId);
    }

    public Finding getFinding(String runId, String wireId) {
        getRun(runId);
        Finding finding = findingRepository.findOne(runId, wireId);
        if (finding == null) {
            throw new NotFoundException("Finding " + wireId + " not found in run " + runId);
        }
        return finding;
    }

    private String resolveVersionId(StartScoringRequest request) {
        if (request.getModelVersionId() != null && !request.getModelVersionId().isBlank()) {
            return request.getModelVersionId();
        }
        if (request.getModelId() == null || request.getModelId().isBlank()) {
            throw new ValidationException("Either modelVersionId or modelId is required");
        }
        Model model = modelService.getModel(request.getModelId());
        if (model.getChampionVersionId() == null) {
            throw new ValidationException("Model " + model.getId() + " has no champion version");
        }
        return model.getChampionVersionId();
    }

    private int resolvePreviewLimit(Integer requested) {
        if (requested == null) {
            return scoringConfig.getDefaultPreviewLimit();
        }
        if (requested < 1 || requested > scoringConfig.getMaxPreviewLimit()) {
            throw new ValidationException("previewLimit must be between 1 and " + scoringConfig.getMaxPreviewLimit());
        }
        return requested;
    }

    private ScoringRun transition(ScoringRun.ScoringRunBuilder builder) {
        ScoringRun run = builder.updatedAt(System.currentTimeMillis()).build();
        runRepository.save(run);
        return run;
    }
}
