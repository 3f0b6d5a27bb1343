package com.bank.bakeoff.service;

import com.bank.bakeoff.config.ScoringConfig;
import com.bank.bakeoff.engine.ModelArtifact;
import com.bank.bakeoff.engine.features.CellValues;
import com.bank.bakeoff.engine.features.FeatureMatrixBuilder;
import com.bank.bakeoff.engine.features.SchemaInferrer;
import com.bank.bakeoff.engine.scoring.ReasonCodeGenerator;
import com.bank.bakeoff.engine.scoring.ThresholdSelector;
import com.bank.bakeoff.engine.trainer.TrainedModel;
import com.bank.bakeoff.exception.PipelineException;
import com.bank.bakeoff.exception.ValidationException;
import com.bank.bakeoff.model.Dataset;
import com.bank.bakeoff.model.Finding;
import com.bank.bakeoff.model.ModelVersion;
import com.bank.bakeoff.model.ScoringResult;
import com.bank.bakeoff.model.ScoringSummary;
import com.bank.bakeoff.model.TabularData;
import com.bank.bakeoff.storage.BlobStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Scores every row of a dataset with one model version.
 *
 * Flow:
 * 1. prepare: resolve dataset and version, load the artifact and rows, check that the
 *    dataset has every column the model was trained on (nothing is persisted yet)
 * 2. execute: encode rows with the training-time encodings, score, pick the threshold,
 *    rank flagged rows, compute label metrics when labels exist, build findings and
 *    the scored CSV
 */
@Service
public class ScoringPipelineService {

    private static final Logger log = LoggerFactory.getLogger(ScoringPipelineService.class);

    private final DatasetService datasetService;
    private final ModelService modelService;
    private final CsvParsingService csvParsingService;
    private final BlobStore blobStore;
    private final ScoringConfig scoringConfig;
    private final ObjectMapper objectMapper;

    public ScoringPipelineService(DatasetService datasetService,
                                  ModelService modelService,
                                  CsvParsingService csvParsingService,
                                  BlobStore blobStore,
                                  ScoringConfig scoringConfig,
                                  ObjectMapper objectMapper) {
        this.datasetService = datasetService;
        this.modelService = modelService;
        this.csvParsingService = csvParsingService;
        this.blobStore = blobStore;
        this.scoringConfig = scoringConfig;
        this.objectMapper = objectMapper;
    }

    /** Validated inputs of one scoring call. */
    public record ScoringInput(Dataset dataset, ModelVersion version, ModelArtifact artifact, TabularData data) {
    }

    public ScoringResult runScoringPipeline(String datasetId, String modelVersionId, double reviewRate,
                                            Double threshold, int previewLimit) {
        return execute(prepare(datasetId, modelVersionId), null, reviewRate, threshold, previewLimit);
    }

    /**
     * Resolve and validate everything a scoring call needs. Throws before any run exists.
     */
    public ScoringInput prepare(String datasetId, String modelVersionId) {
        Dataset dataset = datasetService.getDataset(datasetId);
        ModelVersion version = modelService.getVersion(modelVersionId);
        if (version.isFailed() || version.getArtifactBlobUrl() == null) {
            throw new ValidationException("Model version " + modelVersionId + " failed training and cannot score");
        }

        ModelArtifact artifact = readArtifact(version);
        TabularData data = datasetService.loadRows(dataset);
        List<String> missing = FeatureMatrixBuilder.missingColumns(artifact.getEncodings(), data.getHeaders());
        if (!missing.isEmpty()) {
            throw new ValidationException("Dataset " + datasetId + " is missing columns required by model version "
                    + modelVersionId + ": " + missing);
        }
        if (data.size() == 0) {
            throw new ValidationException("Dataset " + datasetId + " has no rows");
        }
        return new ScoringInput(dataset, version, artifact, data);
    }

    @Observed(name = "scoring.execute", contextualName = "execute-scoring")
    public ScoringResult execute(ScoringInput input, String runId, double reviewRate,
                                 Double threshold, int previewLimit) {
        TabularData data = input.data();
        ModelArtifact artifact = input.artifact();
        TrainedModel model = artifact.getModel();
        int n = data.size();

        double[][] x = FeatureMatrixBuilder.encodeRows(data, artifact.getEncodings());
        double[] scores = model.predictAll(x);
        for (int i = 0; i < n; i++) {
            scores[i] = clamp(scores[i]);
        }

        ThresholdSelector.Selection selection = ThresholdSelector.select(scores, reviewRate, threshold);
        int[] flaggedRows = selection.flaggedRows();
        boolean[] flaggedMask = selection.flaggedMask(n);

        ScoringSummary.LabelMetrics labelMetrics = labelMetrics(input.dataset(), data, flaggedRows);

        String wireIdColumn = SchemaInferrer.detectWireIdColumn(data.getHeaders());
        int findingCount = Math.min(flaggedRows.length, previewLimit);
        List<Finding> findings = new ArrayList<>(findingCount);
        for (int rank = 0; rank < findingCount; rank++) {
            int row = flaggedRows[rank];
            findings.add(Finding.builder()
                    .runId(runId)
                    .wireId(wireId(data, row, wireIdColumn))
                    .rank(rank + 1)
                    .score(scores[row])
                    .predictedLabel(1)
                    .reasonCodes(ReasonCodeGenerator.explain(model, x[row], artifact.getFeatureNames(),
                            artifact.getFeatureMeans(), scoringConfig.getMaxReasonCodes()))
                    .build());
        }

        ScoringSummary summary = ScoringSummary.builder()
                .reviewRate(reviewRate)
                .thresholdUsed(selection.thresholdUsed())
                .flaggedCount(flaggedRows.length)
                .rowCount(n)
                .findingCount(findings.size())
                .labelMetrics(labelMetrics)
                .build();

        log.info("Scored {} rows of dataset {} with version {}: flagged={}, threshold={}, findings={}",
                n, input.dataset().getId(), input.version().getId(),
                flaggedRows.length, selection.thresholdUsed(), findings.size());

        return ScoringResult.builder()
                .scoredCsv(csvParsingService.writeScored(data, scores, flaggedMask))
                .findings(findings)
                .summary(summary)
                .build();
    }

    private ModelArtifact readArtifact(ModelVersion version) {
        try {
            return objectMapper.readValue(blobStore.download(version.getArtifactBlobUrl()), ModelArtifact.class);
        } catch (IOException e) {
            throw new PipelineException("Failed to read artifact of model version " + version.getId(), e);
        }
    }

    private static ScoringSummary.LabelMetrics labelMetrics(Dataset dataset, TabularData data, int[] flaggedRows) {
        String labelColumn = dataset.getLabelColumn();
        if (!dataset.isLabelPresent() || labelColumn == null || !data.getHeaders().contains(labelColumn)) {
            return null;
        }
        int positives = 0;
        for (int i = 0; i < data.size(); i++) {
            positives += CellValues.parseLabel(data.getRows().get(i).get(labelColumn));
        }
        int truePositives = 0;
        for (int row : flaggedRows) {
            truePositives += CellValues.parseLabel(data.getRows().get(row).get(labelColumn));
        }
        double precision = flaggedRows.length > 0 ? (double) truePositives / flaggedRows.length : 0.0;
        double recall = positives > 0 ? (double) truePositives / positives : 0.0;
        double f1 = precision + recall > 0 ? 2 * precision * recall / (precision + recall) : 0.0;
        return ScoringSummary.LabelMetrics.builder()
                .precision(round4(precision))
                .recall(round4(recall))
                .f1(round4(f1))
                .truePositives(truePositives)
                .positives(positives)
                .build();
    }

    private static String wireId(TabularData data, int row, String wireIdColumn) {
        if (wireIdColumn != null) {
            String value = data.getRows().get(row).get(wireIdColumn);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return "row-" + row;
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) return 0.0;
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
