package com.bank.bakeoff.service;

import com.bank.bakeoff.config.ScoringConfig;
import com.bank.bakeoff.engine.ModelArtifact;
import com.bank.bakeoff.engine.features.FeatureMatrix;
import com.bank.bakeoff.engine.features.FeatureMatrixBuilder;
import com.bank.bakeoff.engine.features.SchemaInferrer;
import com.bank.bakeoff.engine.trainer.LogisticRegressionModel;
import com.bank.bakeoff.exception.ValidationException;
import com.bank.bakeoff.model.*;
import com.bank.bakeoff.storage.BlobStore;
import com.bank.bakeoff.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScoringPipelineServiceTest {

    private static final String ARTIFACT_URL = "blob://models/B-1/0-log_reg.json";

    @Mock private DatasetService datasetService;
    @Mock private ModelService modelService;
    @Mock private BlobStore blobStore;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CsvParsingService csvParsingService = new CsvParsingService();
    private ScoringPipelineService service;

    private Dataset dataset;
    private TabularData wires;

    @BeforeEach
    void setUp() throws Exception {
        service = new ScoringPipelineService(datasetService, modelService, csvParsingService, blobStore,
                new ScoringConfig(), objectMapper);

        // 1000 wires, anomalies at rows 0, 100, ..., 900
        wires = TestDataFactory.wires(1000, 100);
        dataset = TestDataFactory.dataset("D-1", "IsAnomaly");
        when(datasetService.getDataset("D-1")).thenReturn(dataset);

        ModelVersion version = TestDataFactory.version("V-1", 0, Algorithm.LOG_REG, TestDataFactory.metrics(0.9, 0.5, 0.8));
        version.setArtifactBlobUrl(ARTIFACT_URL);
        when(modelService.getVersion("V-1")).thenReturn(version);
        when(blobStore.download(ARTIFACT_URL)).thenReturn(objectMapper.writeValueAsBytes(artifact(wires)));
    }

    @Test
    void reviewRate_flagsTopOnePercentAsRankedFindings() {
        when(datasetService.loadRows(dataset)).thenReturn(wires);

        ScoringResult result = service.runScoringPipeline("D-1", "V-1", 0.01, null, 200);

        List<Finding> findings = result.getFindings();
        assertThat(findings).hasSize(10);
        assertThat(findings).extracting(Finding::getRank).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
        for (int i = 1; i < findings.size(); i++) {
            assertThat(findings.get(i - 1).getScore()).isGreaterThan(findings.get(i).getScore());
        }
        assertThat(findings.get(0).getWireId()).isEqualTo("W-000900");
        assertThat(findings.get(0).getPredictedLabel()).isEqualTo(1);
        assertThat(findings.get(0).getReasonCodes()).extracting(ReasonCode::getCode).contains("HighAmountVsBaseline");

        ScoringSummary summary = result.getSummary();
        assertThat(summary.getFlaggedCount()).isEqualTo(10);
        assertThat(summary.getRowCount()).isEqualTo(1000);
        assertThat(summary.getThresholdUsed()).isEqualTo(findings.get(9).getScore());
        assertThat(summary.getLabelMetrics().getRecall()).isEqualTo(1.0);
        assertThat(summary.getLabelMetrics().getPrecision()).isEqualTo(1.0);
        assertThat(summary.getLabelMetrics().getPositives()).isEqualTo(10);
    }

    @Test
    void scoredCsv_appendsScoreAndFlagColumns() {
        when(datasetService.loadRows(dataset)).thenReturn(wires);

        ScoringResult result = service.runScoringPipeline("D-1", "V-1", 0.01, null, 200);

        TabularData scored = csvParsingService.parse(result.getScoredCsv(), "csv");
        assertThat(scored.getHeaders()).containsExactly("WireID", "Amount", "Hour", "IsAnomaly", "AnomalyScore", "Flagged");
        assertThat(scored.size()).isEqualTo(1000);
        assertThat(scored.getRows().get(100).get("Flagged")).isEqualTo("1");
        assertThat(scored.getRows().get(101).get("Flagged")).isEqualTo("0");
        assertThat(scored.getRows().stream().filter(r -> "1".equals(r.get("Flagged")))).hasSize(10);
    }

    @Test
    void previewLimit_capsFindingsButNotFlaggedCount() {
        when(datasetService.loadRows(dataset)).thenReturn(wires);

        ScoringResult result = service.runScoringPipeline("D-1", "V-1", 0.01, null, 3);

        assertThat(result.getFindings()).hasSize(3);
        assertThat(result.getSummary().getFlaggedCount()).isEqualTo(10);
        assertThat(result.getSummary().getFindingCount()).isEqualTo(3);
    }

    @Test
    void explicitThreshold_overridesReviewRate() {
        when(datasetService.loadRows(dataset)).thenReturn(wires);

        ScoringResult result = service.runScoringPipeline("D-1", "V-1", 0.5, 0.5, 200);

        assertThat(result.getSummary().getFlaggedCount()).isEqualTo(10);
        assertThat(result.getSummary().getThresholdUsed()).isEqualTo(0.5);
    }

    @Test
    void datasetMissingTrainingColumns_rejected() {
        List<Map<String, String>> rows = new ArrayList<>();
        Map<String, String> row = new LinkedHashMap<>();
        row.put("WireID", "W-1");
        row.put("Amount", "100");
        rows.add(row);
        when(datasetService.loadRows(dataset)).thenReturn(new TabularData(List.of("WireID", "Amount"), rows));

        assertThatThrownBy(() -> service.prepare("D-1", "V-1"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("missing columns")
                .hasMessageContaining("Hour");
    }

    @Test
    void datasetWithoutWireIdColumn_usesRowPositions() {
        List<Map<String, String>> rows = new ArrayList<>();
        for (Map<String, String> wire : wires.getRows()) {
            Map<String, String> copy = new LinkedHashMap<>(wire);
            copy.remove("WireID");
            rows.add(copy);
        }
        when(datasetService.loadRows(dataset)).thenReturn(new TabularData(List.of("Amount", "Hour", "IsAnomaly"), rows));

        ScoringResult result = service.runScoringPipeline("D-1", "V-1", 0.01, null, 200);

        assertThat(result.getFindings().get(0).getWireId()).isEqualTo("row-900");
    }

    private static ModelArtifact artifact(TabularData training) {
        FeatureMatrix matrix = FeatureMatrixBuilder.buildForTraining(training, SchemaInferrer.infer(training), "IsAnomaly");
        // Amount, Hour, Amount_zScore, Amount_log: only the log amount drives the score
        LogisticRegressionModel model = new LogisticRegressionModel(new double[] {0.0, 0.0, 0.0, 1.0}, -10.0);
        return ModelArtifact.builder()
                .algorithm(Algorithm.LOG_REG)
                .hyperparams(Map.of())
                .featureNames(matrix.getFeatureNames())
                .encodings(matrix.getEncodings())
                .featureMeans(matrix.featureMeans())
                .model(model)
                .trainingRows(matrix.getRowCount())
                .trainedAt(1_000L)
                .build();
    }
}
