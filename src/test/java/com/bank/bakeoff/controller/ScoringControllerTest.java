package com.bank.bakeoff.controller;

import com.bank.bakeoff.exception.NotFoundException;
import com.bank.bakeoff.exception.ValidationException;
import com.bank.bakeoff.model.*;
import com.bank.bakeoff.service.ScoringRunService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ScoringController.class)
class ScoringControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScoringRunService scoringRunService;

    @Test
    void start_returns201WithSummary() throws Exception {
        ScoringRun run = ScoringRun.builder()
                .id("R-1")
                .datasetId("D-1")
                .modelVersionId("V-1")
                .status(RunStatus.SCORED)
                .outputsBlobUrl("blob://runs/R-1/scored.csv")
                .summary(ScoringSummary.builder()
                        .reviewRate(0.01).thresholdUsed(0.91).flaggedCount(10).rowCount(1000).findingCount(10)
                        .build())
                .build();
        when(scoringRunService.startScoring(any(StartScoringRequest.class))).thenReturn(run);

        mockMvc.perform(post("/api/v1/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"datasetId\": \"D-1\", \"modelVersionId\": \"V-1\", \"reviewRate\": 0.01}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("SCORED"))
                .andExpect(jsonPath("$.summary.flaggedCount").value(10))
                .andExpect(jsonPath("$.summary.labelMetrics").doesNotExist());

        verify(scoringRunService).startScoring(argThat(r -> "V-1".equals(r.getModelVersionId())
                && r.getReviewRate() == 0.01));
    }

    @Test
    void start_missingColumns_returns400() throws Exception {
        when(scoringRunService.startScoring(any(StartScoringRequest.class)))
                .thenThrow(new ValidationException("Dataset D-1 is missing columns required by model version V-1: [Hour]"));

        mockMvc.perform(post("/api/v1/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"datasetId\": \"D-1\", \"modelVersionId\": \"V-1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Dataset D-1 is missing columns required by model version V-1: [Hour]"));
    }

    @Test
    void start_malformedJson_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"datasetId\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed JSON request"));
    }

    @Test
    void listFindings_returnsRankedFindings() throws Exception {
        when(scoringRunService.listFindings("R-1")).thenReturn(List.of(
                Finding.builder().runId("R-1").wireId("W-000900").rank(1).score(0.97).predictedLabel(1)
                        .reasonCodes(List.of(ReasonCode.builder()
                                .code("HighAmountVsBaseline").feature("Amount_log").direction("increase")
                                .contribution(0.8).featureValue(13.7).build()))
                        .build()));

        mockMvc.perform(get("/api/v1/runs/R-1/findings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].wireId").value("W-000900"))
                .andExpect(jsonPath("$[0].rank").value(1))
                .andExpect(jsonPath("$[0].reasonCodes[0].code").value("HighAmountVsBaseline"));
    }

    @Test
    void getFinding_unknownWire_returns404() throws Exception {
        when(scoringRunService.getFinding("R-1", "W-404"))
                .thenThrow(new NotFoundException("Finding W-404 not found in run R-1"));

        mockMvc.perform(get("/api/v1/runs/R-1/findings/W-404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Finding W-404 not found in run R-1"));
    }
}
