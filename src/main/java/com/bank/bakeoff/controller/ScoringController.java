package com.bank.bakeoff.controller;

import com.bank.bakeoff.model.Finding;
import com.bank.bakeoff.model.ScoringRun;
import com.bank.bakeoff.model.StartScoringRequest;
import com.bank.bakeoff.service.ScoringRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/runs")
@Tag(name = "Scoring Runs", description = "Score a dataset with a model version and review the flagged wires")
public class ScoringController {

    private final ScoringRunService scoringRunService;

    public ScoringController(ScoringRunService scoringRunService) {
        this.scoringRunService = scoringRunService;
    }

    @Operation(summary = "Start a scoring run",
            description = "Scores every row of the dataset. Without modelVersionId the model's champion is used. " +
                    "Invalid input (missing columns, failed version) is rejected with 400 before a run is created; " +
                    "a failure while scoring is captured in a FAILED run.")
    @PostMapping
    public ResponseEntity<ScoringRun> start(@RequestBody StartScoringRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(scoringRunService.startScoring(request));
    }

    @Operation(summary = "List runs", description = "Newest first.")
    @GetMapping
    public ResponseEntity<List<ScoringRun>> list() {
        return ResponseEntity.ok(scoringRunService.listRuns());
    }

    @Operation(summary = "Get run", description = "Status, summary and scored output location.")
    @GetMapping("/{runId}")
    public ResponseEntity<ScoringRun> get(@Parameter(description = "Run ID") @PathVariable String runId) {
        return ResponseEntity.ok(scoringRunService.getRun(runId));
    }

    @Operation(summary = "List findings", description = "Flagged wires in rank order, capped at the run's preview limit.")
    @GetMapping("/{runId}/findings")
    public ResponseEntity<List<Finding>> listFindings(@Parameter(description = "Run ID") @PathVariable String runId) {
        return ResponseEntity.ok(scoringRunService.listFindings(runId));
    }

    @Operation(summary = "Get finding", description = "One flagged wire with its reason codes.")
    @GetMapping("/{runId}/findings/{wireId}")
    public ResponseEntity<Finding> getFinding(
            @Parameter(description = "Run ID") @PathVariable String runId,
            @Parameter(description = "Wire ID", example = "W-000123") @PathVariable String wireId) {
        return ResponseEntity.ok(scoringRunService.getFinding(runId, wireId));
    }
}
