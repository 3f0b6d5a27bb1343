package com.bank.bakeoff.controller;

import com.bank.bakeoff.exception.ValidationException;
import com.bank.bakeoff.model.Bakeoff;
import com.bank.bakeoff.model.BakeoffStatus;
import com.bank.bakeoff.model.CandidateSummary;
import com.bank.bakeoff.model.FailBakeoffRequest;
import com.bank.bakeoff.model.FinalizeResult;
import com.bank.bakeoff.model.StartBakeoffRequest;
import com.bank.bakeoff.model.VersionSelection;
import com.bank.bakeoff.service.BakeoffService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/bakeoffs")
@Tag(name = "Bake-offs", description = "Train candidate algorithms on a dataset and pick a champion by rubric")
public class BakeoffController {

    private final BakeoffService bakeoffService;

    public BakeoffController(BakeoffService bakeoffService) {
        this.bakeoffService = bakeoffService;
    }

    @Operation(summary = "Start a bake-off",
            description = "BATCH mode queues the bake-off for a background worker and returns 202 with the QUEUED record. " +
                    "INCREMENTAL mode builds the feature matrix right away and returns 201 with a RUNNING record; " +
                    "the caller then trains each candidate in order and finalizes.")
    @PostMapping
    public ResponseEntity<Bakeoff> start(@RequestBody StartBakeoffRequest request) {
        Bakeoff bakeoff = bakeoffService.start(request);
        HttpStatus status = bakeoff.getStatus() == BakeoffStatus.QUEUED
                ? HttpStatus.ACCEPTED : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(bakeoff);
    }

    @Operation(summary = "List bake-offs", description = "Newest first, optionally for one model.")
    @GetMapping
    public ResponseEntity<List<Bakeoff>> list(
            @Parameter(description = "Only bake-offs of this model")
            @RequestParam(required = false) String modelId) {
        return ResponseEntity.ok(bakeoffService.listBakeoffs(modelId));
    }

    @Operation(summary = "Get bake-off", description = "Status, progress, candidate version ids and narrative.")
    @GetMapping("/{bakeoffId}")
    public ResponseEntity<Bakeoff> get(@Parameter(description = "Bake-off ID") @PathVariable String bakeoffId) {
        return ResponseEntity.ok(bakeoffService.getBakeoff(bakeoffId));
    }

    @Operation(summary = "List trained candidates", description = "In candidate index order.")
    @GetMapping("/{bakeoffId}/candidates")
    public ResponseEntity<List<CandidateSummary>> listCandidates(
            @Parameter(description = "Bake-off ID") @PathVariable String bakeoffId) {
        return ResponseEntity.ok(bakeoffService.listCandidates(bakeoffId));
    }

    @Operation(summary = "Train one candidate",
            description = "Trains the candidate at the given index. Returns 409 unless the bake-off is RUNNING " +
                    "and the index is the next untrained one.")
    @PostMapping("/{bakeoffId}/candidates/{candidateIndex}/train")
    public ResponseEntity<CandidateSummary> trainCandidate(
            @Parameter(description = "Bake-off ID") @PathVariable String bakeoffId,
            @Parameter(description = "0-based candidate index", example = "0") @PathVariable int candidateIndex) {
        return ResponseEntity.ok(bakeoffService.trainOne(bakeoffId, candidateIndex));
    }

    @Operation(summary = "Finalize",
            description = "Ranks all trained candidates with the rubric, promotes the champion and completes the bake-off.")
    @PostMapping("/{bakeoffId}/finalize")
    public ResponseEntity<FinalizeResult> finalizeBakeoff(
            @Parameter(description = "Bake-off ID") @PathVariable String bakeoffId) {
        return ResponseEntity.ok(bakeoffService.finalizeBakeoff(bakeoffId));
    }

    @Operation(summary = "Override champion", description = "Pick another successful candidate of a completed bake-off.")
    @PostMapping("/{bakeoffId}/champion")
    public ResponseEntity<Bakeoff> selectChampion(
            @Parameter(description = "Bake-off ID") @PathVariable String bakeoffId,
            @RequestBody VersionSelection selection) {
        if (selection.getVersionId() == null || selection.getVersionId().isBlank()) {
            throw new ValidationException("versionId is required");
        }
        return ResponseEntity.ok(bakeoffService.selectChampion(bakeoffId, selection.getVersionId()));
    }

    @Operation(summary = "Mark failed", description = "Manually fail a stuck QUEUED or RUNNING bake-off.")
    @PostMapping("/{bakeoffId}/fail")
    public ResponseEntity<Bakeoff> fail(
            @Parameter(description = "Bake-off ID") @PathVariable String bakeoffId,
            @RequestBody(required = false) FailBakeoffRequest request) {
        return ResponseEntity.ok(bakeoffService.fail(bakeoffId, request != null ? request.getReason() : null));
    }
}
