package com.bank.bakeoff.controller;

import com.bank.bakeoff.exception.ValidationException;
import com.bank.bakeoff.model.CreateModelRequest;
import com.bank.bakeoff.model.Model;
import com.bank.bakeoff.model.ModelVersion;
import com.bank.bakeoff.model.VersionSelection;
import com.bank.bakeoff.service.ModelService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Models, their trained versions and the champion pointer")
public class ModelController {

    private final ModelService modelService;

    public ModelController(ModelService modelService) {
        this.modelService = modelService;
    }

    @Operation(summary = "Create a model", description = "A model groups the versions produced by its bake-offs.")
    @PostMapping
    public ResponseEntity<Model> create(@RequestBody CreateModelRequest request) {
        Model model = modelService.createModel(request.getName(), request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(model);
    }

    @Operation(summary = "List models")
    @GetMapping
    public ResponseEntity<List<Model>> list() {
        return ResponseEntity.ok(modelService.listModels());
    }

    @Operation(summary = "Get model")
    @GetMapping("/{modelId}")
    public ResponseEntity<Model> get(@Parameter(description = "Model ID") @PathVariable String modelId) {
        return ResponseEntity.ok(modelService.getModel(modelId));
    }

    @Operation(summary = "List model versions",
            description = "Every candidate trained for this model, including failed ones, newest first.")
    @GetMapping("/{modelId}/versions")
    public ResponseEntity<List<ModelVersion>> listVersions(
            @Parameter(description = "Model ID") @PathVariable String modelId) {
        return ResponseEntity.ok(modelService.listVersions(modelId));
    }

    @Operation(summary = "Get model version", description = "Metrics, feature importance and artifact location.")
    @GetMapping("/versions/{versionId}")
    public ResponseEntity<ModelVersion> getVersion(
            @Parameter(description = "Model version ID") @PathVariable String versionId) {
        return ResponseEntity.ok(modelService.getVersion(versionId));
    }

    @Operation(summary = "Set champion version",
            description = "Points the model at a version and clears the champion flag on all others.")
    @PostMapping("/{modelId}/champion")
    public ResponseEntity<Model> setChampion(
            @Parameter(description = "Model ID") @PathVariable String modelId,
            @RequestBody VersionSelection selection) {
        if (selection.getVersionId() == null || selection.getVersionId().isBlank()) {
            throw new ValidationException("versionId is required");
        }
        return ResponseEntity.ok(modelService.setChampion(modelId, selection.getVersionId()));
    }
}
