package com.bank.bakeoff.controller;

import com.bank.bakeoff.exception.PipelineException;
import com.bank.bakeoff.model.Dataset;
import com.bank.bakeoff.service.DatasetService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/api/v1/datasets")
@Tag(name = "Datasets", description = "Upload wire datasets and inspect their inferred schema")
public class DatasetController {

    private final DatasetService datasetService;

    public DatasetController(DatasetService datasetService) {
        this.datasetService = datasetService;
    }

    @Operation(summary = "Upload a dataset",
            description = "Parses a CSV file, infers column types, detects the label column and stores the file.")
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Dataset> upload(
            @Parameter(description = "CSV file with a header row")
            @RequestParam("file") MultipartFile file,
            @Parameter(description = "Display name; defaults to the file name", example = "wires-2024-q1")
            @RequestParam(required = false) String name) {
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new PipelineException("Failed to read uploaded file", e);
        }
        Dataset dataset = datasetService.register(name, file.getOriginalFilename(), content);
        return ResponseEntity.status(HttpStatus.CREATED).body(dataset);
    }

    @Operation(summary = "List datasets", description = "Newest first.")
    @GetMapping
    public ResponseEntity<List<Dataset>> list() {
        return ResponseEntity.ok(datasetService.listDatasets());
    }

    @Operation(summary = "Get dataset", description = "Returns the dataset record with its inferred schema.")
    @GetMapping("/{datasetId}")
    public ResponseEntity<Dataset> get(
            @Parameter(description = "Dataset ID") @PathVariable String datasetId) {
        return ResponseEntity.ok(datasetService.getDataset(datasetId));
    }
}
