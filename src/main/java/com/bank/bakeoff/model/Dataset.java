package com.bank.bakeoff.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "An uploaded tabular dataset with its inferred schema")
public class Dataset {

    private String id;

    @Schema(description = "Dataset name", example = "wires_2024_q1")
    private String name;

    @Schema(description = "Source file format", example = "csv")
    private String sourceFormat;

    private String blobUrl;

    private List<ColumnSchema> schema;

    @Schema(description = "Number of data rows", example = "1000")
    private int rowCount;

    @Schema(description = "Whether a ground-truth label column was detected")
    private boolean labelPresent;

    @Schema(description = "Detected label column", example = "IsAnomaly")
    private String labelColumn;

    private long createdAt;
}
