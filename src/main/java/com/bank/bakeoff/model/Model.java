package com.bank.bakeoff.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A named detection model; versions are produced by bake-offs")
public class Model {

    private String id;

    @Schema(description = "Model name", example = "Wire anomaly detector")
    private String name;

    private String description;

    @Schema(description = "Current champion version, if any")
    private String championVersionId;

    private long createdAt;
    private long updatedAt;

    @JsonIgnore
    private int generation;
}
