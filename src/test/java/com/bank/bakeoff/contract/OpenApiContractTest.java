package com.bank.bakeoff.contract;

import com.aerospike.client.AerospikeClient;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract test that validates the generated OpenAPI document.
 * Ensures all endpoints and critical schemas are present,
 * protecting consumers from accidental schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class OpenApiContractTest {

    // Replaces the connecting client so the context starts without an Aerospike node
    @MockBean
    private AerospikeClient aerospikeClient;

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> paths = json.read("$.paths");

        // Dataset endpoints
        assertThat(paths).containsKey("/api/v1/datasets");
        assertThat(paths).containsKey("/api/v1/datasets/{datasetId}");

        // Model endpoints
        assertThat(paths).containsKey("/api/v1/models");
        assertThat(paths).containsKey("/api/v1/models/{modelId}");
        assertThat(paths).containsKey("/api/v1/models/{modelId}/versions");
        assertThat(paths).containsKey("/api/v1/models/versions/{versionId}");
        assertThat(paths).containsKey("/api/v1/models/{modelId}/champion");

        // Bake-off endpoints
        assertThat(paths).containsKey("/api/v1/bakeoffs");
        assertThat(paths).containsKey("/api/v1/bakeoffs/{bakeoffId}");
        assertThat(paths).containsKey("/api/v1/bakeoffs/{bakeoffId}/candidates");
        assertThat(paths).containsKey("/api/v1/bakeoffs/{bakeoffId}/candidates/{candidateIndex}/train");
        assertThat(paths).containsKey("/api/v1/bakeoffs/{bakeoffId}/finalize");
        assertThat(paths).containsKey("/api/v1/bakeoffs/{bakeoffId}/champion");
        assertThat(paths).containsKey("/api/v1/bakeoffs/{bakeoffId}/fail");

        // Scoring run endpoints
        assertThat(paths).containsKey("/api/v1/runs");
        assertThat(paths).containsKey("/api/v1/runs/{runId}");
        assertThat(paths).containsKey("/api/v1/runs/{runId}/findings");
        assertThat(paths).containsKey("/api/v1/runs/{runId}/findings/{wireId}");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKey("Bakeoff");
        assertThat(schemas).containsKey("StartBakeoffRequest");
        assertThat(schemas).containsKey("RubricConfig");
        assertThat(schemas).containsKey("ModelVersion");
        assertThat(schemas).containsKey("ScoringRun");
        assertThat(schemas).containsKey("Finding");
    }

    @Test
    void openApiSpec_bakeoffAndFindingSchemas_haveRequiredFields() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());

        Map<String, Object> bakeoffProps = json.read("$.components.schemas.Bakeoff.properties");
        assertThat(bakeoffProps).containsKey("status");
        assertThat(bakeoffProps).containsKey("candidateVersionIds");
        assertThat(bakeoffProps).containsKey("championVersionId");
        assertThat(bakeoffProps).containsKey("narrativeShort");
        assertThat(bakeoffProps).containsKey("progress");

        Map<String, Object> findingProps = json.read("$.components.schemas.Finding.properties");
        assertThat(findingProps).containsKey("wireId");
        assertThat(findingProps).containsKey("rank");
        assertThat(findingProps).containsKey("score");
        assertThat(findingProps).containsKey("reasonCodes");
    }
}
