package com.bank.bakeoff.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.bakeoff.config.AerospikeConfig;
import com.bank.bakeoff.model.Algorithm;
import com.bank.bakeoff.model.CandidateMetrics;
import com.bank.bakeoff.model.FeatureWeight;
import com.bank.bakeoff.model.ModelVersion;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Repository
public class ModelVersionRepository {

    private static final Logger log = LoggerFactory.getLogger(ModelVersionRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final JsonCodec json = new JsonCodec();

    public ModelVersionRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    /**
     * Writes the version. Version ids are derived from (bakeoff, candidate index), so a
     * retried candidate overwrites its own orphaned record instead of adding another.
     */
    public void save(ModelVersion version) {
        Key key = new Key(namespace, AerospikeConfig.SET_MODEL_VERSIONS, version.getId());
        client.put(writePolicy, key,
                new Bin("id", version.getId()),
                new Bin("modelId", version.getModelId()),
                new Bin("bakeoffId", version.getBakeoffId()),
                new Bin("candIndex", version.getCandidateIndex()),
                new Bin("algorithm", version.getAlgorithm().getCode()),
                new Bin("hyperparams", json.write(version.getHyperparams())),
                new Bin("datasetId", version.getTrainedDatasetId()),
                new Bin("artifactUrl", version.getArtifactBlobUrl()),
                new Bin("metricsJson", json.write(version.getMetrics())),
                new Bin("importance", json.write(version.getImportance())),
                new Bin("failed", version.isFailed() ? 1 : 0),
                new Bin("errorMessage", version.getErrorMessage()),
                new Bin("champion", version.isChampion() ? 1 : 0),
                new Bin("createdAt", version.getCreatedAt()));
    }

    public ModelVersion findById(String id) {
        Key key = new Key(namespace, AerospikeConfig.SET_MODEL_VERSIONS, id);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Batch read preserving the order of {@code ids}; missing versions are skipped.
     */
    public List<ModelVersion> findByIds(List<String> ids) {
        if (ids.isEmpty()) return List.of();
        Key[] keys = ids.stream()
                .map(id -> new Key(namespace, AerospikeConfig.SET_MODEL_VERSIONS, id))
                .toArray(Key[]::new);
        Record[] records = client.get(null, keys);
        List<ModelVersion> results = new ArrayList<>(ids.size());
        for (int i = 0; i < records.length; i++) {
            if (records[i] == null) {
                log.warn("Model version {} referenced but not found", ids.get(i));
                continue;
            }
            results.add(mapRecord(records[i]));
        }
        return results;
    }

    public List<ModelVersion> findByModelId(String modelId) {
        List<ModelVersion> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_MODEL_VERSIONS,
                (key, record) -> {
                    try {
                        if (!modelId.equals(record.getString("modelId"))) return;
                        ModelVersion version = mapRecord(record);
                        synchronized (results) {
                            results.add(version);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read model version record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(ModelVersion::getCreatedAt).reversed()
                .thenComparingInt(ModelVersion::getCandidateIndex));
        return results;
    }

    public void updateChampionFlag(String versionId, boolean champion) {
        Key key = new Key(namespace, AerospikeConfig.SET_MODEL_VERSIONS, versionId);
        client.put(writePolicy, key, new Bin("champion", champion ? 1 : 0));
    }

    private ModelVersion mapRecord(Record record) {
        return ModelVersion.builder()
                .id(record.getString("id"))
                .modelId(record.getString("modelId"))
                .bakeoffId(record.getString("bakeoffId"))
                .candidateIndex(record.getInt("candIndex"))
                .algorithm(Algorithm.fromCode(record.getString("algorithm")))
                .hyperparams(json.read(record.getString("hyperparams"), new TypeReference<Map<String, Object>>() {}))
                .trainedDatasetId(record.getString("datasetId"))
                .artifactBlobUrl(record.getString("artifactUrl"))
                .metrics(json.read(record.getString("metricsJson"), CandidateMetrics.class))
                .importance(json.read(record.getString("importance"), new TypeReference<List<FeatureWeight>>() {}))
                .failed(record.getLong("failed") == 1)
                .errorMessage(record.getString("errorMessage"))
                .champion(record.getLong("champion") == 1)
                .createdAt(record.getLong("createdAt"))
                .build();
    }
}
