package com.bank.bakeoff.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.bakeoff.config.AerospikeConfig;
import com.bank.bakeoff.model.Bakeoff;
import com.bank.bakeoff.model.BakeoffProgress;
import com.bank.bakeoff.model.BakeoffStatus;
import com.bank.bakeoff.model.RubricConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Bake-off records. Every state change after creation goes through
 * {@link #compareAndSet}, a write conditioned on the record generation that was read,
 * so concurrent writers cannot silently overwrite each other.
 */
@Repository
public class BakeoffRepository {

    private static final Logger log = LoggerFactory.getLogger(BakeoffRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final JsonCodec json = new JsonCodec();

    public BakeoffRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                             @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void create(Bakeoff bakeoff) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        client.put(policy, key(bakeoff.getId()), bins(bakeoff));
    }

    public Bakeoff findById(String id) {
        Record record = client.get(readPolicy, key(id));
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * @return false when the record changed since {@code bakeoff} was read
     */
    public boolean compareAndSet(Bakeoff bakeoff) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        policy.generation = bakeoff.getGeneration();
        policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        try {
            client.put(policy, key(bakeoff.getId()), bins(bakeoff));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.debug("Generation mismatch writing bakeoff {} (expected gen {})",
                        bakeoff.getId(), bakeoff.getGeneration());
                return false;
            }
            throw e;
        }
    }

    public List<Bakeoff> findAll(String modelId) {
        return scan(modelId, null);
    }

    public List<Bakeoff> findByStatus(BakeoffStatus status) {
        return scan(null, status);
    }

    private List<Bakeoff> scan(String modelId, BakeoffStatus status) {
        List<Bakeoff> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_BAKEOFFS,
                (key, record) -> {
                    try {
                        if (modelId != null && !modelId.equals(record.getString("modelId"))) return;
                        if (status != null && !status.name().equals(record.getString("status"))) return;
                        Bakeoff bakeoff = mapRecord(record);
                        synchronized (results) {
                            results.add(bakeoff);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read bakeoff record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(Bakeoff::getCreatedAt).reversed());
        return results;
    }

    private Key key(String id) {
        return new Key(namespace, AerospikeConfig.SET_BAKEOFFS, id);
    }

    private Bin[] bins(Bakeoff bakeoff) {
        return new Bin[] {
                new Bin("id", bakeoff.getId()),
                new Bin("modelId", bakeoff.getModelId()),
                new Bin("datasetId", bakeoff.getDatasetId()),
                new Bin("rubricJson", json.write(bakeoff.getRubric())),
                new Bin("status", bakeoff.getStatus().name()),
                new Bin("candVerIds", json.write(bakeoff.getCandidateVersionIds())),
                new Bin("championVerId", bakeoff.getChampionVersionId()),
                new Bin("narrShort", bakeoff.getNarrativeShort()),
                new Bin("narrLong", bakeoff.getNarrativeLong()),
                new Bin("error", bakeoff.getError()),
                new Bin("progressJson", json.write(bakeoff.getProgress())),
                new Bin("createdAt", bakeoff.getCreatedAt()),
                new Bin("updatedAt", bakeoff.getUpdatedAt())
        };
    }

    private Bakeoff mapRecord(Record record) {
        List<String> versionIds = json.read(record.getString("candVerIds"), new TypeReference<List<String>>() {});
        return Bakeoff.builder()
                .id(record.getString("id"))
                .modelId(record.getString("modelId"))
                .datasetId(record.getString("datasetId"))
                .rubric(json.read(record.getString("rubricJson"), RubricConfig.class))
                .status(BakeoffStatus.valueOf(record.getString("status")))
                .candidateVersionIds(versionIds != null ? new ArrayList<>(versionIds) : new ArrayList<>())
                .championVersionId(record.getString("championVerId"))
                .narrativeShort(record.getString("narrShort"))
                .narrativeLong(record.getString("narrLong"))
                .error(record.getString("error"))
                .progress(json.read(record.getString("progressJson"), BakeoffProgress.class))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .generation(record.generation)
                .build();
    }
}
