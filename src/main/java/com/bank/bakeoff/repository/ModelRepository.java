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
import com.bank.bakeoff.model.Model;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class ModelRepository {

    private static final Logger log = LoggerFactory.getLogger(ModelRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public ModelRepository(AerospikeClient client,
                           @Qualifier("aerospikeNamespace") String namespace,
                           @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                           @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(Model model) {
        Key key = new Key(namespace, AerospikeConfig.SET_MODELS, model.getId());
        client.put(writePolicy, key,
                new Bin("id", model.getId()),
                new Bin("name", model.getName()),
                new Bin("description", model.getDescription()),
                new Bin("championVerId", model.getChampionVersionId()),
                new Bin("createdAt", model.getCreatedAt()),
                new Bin("updatedAt", model.getUpdatedAt()));
    }

    public Model findById(String id) {
        Key key = new Key(namespace, AerospikeConfig.SET_MODELS, id);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<Model> findAll() {
        List<Model> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_MODELS,
                (key, record) -> {
                    try {
                        Model model = mapRecord(record);
                        synchronized (results) {
                            results.add(model);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read model record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(Model::getCreatedAt).reversed());
        return results;
    }

    /**
     * Points the model at a new champion, only if the record is still at the generation
     * {@code model} was read with.
     *
     * @return false when another writer changed the model first
     */
    public boolean compareAndSetChampion(Model model, String versionId) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        policy.generation = model.getGeneration();
        policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        Key key = new Key(namespace, AerospikeConfig.SET_MODELS, model.getId());
        try {
            client.put(policy, key,
                    new Bin("championVerId", versionId),
                    new Bin("updatedAt", System.currentTimeMillis()));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.debug("Generation mismatch writing champion of model {} (expected gen {})",
                        model.getId(), model.getGeneration());
                return false;
            }
            throw e;
        }
    }

    private Model mapRecord(Record record) {
        return Model.builder()
                .id(record.getString("id"))
                .name(record.getString("name"))
                .description(record.getString("description"))
                .championVersionId(record.getString("championVerId"))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .generation(record.generation)
                .build();
    }
}
