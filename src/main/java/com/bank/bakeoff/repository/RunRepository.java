package com.bank.bakeoff.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.bakeoff.config.AerospikeConfig;
import com.bank.bakeoff.model.RunStatus;
import com.bank.bakeoff.model.ScoringRun;
import com.bank.bakeoff.model.ScoringSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class RunRepository {

    private static final Logger log = LoggerFactory.getLogger(RunRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final JsonCodec json = new JsonCodec();

    public RunRepository(AerospikeClient client,
                         @Qualifier("aerospikeNamespace") String namespace,
                         @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                         @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(ScoringRun run) {
        Key key = new Key(namespace, AerospikeConfig.SET_SCORING_RUNS, run.getId());
        client.put(writePolicy, key,
                new Bin("id", run.getId()),
                new Bin("datasetId", run.getDatasetId()),
                new Bin("versionId", run.getModelVersionId()),
                new Bin("status", run.getStatus().name()),
                new Bin("outputsUrl", run.getOutputsBlobUrl()),
                new Bin("summaryJson", json.write(run.getSummary())),
                new Bin("errorMessage", run.getErrorMessage()),
                new Bin("createdAt", run.getCreatedAt()),
                new Bin("updatedAt", run.getUpdatedAt()));
    }

    public ScoringRun findById(String id) {
        Key key = new Key(namespace, AerospikeConfig.SET_SCORING_RUNS, id);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<ScoringRun> findAll() {
        List<ScoringRun> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_SCORING_RUNS,
                (key, record) -> {
                    try {
                        ScoringRun run = mapRecord(record);
                        synchronized (results) {
                            results.add(run);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read scoring run record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(ScoringRun::getCreatedAt).reversed());
        return results;
    }

    private ScoringRun mapRecord(Record record) {
        return ScoringRun.builder()
                .id(record.getString("id"))
                .datasetId(record.getString("datasetId"))
                .modelVersionId(record.getString("versionId"))
                .status(RunStatus.valueOf(record.getString("status")))
                .outputsBlobUrl(record.getString("outputsUrl"))
                .summary(json.read(record.getString("summaryJson"), ScoringSummary.class))
                .errorMessage(record.getString("errorMessage"))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .build();
    }
}
