package com.bank.bakeoff.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.bakeoff.config.AerospikeConfig;
import com.bank.bakeoff.model.ColumnSchema;
import com.bank.bakeoff.model.Dataset;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class DatasetRepository {

    private static final Logger log = LoggerFactory.getLogger(DatasetRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final JsonCodec json = new JsonCodec();

    public DatasetRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                             @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(Dataset dataset) {
        Key key = new Key(namespace, AerospikeConfig.SET_DATASETS, dataset.getId());
        client.put(writePolicy, key,
                new Bin("id", dataset.getId()),
                new Bin("name", dataset.getName()),
                new Bin("srcFormat", dataset.getSourceFormat()),
                new Bin("blobUrl", dataset.getBlobUrl()),
                new Bin("schemaJson", json.write(dataset.getSchema())),
                new Bin("rowCount", dataset.getRowCount()),
                new Bin("labelPresent", dataset.isLabelPresent() ? 1 : 0),
                new Bin("labelColumn", dataset.getLabelColumn()),
                new Bin("createdAt", dataset.getCreatedAt()));
    }

    public Dataset findById(String id) {
        Key key = new Key(namespace, AerospikeConfig.SET_DATASETS, id);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<Dataset> findAll() {
        List<Dataset> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DATASETS,
                (key, record) -> {
                    try {
                        Dataset dataset = mapRecord(record);
                        synchronized (results) {
                            results.add(dataset);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read dataset record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(Dataset::getCreatedAt).reversed());
        return results;
    }

    private Dataset mapRecord(Record record) {
        return Dataset.builder()
                .id(record.getString("id"))
                .name(record.getString("name"))
                .sourceFormat(record.getString("srcFormat"))
                .blobUrl(record.getString("blobUrl"))
                .schema(json.read(record.getString("schemaJson"), new TypeReference<List<ColumnSchema>>() {}))
                .rowCount(record.getInt("rowCount"))
                .labelPresent(record.getLong("labelPresent") == 1)
                .labelColumn(record.getString("labelColumn"))
                .createdAt(record.getLong("createdAt"))
                .build();
    }
}
