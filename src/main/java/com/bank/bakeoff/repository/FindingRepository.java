package com.bank.bakeoff.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.bank.bakeoff.config.AerospikeConfig;
import com.bank.bakeoff.exception.ConflictException;
import com.bank.bakeoff.model.Finding;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Findings of a run, stored as a single record keyed by run id. Writing them in one
 * put makes the batch all-or-nothing: a reader sees every finding of a run or none.
 */
@Repository
public class FindingRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final JsonCodec json = new JsonCodec();

    public FindingRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                             @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void saveAll(String runId, List<Finding> findings) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        try {
            client.put(policy, key(runId),
                    new Bin("runId", runId),
                    new Bin("count", findings.size()),
                    new Bin("findingsJson", json.write(findings)));
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                throw new ConflictException("Findings already written for run " + runId);
            }
            throw e;
        }
    }

    /**
     * @return findings ordered by rank, empty when the run has none
     */
    public List<Finding> findByRunId(String runId) {
        Record record = client.get(readPolicy, key(runId));
        if (record == null) return List.of();
        List<Finding> findings = json.read(record.getString("findingsJson"), new TypeReference<List<Finding>>() {});
        return findings != null ? findings : List.of();
    }

    public Finding findOne(String runId, String wireId) {
        return findByRunId(runId).stream()
                .filter(f -> wireId.equals(f.getWireId()))
                .findFirst()
                .orElse(null);
    }

    private Key key(String runId) {
        return new Key(namespace, AerospikeConfig.SET_FINDINGS, runId);
    }
}
