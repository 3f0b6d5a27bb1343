package com.bank.bakeoff.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AerospikeConfig {

    public static final String SET_DATASETS = "datasets";
    public static final String SET_MODELS = "models";
    public static final String SET_MODEL_VERSIONS = "model_versions";
    public static final String SET_BAKEOFFS = "bakeoffs";
    public static final String SET_SCORING_RUNS = "scoring_runs";
    public static final String SET_FINDINGS = "findings";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:banking}")
    private String namespace;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 100;
        clientPolicy.timeout = 5000;

        clientPolicy.readPolicyDefault.totalTimeout = 5000;
        clientPolicy.readPolicyDefault.socketTimeout = 2000;

        // Feature matrices live in blobs, but version and findings records can still be large
        clientPolicy.writePolicyDefault.totalTimeout = 10000;
        clientPolicy.writePolicyDefault.socketTimeout = 5000;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 10000;
        policy.socketTimeout = 5000;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = 5000;
        policy.socketTimeout = 2000;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
