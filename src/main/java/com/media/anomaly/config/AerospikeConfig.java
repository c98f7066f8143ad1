package com.media.anomaly.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AerospikeConfig {

    // chat id -> country code, maintained by the source enrichment job
    public static final String SET_SOURCE_COUNTRIES = "tg_countries";
    public static final String BIN_COUNTRY = "country";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:media}")
    private String namespace;

    @Value("${aerospike.read-timeout-ms:1000}")
    private int readTimeoutMs;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 100;
        clientPolicy.timeout = 5000;

        // Lookups happen inline with detection, keep them short
        clientPolicy.readPolicyDefault.totalTimeout = readTimeoutMs;
        clientPolicy.readPolicyDefault.socketTimeout = readTimeoutMs / 2;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = readTimeoutMs;
        policy.socketTimeout = readTimeoutMs / 2;
        policy.maxRetries = 1;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
