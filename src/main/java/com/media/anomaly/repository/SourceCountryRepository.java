package com.media.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.media.anomaly.config.AerospikeConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * Read-only view of the chat id -> country code mapping.
 */
@Repository
public class SourceCountryRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;

    public SourceCountryRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
    }

    /**
     * Country code registered for the chat, or null when the chat is unknown.
     */
    public String findCountry(long chatId) {
        Key key = new Key(namespace, AerospikeConfig.SET_SOURCE_COUNTRIES, chatId);
        Record record = client.get(readPolicy, key, AerospikeConfig.BIN_COUNTRY);
        if (record == null) return null;
        return record.getString(AerospikeConfig.BIN_COUNTRY);
    }
}
