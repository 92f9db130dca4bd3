package com.sensor.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.sensor.anomaly.config.AerospikeConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * Resume point per ingestion source. Written only after a batch has been fully processed.
 */
@Repository
public class CursorRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public CursorRepository(AerospikeClient client,
                            @Qualifier("aerospikeNamespace") String namespace,
                            @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                            @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public String findCursor(String sourceName) {
        Key key = new Key(namespace, AerospikeConfig.SET_INGESTION_CURSORS, sourceName);
        Record record = client.get(readPolicy, key);
        return record == null ? null : record.getString("cursor");
    }

    public void saveCursor(String sourceName, String cursor) {
        Key key = new Key(namespace, AerospikeConfig.SET_INGESTION_CURSORS, sourceName);
        client.put(writePolicy, key,
                new Bin("source", sourceName),
                new Bin("cursor", cursor),
                new Bin("updatedAt", System.currentTimeMillis()));
    }
}
