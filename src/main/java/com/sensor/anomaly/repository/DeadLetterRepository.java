package com.sensor.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.sensor.anomaly.config.AerospikeConfig;
import com.sensor.anomaly.model.DeadLetter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Alert events that could not be delivered, kept for manual follow-up.
 */
@Repository
public class DeadLetterRepository {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final StateCodec codec;

    public DeadLetterRepository(AerospikeClient client,
                                @Qualifier("aerospikeNamespace") String namespace,
                                @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                StateCodec codec) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.codec = codec;
    }

    public void save(DeadLetter deadLetter) {
        String id = deadLetter.getEvent().getEventId() + ":" + deadLetter.getTransport();
        Key key = new Key(namespace, AerospikeConfig.SET_DEAD_LETTERS, id);
        try {
            client.put(writePolicy, key,
                    new Bin("eventJson", codec.writeEvent(deadLetter.getEvent())),
                    new Bin("transport", deadLetter.getTransport()),
                    new Bin("attempts", deadLetter.getAttempts()),
                    new Bin("lastError", deadLetter.getLastError()),
                    new Bin("failedAt", deadLetter.getFailedAt()));
        } catch (Exception e) {
            // Last resort: the event is only in the log now
            log.error("Failed to persist dead letter {}: {}", id, deadLetter, e);
        }
    }

    /**
     * Most recent dead letters first.
     */
    public List<DeadLetter> findRecent(int limit) {
        List<DeadLetter> letters = Collections.synchronizedList(new ArrayList<>());
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DEAD_LETTERS,
                (key, record) -> {
                    try {
                        letters.add(mapRecord(record));
                    } catch (Exception e) {
                        log.warn("Failed to deserialize dead letter record: {}", e.getMessage());
                    }
                });

        List<DeadLetter> sorted = new ArrayList<>(letters);
        sorted.sort(Comparator.comparingLong(DeadLetter::getFailedAt).reversed());
        return sorted.size() > limit ? sorted.subList(0, limit) : sorted;
    }

    private DeadLetter mapRecord(Record record) throws Exception {
        return DeadLetter.builder()
                .event(codec.readEvent(record.getString("eventJson")))
                .transport(record.getString("transport"))
                .attempts(record.getInt("attempts"))
                .lastError(record.getString("lastError"))
                .failedAt(record.getLong("failedAt"))
                .build();
    }
}
