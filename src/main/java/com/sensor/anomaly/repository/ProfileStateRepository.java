package com.sensor.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.sensor.anomaly.config.AerospikeConfig;
import com.sensor.anomaly.model.ProfileState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

@Repository
public class ProfileStateRepository {

    private static final Logger log = LoggerFactory.getLogger(ProfileStateRepository.class);

    static final String PROFILE_KEY = "current";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final StateCodec codec;

    public ProfileStateRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy,
                                  StateCodec codec) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.codec = codec;
    }

    public void save(ProfileState profile) {
        try {
            Key key = new Key(namespace, AerospikeConfig.SET_PROFILE_STATE, PROFILE_KEY);
            client.put(writePolicy, key,
                    new Bin("stateJson", codec.writeProfile(profile)),
                    new Bin("featureCount", profile.dimensions()),
                    new Bin("capturedAt", profile.getCapturedAt()));
            log.debug("Saved profile snapshot captured at {}", profile.getCapturedAt());
        } catch (Exception e) {
            log.error("Failed to save profile snapshot", e);
        }
    }

    public ProfileState load() {
        Key key = new Key(namespace, AerospikeConfig.SET_PROFILE_STATE, PROFILE_KEY);
        try {
            Record record = client.get(readPolicy, key);
            if (record == null) return null;
            return codec.readProfile(record.getString("stateJson"));
        } catch (Exception e) {
            log.error("Failed to load persisted profile", e);
            return null;
        }
    }
}
