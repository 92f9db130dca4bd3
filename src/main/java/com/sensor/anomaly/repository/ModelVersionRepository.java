package com.sensor.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.sensor.anomaly.config.AerospikeConfig;
import com.sensor.anomaly.model.ModelVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.Map;

/**
 * Stores the active model version so scoring resumes after a restart without waiting for
 * a retrain.
 */
@Repository
public class ModelVersionRepository {

    private static final Logger log = LoggerFactory.getLogger(ModelVersionRepository.class);

    static final String ACTIVE_KEY = "active";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final StateCodec codec;

    public ModelVersionRepository(AerospikeClient client,
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

    public void saveActive(ModelVersion model) {
        try {
            String modelJson = codec.writeModel(model);
            Key key = new Key(namespace, AerospikeConfig.SET_MODEL_VERSIONS, ACTIVE_KEY);

            client.put(writePolicy, key,
                    new Bin("modelJson", modelJson),
                    new Bin("versionId", model.getVersionId()),
                    new Bin("featureCount", model.getDimensions()),
                    new Bin("treeCount", model.getTrees().size()),
                    new Bin("trainedAt", model.getTrainedAt()),
                    new Bin("trainSamples", model.getTrainingSampleSize()));

            log.info("Saved model version {}: {} trees, {} samples",
                    model.getVersionId(), model.getTrees().size(), model.getTrainingSampleSize());
        } catch (Exception e) {
            log.error("Failed to save model version {}", model.getVersionId(), e);
        }
    }

    /**
     * @return the persisted active version, or null if none is stored or it cannot be read
     */
    public ModelVersion loadActive() {
        Key key = new Key(namespace, AerospikeConfig.SET_MODEL_VERSIONS, ACTIVE_KEY);
        try {
            Record record = client.get(readPolicy, key);
            if (record == null) return null;
            return codec.readModel(record.getString("modelJson"));
        } catch (Exception e) {
            log.error("Failed to load persisted model version", e);
            return null;
        }
    }

    public Map<String, Object> getActiveMetadata() {
        Key key = new Key(namespace, AerospikeConfig.SET_MODEL_VERSIONS, ACTIVE_KEY);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;

        return Map.of(
                "versionId", record.getLong("versionId"),
                "treeCount", record.getInt("treeCount"),
                "featureCount", record.getInt("featureCount"),
                "trainingSamples", record.getInt("trainSamples"),
                "trainedAt", record.getLong("trainedAt")
        );
    }
}
