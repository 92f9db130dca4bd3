package com.sensor.anomaly.ingestion;

import com.sensor.anomaly.config.IngestionConfig;
import com.sensor.anomaly.exception.IngestionFailureException;
import com.sensor.anomaly.model.IngestionBatch;
import com.sensor.anomaly.model.RawRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Synthetic MQ2 gas-sensor readings. Normal values are drawn from N(mean, stdDev) clipped at
 * zero; a configurable share are spikes or flatlines. The cursor is the offset of the next
 * record. With a seed configured, the reading at a given offset is always the same.
 * Record timestamps follow the offset, {@code intervalMs} apart, anchored so that the
 * first offset fetched maps to the time of that first fetch.
 */
@Component
public class SimulatedSensorSource implements IngestionSource {

    private final IngestionConfig config;

    // Timestamp of offset 0; fixed on the first fetch
    private Long clockOrigin;

    public SimulatedSensorSource(IngestionConfig config) {
        this.config = config;
    }

    @Override
    public String name() {
        return config.getSourceName();
    }

    @Override
    public IngestionBatch fetchBatch(String cursor) {
        long offset = parseCursor(cursor);
        IngestionConfig.Simulator sim = config.getSimulator();
        long origin = clockOrigin(offset, sim.getIntervalMs());
        int size = config.getBatchSize();

        List<RawRecord> records = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            long index = offset + i;
            records.add(RawRecord.builder()
                    .recordId(String.format("%s-%012d", config.getSourceName(), index))
                    .entityId(sim.getSensorId())
                    .timestamp(origin + index * sim.getIntervalMs())
                    .values(Map.of(sim.getFeature(), reading(index, sim)))
                    .build());
        }
        return new IngestionBatch(records, Long.toString(offset + size));
    }

    private synchronized long clockOrigin(long offset, long intervalMs) {
        if (clockOrigin == null) {
            clockOrigin = System.currentTimeMillis() - offset * intervalMs;
        }
        return clockOrigin;
    }

    double reading(long index, IngestionConfig.Simulator sim) {
        Random random = sim.getSeed() != null
                ? new Random(sim.getSeed() * 31 + index)
                : ThreadLocalRandom.current();

        if (random.nextDouble() < sim.getAnomalyRate()) {
            return random.nextBoolean() ? sim.getSpikeValue() : sim.getFlatlineValue();
        }
        return Math.max(0.0, sim.getMean() + random.nextGaussian() * sim.getStdDev());
    }

    private long parseCursor(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            return 0L;
        }
        try {
            long offset = Long.parseLong(cursor.trim());
            if (offset < 0) {
                throw new IngestionFailureException("Negative cursor: " + cursor);
            }
            return offset;
        } catch (NumberFormatException e) {
            throw new IngestionFailureException("Unreadable cursor '" + cursor + "'", e);
        }
    }
}
