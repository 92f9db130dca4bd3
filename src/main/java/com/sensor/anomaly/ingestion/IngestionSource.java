package com.sensor.anomaly.ingestion;

import com.sensor.anomaly.exception.IngestionFailureException;
import com.sensor.anomaly.model.IngestionBatch;

/**
 * A pull-based source of raw records. The cursor is opaque to callers: they persist the
 * returned {@code nextCursor} and hand it back on the next call.
 */
public interface IngestionSource {

    String name();

    /**
     * @param cursor position after the last consumed record, or null to start from the beginning
     * @throws IngestionFailureException if the source is unreachable; the cursor does not move
     */
    IngestionBatch fetchBatch(String cursor);
}
