package com.sensor.anomaly.model;

import java.util.List;

public record IngestionBatch(List<RawRecord> records, String nextCursor) {}
