package com.sensor.anomaly.engine.features;

import com.sensor.anomaly.exception.EmptyRecordException;
import com.sensor.anomaly.exception.SchemaMismatchException;
import com.sensor.anomaly.model.FeatureDefinition;
import com.sensor.anomaly.model.FeatureSchema;
import com.sensor.anomaly.model.FeatureStatistics;
import com.sensor.anomaly.model.FeatureVector;
import com.sensor.anomaly.model.ProfileState;
import com.sensor.anomaly.model.RawRecord;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Converts a raw record into a fixed-shape feature vector following the declared schema.
 *
 * Coercion is explicit and strict:
 *   DOUBLE  - any finite number, or a string parseable as one
 *   LONG    - an integral number (fractional part rejected)
 *   INTEGER - an integral number within int range
 *   BOOLEAN - a boolean, or "true"/"false" (1.0 / 0.0)
 * Values outside the declared [min, max] are rejected, never clamped.
 *
 * Missing optional features are imputed from the profile mean, falling back to the declared
 * default while the profile has no observations. The profile is only read.
 */
public final class FeatureExtractor {

    private FeatureExtractor() {}

    public static FeatureVector extract(RawRecord record, FeatureSchema schema, ProfileState profile) {
        Map<String, Object> values = record == null ? null : record.getValues();
        if (values == null || values.isEmpty()) {
            throw new EmptyRecordException("Record " + recordId(record) + " has no columns");
        }

        List<FeatureDefinition> definitions = schema.getDefinitions();
        boolean anyPresent = definitions.stream().anyMatch(def -> values.get(def.getName()) != null);
        if (!anyPresent) {
            throw new EmptyRecordException("Record " + recordId(record) + " has none of the declared features "
                    + schema.getNames());
        }

        double[] features = new double[definitions.size()];
        for (int i = 0; i < definitions.size(); i++) {
            FeatureDefinition def = definitions.get(i);
            Object raw = values.get(def.getName());
            if (raw == null) {
                if (def.isRequired()) {
                    throw new SchemaMismatchException("Required feature '" + def.getName() + "' is missing");
                }
                features[i] = impute(def, i, profile);
                continue;
            }
            double value = coerce(def, raw);
            checkBounds(def, value);
            features[i] = value;
        }

        return new FeatureVector(record.getRecordId(), record.getEntityId(), record.getTimestamp(),
                schema.getNames(), features);
    }

    private static double impute(FeatureDefinition def, int index, ProfileState profile) {
        if (profile != null && index < profile.dimensions()) {
            FeatureStatistics stats = profile.get(index);
            if (stats.getCount() > 0 && def.getName().equals(stats.getName())) {
                return stats.getMean();
            }
        }
        return def.getDefaultValue();
    }

    static double coerce(FeatureDefinition def, Object raw) {
        return switch (def.getType()) {
            case DOUBLE -> toDouble(def, raw);
            case LONG -> toIntegral(def, raw, Long.MIN_VALUE, Long.MAX_VALUE);
            case INTEGER -> toIntegral(def, raw, Integer.MIN_VALUE, Integer.MAX_VALUE);
            case BOOLEAN -> toBoolean(def, raw);
        };
    }

    private static double toDouble(FeatureDefinition def, Object raw) {
        double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else if (raw instanceof String text) {
            try {
                value = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw mismatch(def, raw, "not a number");
            }
        } else {
            throw mismatch(def, raw, "expected a number");
        }
        if (!Double.isFinite(value)) {
            throw mismatch(def, raw, "not finite");
        }
        return value;
    }

    private static double toIntegral(FeatureDefinition def, Object raw, long min, long max) {
        BigDecimal decimal;
        try {
            if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
                decimal = BigDecimal.valueOf(((Number) raw).longValue());
            } else if (raw instanceof BigInteger big) {
                decimal = new BigDecimal(big);
            } else if (raw instanceof BigDecimal big) {
                decimal = big;
            } else if (raw instanceof Number number) {
                double d = number.doubleValue();
                if (!Double.isFinite(d)) {
                    throw mismatch(def, raw, "not finite");
                }
                decimal = BigDecimal.valueOf(d);
            } else if (raw instanceof String text) {
                decimal = new BigDecimal(text.trim());
            } else {
                throw mismatch(def, raw, "expected an integer");
            }
        } catch (NumberFormatException e) {
            throw mismatch(def, raw, "not an integer");
        }

        BigInteger integral;
        try {
            integral = decimal.toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw mismatch(def, raw, "has a fractional part");
        }
        if (integral.compareTo(BigInteger.valueOf(min)) < 0 || integral.compareTo(BigInteger.valueOf(max)) > 0) {
            throw mismatch(def, raw, "out of " + def.getType() + " range");
        }
        return integral.doubleValue();
    }

    private static double toBoolean(FeatureDefinition def, Object raw) {
        if (raw instanceof Boolean flag) {
            return flag ? 1.0 : 0.0;
        }
        if (raw instanceof String text) {
            if ("true".equalsIgnoreCase(text.trim())) return 1.0;
            if ("false".equalsIgnoreCase(text.trim())) return 0.0;
        }
        throw mismatch(def, raw, "expected a boolean");
    }

    private static void checkBounds(FeatureDefinition def, double value) {
        if (def.getMin() != null && value < def.getMin()) {
            throw new SchemaMismatchException(String.format(
                    "Feature '%s' is below its minimum %s: %s", def.getName(), def.getMin(), value));
        }
        if (def.getMax() != null && value > def.getMax()) {
            throw new SchemaMismatchException(String.format(
                    "Feature '%s' is above its maximum %s: %s", def.getName(), def.getMax(), value));
        }
    }

    private static SchemaMismatchException mismatch(FeatureDefinition def, Object raw, String problem) {
        return new SchemaMismatchException(String.format("Feature '%s' (%s) value '%s' %s",
                def.getName(), def.getType(), raw, problem));
    }

    private static String recordId(RawRecord record) {
        return record == null ? "<null>" : record.getRecordId();
    }
}
