package com.sensor.anomaly.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, immutable list of declared features. The position of a definition is
 * its index in every {@link FeatureVector}, {@link ProfileState} and model built from it.
 */
public final class FeatureSchema {

    private final List<FeatureDefinition> definitions;
    private final List<String> names;
    private final Map<String, Integer> indexByName;

    public FeatureSchema(List<FeatureDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new IllegalArgumentException("Feature schema must declare at least one feature");
        }
        List<FeatureDefinition> copy = new ArrayList<>(definitions.size());
        List<String> featureNames = new ArrayList<>(definitions.size());
        Map<String, Integer> index = new HashMap<>();
        for (FeatureDefinition def : definitions) {
            if (def.getName() == null || def.getName().isBlank()) {
                throw new IllegalArgumentException("Feature name must not be blank");
            }
            if (index.putIfAbsent(def.getName(), featureNames.size()) != null) {
                throw new IllegalArgumentException("Duplicate feature name: " + def.getName());
            }
            copy.add(FeatureDefinition.builder()
                    .name(def.getName())
                    .type(def.getType() == null ? FeatureType.DOUBLE : def.getType())
                    .required(def.isRequired())
                    .min(def.getMin())
                    .max(def.getMax())
                    .defaultValue(def.getDefaultValue())
                    .build());
            featureNames.add(def.getName());
        }
        this.definitions = Collections.unmodifiableList(copy);
        this.names = Collections.unmodifiableList(featureNames);
        this.indexByName = Collections.unmodifiableMap(index);
    }

    public List<FeatureDefinition> getDefinitions() { return definitions; }
    public List<String> getNames() { return names; }
    public int size() { return definitions.size(); }

    public int indexOf(String name) {
        return indexByName.getOrDefault(name, -1);
    }
}
