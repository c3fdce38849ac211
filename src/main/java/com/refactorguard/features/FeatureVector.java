package com.refactorguard.features;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The ten numeric features of one (before, after) pair, always in
 * {@link #SCHEMA} order. Immutable.
 */
public final class FeatureVector {

    public static final String COMPLEXITY_BEFORE = "complexity_before";
    public static final String COMPLEXITY_AFTER = "complexity_after";
    public static final String COMPLEXITY_CHANGE = "complexity_change";
    public static final String LENGTH_BEFORE = "length_before";
    public static final String LENGTH_AFTER = "length_after";
    public static final String LENGTH_CHANGE = "length_change";
    public static final String NESTING_BEFORE = "nesting_before";
    public static final String NESTING_AFTER = "nesting_after";
    public static final String NESTING_CHANGE = "nesting_change";
    public static final String VARIABLE_USAGE_DIFF = "variable_usage_diff";

    public static final List<String> SCHEMA = List.of(
            COMPLEXITY_BEFORE, COMPLEXITY_AFTER, COMPLEXITY_CHANGE,
            LENGTH_BEFORE, LENGTH_AFTER, LENGTH_CHANGE,
            NESTING_BEFORE, NESTING_AFTER, NESTING_CHANGE,
            VARIABLE_USAGE_DIFF
    );

    private final double[] values;

    private FeatureVector(double[] values) {
        this.values = values;
    }

    /** Values in {@link #SCHEMA} order. */
    public static FeatureVector of(double... values) {
        if (values.length != SCHEMA.size()) {
            throw new IllegalArgumentException(
                    "Expected " + SCHEMA.size() + " feature values but got " + values.length);
        }
        return new FeatureVector(values.clone());
    }

    public double get(String key) {
        int index = SCHEMA.indexOf(key);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown feature: " + key);
        }
        return values[index];
    }

    public List<String> keys() {
        return SCHEMA;
    }

    public double[] toArray() {
        return values.clone();
    }

    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(SCHEMA.get(i), values[i]);
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof FeatureVector other && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
