package com.tableview.data;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.LinkedHashMap;

/**
 * A loaded value of any shape. Every runtime value the viewer shows is one of these variants,
 * so renderers can match on a closed set instead of guessing at types.
 */
public sealed interface DataValue {

    record Mapping(MutableMap<String, DataValue> entries) implements DataValue {
        public static Mapping empty() {
            // insertion order matters when keys are not sorted
            return new Mapping(MapAdapter.adapt(new LinkedHashMap<>()));
        }

        public Mapping with(String key, DataValue value) {
            entries.put(key, value);
            return this;
        }

        public int size() {
            return entries.size();
        }
    }

    record Sequence(MutableList<DataValue> elements) implements DataValue {
        public static Sequence empty() {
            return new Sequence(Lists.mutable.empty());
        }

        public Sequence with(DataValue element) {
            elements.add(element);
            return this;
        }

        public int size() {
            return elements.size();
        }
    }

    record Text(String value) implements DataValue {
        public boolean isMultiline() {
            return value.lines().limit(2).count() > 1;
        }
    }

    record Number(java.lang.Number value) implements DataValue {
        public boolean isWhole() {
            return value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof java.math.BigInteger;
        }

        public String display() {
            if (isWhole()) {
                return value.toString();
            }
            double d = value.doubleValue();
            // whole doubles print like integers
            if (d == (long) d && !Double.isInfinite(d) && !Double.isNaN(d)) {
                return Long.toString((long) d);
            }
            return value.toString();
        }
    }

    record Bool(boolean value) implements DataValue {}

    record Null() implements DataValue {}

    record Binary(byte[] bytes) implements DataValue {}

    /** Anything else, carried as its string form. */
    record Other(String display) implements DataValue {}
}
