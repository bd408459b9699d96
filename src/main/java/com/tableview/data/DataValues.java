package com.tableview.data;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.Set;

/**
 * Conversions between plain Java objects and {@link DataValue}.
 */
public final class DataValues {

    /**
     * Total order used to sort set members: nulls, booleans, numbers, texts, then everything
     * else by its display string.
     */
    public static final Comparator<DataValue> SET_ORDER = Comparator
        .comparingInt(DataValues::rank)
        .thenComparing(DataValues::compareWithinRank);

    private DataValues() {
    }

    public static DataValue of(Object value) {
        if (value == null) {
            return new DataValue.Null();
        }
        if (value instanceof DataValue dv) {
            return dv;
        }
        if (value instanceof CharSequence cs) {
            return new DataValue.Text(cs.toString());
        }
        if (value instanceof Boolean b) {
            return new DataValue.Bool(b);
        }
        if (value instanceof Number n) {
            return new DataValue.Number(n);
        }
        if (value instanceof byte[] bytes) {
            return new DataValue.Binary(bytes);
        }
        if (value instanceof Map<?, ?> map) {
            DataValue.Mapping mapping = DataValue.Mapping.empty();
            map.forEach((k, v) -> mapping.with(String.valueOf(k), of(v)));
            return mapping;
        }
        if (value instanceof Set<?> set) {
            // sets have no order of their own
            MutableList<DataValue> members = Lists.mutable.empty();
            set.forEach(member -> members.add(of(member)));
            members.sortThis(SET_ORDER);
            return new DataValue.Sequence(members);
        }
        if (value instanceof Collection<?> collection) {
            MutableList<DataValue> elements = Lists.mutable.withInitialCapacity(collection.size());
            collection.forEach(element -> elements.add(of(element)));
            return new DataValue.Sequence(elements);
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            MutableList<DataValue> elements = Lists.mutable.withInitialCapacity(length);
            for (int i = 0; i < length; i++) {
                elements.add(of(Array.get(value, i)));
            }
            return new DataValue.Sequence(elements);
        }
        return new DataValue.Other(value.toString());
    }

    /**
     * Copies containers recursively. Scalars are immutable and shared, except binary blobs.
     */
    public static DataValue deepCopy(DataValue value) {
        if (value instanceof DataValue.Mapping mapping) {
            DataValue.Mapping copy = DataValue.Mapping.empty();
            mapping.entries().forEachKeyValue((k, v) -> copy.with(k, deepCopy(v)));
            return copy;
        }
        if (value instanceof DataValue.Sequence sequence) {
            return new DataValue.Sequence(sequence.elements().collect(DataValues::deepCopy));
        }
        if (value instanceof DataValue.Binary binary) {
            return new DataValue.Binary(binary.bytes().clone());
        }
        return value;
    }

    /**
     * Single-line display text of a scalar, the way the tree shows leaf values.
     */
    public static String display(DataValue value) {
        if (value instanceof DataValue.Null) {
            return "None";
        }
        if (value instanceof DataValue.Text text) {
            return text.value();
        }
        if (value instanceof DataValue.Number number) {
            return number.display();
        }
        if (value instanceof DataValue.Bool bool) {
            return bool.value() ? "True" : "False";
        }
        if (value instanceof DataValue.Binary binary) {
            return "<" + binary.bytes().length + " bytes>";
        }
        if (value instanceof DataValue.Other other) {
            return other.display();
        }
        if (value instanceof DataValue.Mapping mapping) {
            return "{" + mapping.size() + " keys}";
        }
        return "[" + ((DataValue.Sequence) value).size() + " items]";
    }

    /**
     * Unwraps a scalar into the cell object a table holds. Containers are returned as-is.
     */
    public static Object toCell(DataValue value) {
        if (value instanceof DataValue.Null) {
            return null;
        }
        if (value instanceof DataValue.Text text) {
            return text.value();
        }
        if (value instanceof DataValue.Number number) {
            return number.isWhole() ? (Object) number.value().longValue() : (Object) number.value().doubleValue();
        }
        if (value instanceof DataValue.Bool bool) {
            return bool.value();
        }
        if (value instanceof DataValue.Binary binary) {
            return binary.bytes();
        }
        if (value instanceof DataValue.Other other) {
            return other.display();
        }
        return value;
    }

    private static int rank(DataValue value) {
        if (value instanceof DataValue.Null) {
            return 0;
        }
        if (value instanceof DataValue.Bool) {
            return 1;
        }
        if (value instanceof DataValue.Number) {
            return 2;
        }
        if (value instanceof DataValue.Text) {
            return 3;
        }
        return 4;
    }

    private static int compareWithinRank(DataValue a, DataValue b) {
        if (a instanceof DataValue.Bool x && b instanceof DataValue.Bool y) {
            return Boolean.compare(x.value(), y.value());
        }
        if (a instanceof DataValue.Number x && b instanceof DataValue.Number y) {
            return Double.compare(x.value().doubleValue(), y.value().doubleValue());
        }
        if (a instanceof DataValue.Text x && b instanceof DataValue.Text y) {
            return x.value().compareTo(y.value());
        }
        return display(a).compareTo(display(b));
    }
}
