package com.phylotree.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory column backed by a flat list of values, {@code components} values per tuple.
 */
public class ArrayColumn implements AttributeColumn {

    private final String name;
    private final ValueKind kind;
    private final int components;
    private final List<TypedValue> values;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    public ArrayColumn(String name, ValueKind kind, int components, List<TypedValue> values) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        if (components < 1) {
            throw new IllegalArgumentException("Column '" + name + "' needs at least one component");
        }
        if (values.size() % components != 0) {
            throw new IllegalArgumentException("Column '" + name + "' has " + values.size()
                    + " values, not a multiple of " + components + " components");
        }
        for (TypedValue value : values) {
            if (value.kind() != kind) {
                throw new IllegalArgumentException("Column '" + name + "' of kind " + kind.typeName()
                        + " holds a " + value.typeName() + " value");
            }
        }
        this.components = components;
        this.values = List.copyOf(values);
    }

    public static ArrayColumn of(String name, ValueKind kind, List<TypedValue> values) {
        return new ArrayColumn(name, kind, 1, values);
    }

    public static ArrayColumn ofDoubles(String name, double... values) {
        List<TypedValue> list = new ArrayList<>(values.length);
        for (double v : values) {
            list.add(TypedValue.ofDouble(v));
        }
        return of(name, ValueKind.DOUBLE, list);
    }

    public static ArrayColumn ofInts(String name, int... values) {
        List<TypedValue> list = new ArrayList<>(values.length);
        for (int v : values) {
            list.add(TypedValue.ofInt(v));
        }
        return of(name, ValueKind.INT, list);
    }

    public static ArrayColumn ofStrings(String name, String... values) {
        List<TypedValue> list = new ArrayList<>(values.length);
        for (String v : values) {
            list.add(TypedValue.ofString(v));
        }
        return of(name, ValueKind.STRING, list);
    }

    /**
     * RGB column: three unsigned bytes per row, given flat as r0, g0, b0, r1, g1, b1, ...
     */
    public static ArrayColumn ofRgb(String name, int... rgb) {
        List<TypedValue> list = new ArrayList<>(rgb.length);
        for (int v : rgb) {
            list.add(TypedValue.ofUnsignedByte(v));
        }
        return new ArrayColumn(name, ValueKind.UNSIGNED_BYTE, 3, list);
    }

    public ArrayColumn withMetadata(String key, String value) {
        metadata.put(key, value);
        return this;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ValueKind kind() {
        return kind;
    }

    @Override
    public int size() {
        return values.size() / components;
    }

    @Override
    public int components() {
        return components;
    }

    @Override
    public TypedValue component(int row, int component) {
        if (row < 0 || row >= size()) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range for column '" + name
                    + "' with " + size() + " rows");
        }
        if (component < 0 || component >= components) {
            throw new IndexOutOfBoundsException("Component " + component + " out of range for column '"
                    + name + "' with " + components + " components");
        }
        return values.get(row * components + component);
    }

    @Override
    public Map<String, String> metadata() {
        return Collections.unmodifiableMap(metadata);
    }

    @Override
    public String toString() {
        return "ArrayColumn[" + name + ", " + kind.typeName() + " x" + components + ", " + size() + " rows]";
    }
}
