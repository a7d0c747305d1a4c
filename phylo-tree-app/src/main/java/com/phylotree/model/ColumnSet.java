package com.phylotree.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Columns of one scope (nodes or edges), iterated in insertion order.
 */
public class ColumnSet {

    private final Map<String, AttributeColumn> columns = new LinkedHashMap<>();

    public ColumnSet add(AttributeColumn column) {
        if (columns.containsKey(column.name())) {
            throw new IllegalArgumentException("Duplicate column name: " + column.name());
        }
        columns.put(column.name(), column);
        return this;
    }

    public Optional<AttributeColumn> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(columns.get(name));
    }

    public boolean contains(String name) {
        return name != null && columns.containsKey(name);
    }

    public List<AttributeColumn> columns() {
        return List.copyOf(columns.values());
    }

    public List<String> names() {
        return new ArrayList<>(columns.keySet());
    }

    public int size() {
        return columns.size();
    }
}
