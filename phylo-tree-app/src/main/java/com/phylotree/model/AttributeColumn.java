package com.phylotree.model;

import java.util.Map;
import java.util.Optional;

/**
 * A named, ordered sequence of typed tuples, one per node or per edge,
 * with free-form string metadata (authority, applies_to, unit, type, ...).
 */
public interface AttributeColumn {

    String name();

    ValueKind kind();

    /**
     * Number of tuples (rows).
     */
    int size();

    /**
     * Values per tuple; 1 for scalar columns, 3 for RGB colors.
     */
    int components();

    TypedValue component(int row, int component);

    /**
     * The first component of the tuple at {@code row}.
     */
    default TypedValue value(int row) {
        return component(row, 0);
    }

    Map<String, String> metadata();

    default Optional<String> metadata(String key) {
        return Optional.ofNullable(metadata().get(key));
    }
}
