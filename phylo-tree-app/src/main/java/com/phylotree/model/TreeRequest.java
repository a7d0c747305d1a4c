package com.phylotree.model;

import java.util.List;
import java.util.Map;

/**
 * JSON body describing a tree to write: node count, parent-child edges in edge-id order,
 * node and edge columns, and optional per-request writer settings.
 */
public record TreeRequest(
    int nodeCount,
    List<Edge> edges,
    List<Column> nodeColumns,
    List<Column> edgeColumns,
    String edgeWeightColumn,   // null keeps the configured default
    String nodeNameColumn,     // null keeps the configured default
    List<String> ignoredColumns
) {
    public record Edge(int parent, int child) {}

    /**
     * @param type       value kind type name, e.g. "double", "int", "string", "unsigned char"
     * @param components values per row; 3 for colors, defaults to 1
     * @param values     row values, flattened when components is more than 1
     */
    public record Column(
        String name,
        String type,
        Integer components,
        List<Object> values,
        Map<String, String> metadata
    ) {}
}
