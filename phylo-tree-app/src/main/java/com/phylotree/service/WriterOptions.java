package com.phylotree.service;

import java.util.List;

/**
 * Settings for one write.
 *
 * @param edgeWeightColumn edge column written as {@code branch_length}; null for none
 * @param nodeNameColumn   node column written as clade {@code name}; null for none
 * @param ignoredColumns   node columns that are never written as properties
 * @param indent           spaces per nesting level, 0 for no line breaks
 * @param xmlDeclaration   whether to start the document with an XML declaration
 */
public record WriterOptions(
    String edgeWeightColumn,
    String nodeNameColumn,
    List<String> ignoredColumns,
    int indent,
    boolean xmlDeclaration
) {
    public static final String DEFAULT_EDGE_WEIGHT_COLUMN = "weight";
    public static final String DEFAULT_NODE_NAME_COLUMN = "node name";
    public static final int DEFAULT_INDENT = 2;

    public WriterOptions {
        ignoredColumns = ignoredColumns == null ? List.of() : List.copyOf(ignoredColumns);
        if (indent < 0) {
            throw new IllegalArgumentException("Indent must not be negative: " + indent);
        }
    }

    public static WriterOptions defaults() {
        return new WriterOptions(DEFAULT_EDGE_WEIGHT_COLUMN, DEFAULT_NODE_NAME_COLUMN, List.of(), DEFAULT_INDENT, true);
    }

    public WriterOptions withEdgeWeightColumn(String name) {
        return new WriterOptions(name, nodeNameColumn, ignoredColumns, indent, xmlDeclaration);
    }

    public WriterOptions withNodeNameColumn(String name) {
        return new WriterOptions(edgeWeightColumn, name, ignoredColumns, indent, xmlDeclaration);
    }

    public WriterOptions withIgnoredColumns(List<String> names) {
        return new WriterOptions(edgeWeightColumn, nodeNameColumn, names, indent, xmlDeclaration);
    }

    public WriterOptions withIndent(int spaces) {
        return new WriterOptions(edgeWeightColumn, nodeNameColumn, ignoredColumns, spaces, xmlDeclaration);
    }

    public WriterOptions withXmlDeclaration(boolean include) {
        return new WriterOptions(edgeWeightColumn, nodeNameColumn, ignoredColumns, indent, include);
    }
}
