package com.phylotree.service;

import com.phylotree.model.ArrayColumn;
import com.phylotree.model.InMemoryPhyloTree;
import com.phylotree.model.PhyloTree;
import com.phylotree.model.TreeRequest;
import com.phylotree.model.TypedValue;
import com.phylotree.model.ValueKind;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a {@link TreeRequest} into an in-memory tree and per-request writer options.
 * Invalid requests are rejected with {@link IllegalArgumentException}.
 */
@Service
public class TreeRequestMapper {

    public PhyloTree toTree(TreeRequest request) {
        InMemoryPhyloTree.Builder builder = InMemoryPhyloTree.builder(request.nodeCount());

        if (request.edges() != null) {
            for (TreeRequest.Edge edge : request.edges()) {
                requireEntry(edge, "edges");
                builder.edge(edge.parent(), edge.child());
            }
        }
        if (request.nodeColumns() != null) {
            for (TreeRequest.Column column : request.nodeColumns()) {
                builder.nodeColumn(toColumn(requireEntry(column, "nodeColumns")));
            }
        }
        if (request.edgeColumns() != null) {
            for (TreeRequest.Column column : request.edgeColumns()) {
                builder.edgeColumn(toColumn(requireEntry(column, "edgeColumns")));
            }
        }
        return builder.build();
    }

    private static <T> T requireEntry(T entry, String list) {
        if (entry == null) {
            throw new IllegalArgumentException("Null entry in " + list);
        }
        return entry;
    }

    public WriterOptions toOptions(TreeRequest request, WriterOptions defaults) {
        WriterOptions options = defaults;
        if (request.edgeWeightColumn() != null) {
            options = options.withEdgeWeightColumn(request.edgeWeightColumn());
        }
        if (request.nodeNameColumn() != null) {
            options = options.withNodeNameColumn(request.nodeNameColumn());
        }
        if (request.ignoredColumns() != null) {
            List<String> ignored = new ArrayList<>(defaults.ignoredColumns());
            ignored.addAll(request.ignoredColumns());
            options = options.withIgnoredColumns(ignored);
        }
        return options;
    }

    ArrayColumn toColumn(TreeRequest.Column column) {
        if (column.name() == null || column.name().isEmpty()) {
            throw new IllegalArgumentException("Column without a name");
        }
        ValueKind kind = ValueKind.fromTypeName(column.type())
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown type '" + column.type() + "' for column '" + column.name() + "'"));

        List<Object> raw = column.values() == null ? List.of() : column.values();
        List<TypedValue> values = new ArrayList<>(raw.size());
        for (Object value : raw) {
            values.add(TypedValue.coerce(kind, value));
        }

        int components = column.components() == null ? 1 : column.components();
        ArrayColumn result = new ArrayColumn(column.name(), kind, components, values);
        if (column.metadata() != null) {
            for (Map.Entry<String, String> entry : column.metadata().entrySet()) {
                result.withMetadata(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }
}
