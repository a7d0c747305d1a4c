package com.phylotree.model;

import java.util.List;
import java.util.OptionalInt;

/**
 * A rooted tree whose nodes and edges carry attribute columns.
 * Nodes are numbered 0..nodeCount()-1, edges 0..edgeCount()-1.
 */
public interface PhyloTree {

    int root();

    int nodeCount();

    int edgeCount();

    /**
     * Children of {@code node}, in insertion order.
     */
    List<Integer> children(int node);

    OptionalInt parent(int node);

    OptionalInt edgeId(int parent, int child);

    ColumnSet nodeData();

    ColumnSet edgeData();
}
