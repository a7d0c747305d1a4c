package com.phylotree.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * Adjacency-list tree. Built once through {@link Builder}, which checks the rooted-tree invariants.
 */
public class InMemoryPhyloTree implements PhyloTree {

    private final int root;
    private final int[] parents;
    private final int[] parentEdges;
    private final List<List<Integer>> children;
    private final int edgeCount;
    private final ColumnSet nodeData;
    private final ColumnSet edgeData;

    private InMemoryPhyloTree(Builder builder, int root) {
        this.root = root;
        this.parents = builder.parents.clone();
        this.parentEdges = builder.parentEdges.clone();
        this.edgeCount = builder.edgeCount;
        List<List<Integer>> kids = new ArrayList<>(builder.children.size());
        for (List<Integer> list : builder.children) {
            kids.add(List.copyOf(list));
        }
        this.children = Collections.unmodifiableList(kids);
        this.nodeData = builder.nodeData;
        this.edgeData = builder.edgeData;
    }

    public static Builder builder(int nodeCount) {
        return new Builder(nodeCount);
    }

    @Override
    public int root() {
        return root;
    }

    @Override
    public int nodeCount() {
        return parents.length;
    }

    @Override
    public int edgeCount() {
        return edgeCount;
    }

    @Override
    public List<Integer> children(int node) {
        return children.get(node);
    }

    @Override
    public OptionalInt parent(int node) {
        int parent = parents[node];
        return parent < 0 ? OptionalInt.empty() : OptionalInt.of(parent);
    }

    @Override
    public OptionalInt edgeId(int parent, int child) {
        if (child < 0 || child >= parents.length || parents[child] != parent) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(parentEdges[child]);
    }

    @Override
    public ColumnSet nodeData() {
        return nodeData;
    }

    @Override
    public ColumnSet edgeData() {
        return edgeData;
    }

    public static class Builder {
        private final int[] parents;
        private final int[] parentEdges;
        private final List<List<Integer>> children;
        private final ColumnSet nodeData = new ColumnSet();
        private final ColumnSet edgeData = new ColumnSet();
        private int edgeCount;

        private Builder(int nodeCount) {
            if (nodeCount < 1) {
                throw new IllegalArgumentException("A tree needs at least one node, got " + nodeCount);
            }
            this.parents = new int[nodeCount];
            this.parentEdges = new int[nodeCount];
            Arrays.fill(parents, -1);
            Arrays.fill(parentEdges, -1);
            this.children = new ArrayList<>(nodeCount);
            for (int i = 0; i < nodeCount; i++) {
                children.add(new ArrayList<>());
            }
        }

        /**
         * Add an edge; edges are numbered in the order they are added.
         */
        public Builder edge(int parent, int child) {
            checkNode(parent);
            checkNode(child);
            if (parent == child) {
                throw new IllegalArgumentException("Self loop on node " + child);
            }
            if (parents[child] >= 0) {
                throw new IllegalArgumentException("Node " + child + " already has parent " + parents[child]);
            }
            parents[child] = parent;
            parentEdges[child] = edgeCount++;
            children.get(parent).add(child);
            return this;
        }

        public Builder nodeColumn(AttributeColumn column) {
            nodeData.add(column);
            return this;
        }

        public Builder edgeColumn(AttributeColumn column) {
            edgeData.add(column);
            return this;
        }

        public InMemoryPhyloTree build() {
            int root = -1;
            for (int node = 0; node < parents.length; node++) {
                if (parents[node] < 0) {
                    if (root >= 0) {
                        throw new IllegalArgumentException("Nodes " + root + " and " + node
                                + " both lack a parent; a tree has exactly one root");
                    }
                    root = node;
                }
            }
            if (root < 0) {
                throw new IllegalArgumentException("Every node has a parent; the edges contain a cycle");
            }
            checkReachable(root);
            for (AttributeColumn column : nodeData.columns()) {
                checkLength(column, parents.length, "node");
            }
            for (AttributeColumn column : edgeData.columns()) {
                checkLength(column, edgeCount, "edge");
            }
            return new InMemoryPhyloTree(this, root);
        }

        private void checkReachable(int root) {
            boolean[] seen = new boolean[parents.length];
            ArrayDeque<Integer> queue = new ArrayDeque<>();
            queue.add(root);
            int reached = 0;
            while (!queue.isEmpty()) {
                int node = queue.poll();
                seen[node] = true;
                reached++;
                queue.addAll(children.get(node));
            }
            if (reached != parents.length) {
                for (int node = 0; node < seen.length; node++) {
                    if (!seen[node]) {
                        throw new IllegalArgumentException("Node " + node + " is not reachable from root " + root);
                    }
                }
            }
        }

        private void checkNode(int node) {
            if (node < 0 || node >= parents.length) {
                throw new IllegalArgumentException("Node " + node + " out of range 0.." + (parents.length - 1));
            }
        }

        private static void checkLength(AttributeColumn column, int expected, String scope) {
            if (column.size() != expected) {
                throw new IllegalArgumentException("Column '" + column.name() + "' has " + column.size()
                        + " rows but the tree has " + expected + " " + scope + (expected == 1 ? "" : "s"));
            }
        }
    }
}
