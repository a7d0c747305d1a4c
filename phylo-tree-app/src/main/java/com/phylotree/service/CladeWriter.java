package com.phylotree.service;

import com.phylotree.model.AttributeColumn;
import com.phylotree.model.PhyloTree;
import com.phylotree.model.TypedValue;
import com.phylotree.model.ValueKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.OptionalInt;

/**
 * Builds the nested {@code <clade>} elements, one per tree node, in depth-first pre-order.
 *
 * Each clade holds, in order: its branch length attribute, name, confidence and color elements,
 * a property element for every other node column not yet in the ledger and non-empty on this node,
 * and then its child clades.
 * Unlike the VTK writer, which puts every property column on every clade, a property whose value
 * has no text is left out of that clade.
 * An explicit stack replaces recursion so that very deep trees do not overflow the call stack.
 */
public class CladeWriter {

    private static final Logger log = LoggerFactory.getLogger(CladeWriter.class);

    private final PropertyElementWriter propertyWriter;

    public CladeWriter(PropertyElementWriter propertyWriter) {
        this.propertyWriter = propertyWriter;
    }

    /**
     * Append the clade for the tree root, with all its descendants, to {@code parent}.
     *
     * @return number of clade elements written
     */
    public int write(PhyloXmlDocument doc, Element parent, PhyloTree tree, WriterOptions options,
                     EmissionLedger ledger) {
        Columns columns = Columns.resolve(tree, options);

        Deque<PendingClade> stack = new ArrayDeque<>();
        stack.push(new PendingClade(tree.root(), parent));
        int written = 0;

        while (!stack.isEmpty()) {
            PendingClade pending = stack.pop();
            Element clade = doc.element("clade");

            writeBranchLength(tree, pending.node(), clade, columns, ledger);
            writeName(doc, pending.node(), clade, columns, ledger);
            writeConfidence(doc, pending.node(), clade, columns, ledger);
            writeColor(doc, pending.node(), clade, columns, ledger);
            writeProperties(doc, tree, pending.node(), clade, columns, ledger);

            pending.parent().appendChild(clade);
            written++;

            // reversed so the first child is popped, and fully written, first
            List<Integer> children = tree.children(pending.node());
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new PendingClade(children.get(i), clade));
            }
        }
        return written;
    }

    private void writeBranchLength(PhyloTree tree, int node, Element clade, Columns columns, EmissionLedger ledger) {
        AttributeColumn weights = columns.edgeWeight();
        if (weights == null) {
            return;
        }

        OptionalInt parent = tree.parent(node);
        if (parent.isPresent()) {
            OptionalInt edge = tree.edgeId(parent.getAsInt(), node);
            if (edge.isPresent()) {
                double weight = weights.value(edge.getAsInt()).asDouble();
                clade.setAttribute("branch_length", TypedValue.formatDouble(weight));
            }
        }
        ledger.record(weights.name());
    }

    private void writeName(PhyloXmlDocument doc, int node, Element clade, Columns columns, EmissionLedger ledger) {
        AttributeColumn names = columns.nodeName();
        if (names == null) {
            return;
        }

        String name = names.value(node).asString();
        if (!name.isEmpty()) {
            clade.appendChild(doc.textElement("name", name));
        }
        ledger.record(names.name());
    }

    private void writeConfidence(PhyloXmlDocument doc, int node, Element clade, Columns columns,
                                 EmissionLedger ledger) {
        AttributeColumn confidences = columns.confidence();
        if (confidences == null) {
            return;
        }

        String confidence = confidences.value(node).asString();
        if (!confidence.isEmpty()) {
            Element element = doc.textElement("confidence", confidence);
            confidences.metadata("type")
                    .filter(type -> !type.isEmpty())
                    .ifPresent(type -> doc.attribute(element, "type", type));
            clade.appendChild(element);
        }
        ledger.record(ColumnNames.CONFIDENCE);
    }

    private void writeColor(PhyloXmlDocument doc, int node, Element clade, Columns columns, EmissionLedger ledger) {
        AttributeColumn colors = columns.color();
        if (colors == null) {
            return;
        }

        Element color = doc.element("color");
        color.appendChild(doc.textElement("red", colors.component(node, 0).asString()));
        color.appendChild(doc.textElement("green", colors.component(node, 1).asString()));
        color.appendChild(doc.textElement("blue", colors.component(node, 2).asString()));
        clade.appendChild(color);
        ledger.record(ColumnNames.COLOR);
    }

    private void writeProperties(PhyloXmlDocument doc, PhyloTree tree, int node, Element clade, Columns columns,
                                 EmissionLedger ledger) {
        for (AttributeColumn column : tree.nodeData().columns()) {
            if (column == columns.nodeName() || column == columns.edgeWeight()) {
                continue;
            }
            if (ledger.contains(column.name())) {
                continue;
            }
            propertyWriter.cladeProperty(doc, column, node).ifPresent(clade::appendChild);
        }
    }

    private record PendingClade(int node, Element parent) {
    }

    /**
     * Designated columns looked up once per write; null where the tree has no usable column.
     */
    private record Columns(
        AttributeColumn edgeWeight,
        AttributeColumn nodeName,
        AttributeColumn confidence,
        AttributeColumn color
    ) {
        static Columns resolve(PhyloTree tree, WriterOptions options) {
            AttributeColumn edgeWeight = tree.edgeData().get(options.edgeWeightColumn()).orElse(null);
            AttributeColumn nodeName = tree.nodeData().get(options.nodeNameColumn()).orElse(null);
            AttributeColumn confidence = tree.nodeData().get(ColumnNames.CONFIDENCE).orElse(null);
            AttributeColumn color = tree.nodeData().get(ColumnNames.COLOR)
                    .filter(CladeWriter::isRgb)
                    .orElse(null);

            if (edgeWeight == null) {
                log.debug("No edge column '{}', branch lengths omitted", options.edgeWeightColumn());
            }
            if (nodeName == null) {
                log.debug("No node column '{}', clade names omitted", options.nodeNameColumn());
            }
            if (color == null && tree.nodeData().contains(ColumnNames.COLOR)) {
                log.warn("Column '{}' is not three unsigned bytes per node, writing it as a property",
                        ColumnNames.COLOR);
            }
            return new Columns(edgeWeight, nodeName, confidence, color);
        }
    }

    static boolean isRgb(AttributeColumn column) {
        return column.kind() == ValueKind.UNSIGNED_BYTE && column.components() == 3;
    }
}
