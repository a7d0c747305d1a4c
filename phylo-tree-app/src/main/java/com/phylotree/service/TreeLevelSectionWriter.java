package com.phylotree.service;

import com.phylotree.model.AttributeColumn;
import com.phylotree.model.PhyloTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.Optional;

/**
 * Writes the optional elements that describe the whole phylogeny: name, description,
 * confidence and properties, all taken from row 0 of "phylogeny."-prefixed node columns.
 */
public class TreeLevelSectionWriter {

    private static final Logger log = LoggerFactory.getLogger(TreeLevelSectionWriter.class);

    private final PropertyElementWriter propertyWriter;

    public TreeLevelSectionWriter(PropertyElementWriter propertyWriter) {
        this.propertyWriter = propertyWriter;
    }

    public void write(PhyloXmlDocument doc, PhyloTree tree, EmissionLedger ledger) {
        Element phylogeny = doc.phylogeny();

        writeElement(doc, tree, ledger, "name", null);
        writeElement(doc, tree, ledger, "description", null);
        writeElement(doc, tree, ledger, "confidence", "type");

        for (AttributeColumn column : tree.nodeData().columns()) {
            if (!ColumnNames.isTreeLevelProperty(column.name()) || ledger.contains(column.name())) {
                continue;
            }
            phylogeny.appendChild(propertyWriter.treeLevelProperty(doc, column, ledger));
        }
    }

    private void writeElement(PhyloXmlDocument doc, PhyloTree tree, EmissionLedger ledger,
                              String elementName, String attributeName) {
        String columnName = ColumnNames.treeLevelColumn(elementName);
        Optional<AttributeColumn> found = tree.nodeData().get(columnName);
        if (found.isEmpty()) {
            log.debug("No '{}' column, phylogeny {} omitted", columnName, elementName);
            return;
        }
        AttributeColumn column = found.get();

        Element element = doc.textElement(elementName, column.value(0).asString());
        if (attributeName != null) {
            column.metadata(attributeName)
                    .filter(value -> !value.isEmpty())
                    .ifPresent(value -> doc.attribute(element, attributeName, value));
        }
        doc.phylogeny().appendChild(element);
        ledger.record(columnName);
    }
}
