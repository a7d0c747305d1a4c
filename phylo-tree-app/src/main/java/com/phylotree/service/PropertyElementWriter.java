package com.phylotree.service;

import com.phylotree.model.AttributeColumn;
import com.phylotree.model.TypedValue;
import org.w3c.dom.Element;

import java.util.Optional;

/**
 * Builds PhyloXML {@code <property>} elements from columns that have no dedicated element.
 */
public class PropertyElementWriter {

    public static final String AUTHORITY_KEY = "authority";
    public static final String APPLIES_TO_KEY = "applies_to";
    public static final String UNIT_KEY = "unit";

    public static final String DEFAULT_AUTHORITY = "VTK";
    public static final String DEFAULT_APPLIES_TO = "clade";

    /**
     * Property describing one clade, valued from {@code row}; empty when the value has no text.
     */
    public Optional<Element> cladeProperty(PhyloXmlDocument doc, AttributeColumn column, int row) {
        if (column.value(row).asString().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(propertyElement(doc, column, row));
    }

    /**
     * Property describing the whole phylogeny, valued from row 0. The column is recorded in
     * the ledger so the clade pass does not write it again.
     */
    public Element treeLevelProperty(PhyloXmlDocument doc, AttributeColumn column, EmissionLedger ledger) {
        ledger.record(column.name());
        return propertyElement(doc, column, 0);
    }

    private Element propertyElement(PhyloXmlDocument doc, AttributeColumn column, int row) {
        String authority = nonEmptyMetadata(column, AUTHORITY_KEY, DEFAULT_AUTHORITY);
        String appliesTo = nonEmptyMetadata(column, APPLIES_TO_KEY, DEFAULT_APPLIES_TO);
        String unit = nonEmptyMetadata(column, UNIT_KEY, "");
        TypedValue value = column.value(row);

        Element property = doc.textElement("property", value.asString());
        property.setAttribute("datatype", XsdDatatypeResolver.datatypeOf(value));
        doc.attribute(property, "ref", authority + ":" + ColumnNames.propertyLocalName(column.name()));
        doc.attribute(property, "applies_to", appliesTo);
        if (!unit.isEmpty()) {
            doc.attribute(property, "unit", unit);
        }
        return property;
    }

    static String nonEmptyMetadata(AttributeColumn column, String key, String fallback) {
        return column.metadata(key)
                .filter(value -> !value.isEmpty())
                .orElse(fallback);
    }
}
