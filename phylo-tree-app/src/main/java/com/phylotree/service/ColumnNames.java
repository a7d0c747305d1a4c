package com.phylotree.service;

/**
 * Naming conventions that tie columns to PhyloXML elements.
 */
public final class ColumnNames {

    public static final String TREE_LEVEL_PREFIX = "phylogeny.";
    public static final String TREE_LEVEL_PROPERTY_PREFIX = "phylogeny.property.";
    public static final String PROPERTY_PREFIX = "property.";

    public static final String CONFIDENCE = "confidence";
    public static final String COLOR = "color";

    private ColumnNames() {
    }

    /**
     * Column that feeds the phylogeny-level element {@code elementName}, e.g. "phylogeny.name".
     */
    public static String treeLevelColumn(String elementName) {
        return TREE_LEVEL_PREFIX + elementName;
    }

    public static boolean isTreeLevelProperty(String columnName) {
        return columnName != null && columnName.startsWith(TREE_LEVEL_PROPERTY_PREFIX);
    }

    /**
     * Name used after the authority in a property's {@code ref}: everything after the first
     * "property.", so both "property.habitat" and "phylogeny.property.habitat" give "habitat".
     * Names without the marker are returned unchanged.
     */
    public static String propertyLocalName(String columnName) {
        int start = columnName.indexOf(PROPERTY_PREFIX);
        if (start < 0) {
            return columnName;
        }
        return columnName.substring(start + PROPERTY_PREFIX.length());
    }
}
