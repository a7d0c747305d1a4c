package com.phylotree.config;

import com.phylotree.service.WriterOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Default writer settings, bound from 'phyloxml.writer' in application.yml.
 */
@Configuration
@ConfigurationProperties(prefix = "phyloxml.writer")
public class PhyloXmlProperties {

    private String edgeWeightColumn = WriterOptions.DEFAULT_EDGE_WEIGHT_COLUMN;
    private String nodeNameColumn = WriterOptions.DEFAULT_NODE_NAME_COLUMN;
    private List<String> ignoredColumns = new ArrayList<>();
    private int indent = WriterOptions.DEFAULT_INDENT;
    private boolean xmlDeclaration = true;

    public WriterOptions toOptions() {
        return new WriterOptions(edgeWeightColumn, nodeNameColumn, ignoredColumns, indent, xmlDeclaration);
    }

    public String getEdgeWeightColumn() { return edgeWeightColumn; }
    public void setEdgeWeightColumn(String edgeWeightColumn) { this.edgeWeightColumn = edgeWeightColumn; }

    public String getNodeNameColumn() { return nodeNameColumn; }
    public void setNodeNameColumn(String nodeNameColumn) { this.nodeNameColumn = nodeNameColumn; }

    public List<String> getIgnoredColumns() { return ignoredColumns; }
    public void setIgnoredColumns(List<String> ignoredColumns) { this.ignoredColumns = ignoredColumns; }

    public int getIndent() { return indent; }
    public void setIndent(int indent) { this.indent = indent; }

    public boolean isXmlDeclaration() { return xmlDeclaration; }
    public void setXmlDeclaration(boolean xmlDeclaration) { this.xmlDeclaration = xmlDeclaration; }
}
