package com.phylotree.service;

import com.phylotree.config.PhyloXmlProperties;
import com.phylotree.model.PhyloTree;
import com.phylotree.service.PhyloXmlWriteException.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link PhyloTree} and its node and edge columns as a PhyloXML document.
 *
 * The writer keeps no state between writes: every call builds its own document and
 * {@link EmissionLedger}, so one instance can serve concurrent writes of different trees.
 * A tree must not change while it is being written.
 */
@Service
public class PhyloXmlTreeWriter {

    public static final String DEFAULT_FILE_EXTENSION = "xml";

    private static final Logger log = LoggerFactory.getLogger(PhyloXmlTreeWriter.class);

    private final WriterOptions defaultOptions;
    private final TreeLevelSectionWriter treeLevelWriter;
    private final CladeWriter cladeWriter;

    @Autowired
    public PhyloXmlTreeWriter(PhyloXmlProperties properties) {
        this(properties.toOptions());
    }

    public PhyloXmlTreeWriter(WriterOptions defaultOptions) {
        this.defaultOptions = defaultOptions;
        PropertyElementWriter propertyWriter = new PropertyElementWriter();
        this.treeLevelWriter = new TreeLevelSectionWriter(propertyWriter);
        this.cladeWriter = new CladeWriter(propertyWriter);
    }

    public WriterOptions defaultOptions() {
        return defaultOptions;
    }

    public WriteSummary write(PhyloTree tree, OutputStream out) {
        return write(tree, out, defaultOptions);
    }

    /**
     * Write the document to {@code out}, which is flushed but left open.
     *
     * @throws PhyloXmlWriteException if the document cannot be built or the stream fails
     */
    public WriteSummary write(PhyloTree tree, OutputStream out, WriterOptions options) {
        EmissionLedger ledger = EmissionLedger.seededWith(options.ignoredColumns());
        PhyloXmlDocument doc = PhyloXmlDocument.create();

        treeLevelWriter.write(doc, tree, ledger);
        int clades = cladeWriter.write(doc, doc.phylogeny(), tree, options, ledger);

        doc.writeTo(out, options.indent(), options.xmlDeclaration());

        log.info("Wrote PhyloXML with {} clades, {} columns in ledger", clades, ledger.size());
        return new WriteSummary(clades, ledger.names());
    }

    public WriteSummary write(PhyloTree tree, Path file) {
        return write(tree, file, defaultOptions);
    }

    /**
     * Write the document to {@code file}, replacing any existing content.
     *
     * @throws PhyloXmlWriteException with {@link ErrorCode#CANNOT_OPEN_FILE} if the file cannot be opened
     */
    public WriteSummary write(PhyloTree tree, Path file, WriterOptions options) {
        OutputStream out;
        try {
            out = new BufferedOutputStream(Files.newOutputStream(file));
        } catch (IOException e) {
            throw new PhyloXmlWriteException(ErrorCode.CANNOT_OPEN_FILE,
                    "Cannot open " + file + " for writing: " + e.getMessage(), e);
        }

        try (out) {
            WriteSummary summary = write(tree, out, options);
            log.debug("PhyloXML written to {}", file);
            return summary;
        } catch (IOException e) {
            throw new PhyloXmlWriteException(ErrorCode.WRITE_FAILED,
                    "Failed to close " + file + ": " + e.getMessage(), e);
        }
    }

    public String writeToString(PhyloTree tree) {
        return writeToString(tree, defaultOptions);
    }

    public String writeToString(PhyloTree tree, WriterOptions options) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(tree, out, options);
        return out.toString(StandardCharsets.UTF_8);
    }
}
