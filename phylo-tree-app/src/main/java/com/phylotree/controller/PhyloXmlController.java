package com.phylotree.controller;

import com.phylotree.model.PhyloTree;
import com.phylotree.model.TreeRequest;
import com.phylotree.service.PhyloXmlTreeWriter;
import com.phylotree.service.PhyloXmlWriteException;
import com.phylotree.service.TreeRequestMapper;
import com.phylotree.service.WriterOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.ByteArrayOutputStream;
import java.util.Map;

@RestController
@RequestMapping("/api/phyloxml")
public class PhyloXmlController {

    private static final Logger log = LoggerFactory.getLogger(PhyloXmlController.class);

    private final PhyloXmlTreeWriter treeWriter;
    private final TreeRequestMapper requestMapper;

    public PhyloXmlController(PhyloXmlTreeWriter treeWriter, TreeRequestMapper requestMapper) {
        this.treeWriter = treeWriter;
        this.requestMapper = requestMapper;
    }

    /**
     * Write the posted tree as a PhyloXML document.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> writeTree(@RequestBody TreeRequest request) {
        PhyloTree tree;
        WriterOptions options;
        try {
            tree = requestMapper.toTree(request);
            options = requestMapper.toOptions(request, treeWriter.defaultOptions());
        } catch (IllegalArgumentException e) {
            log.warn("Rejected tree request: {}", e.getMessage());
            return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON).body(Map.of("error", e.getMessage()));
        }

        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            treeWriter.write(tree, out, options);
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_XML)
                    .body(out.toByteArray());
        } catch (PhyloXmlWriteException e) {
            log.error("Failed to write PhyloXML ({})", e.getErrorCode(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("error", e.getMessage()));
        }
    }
}
