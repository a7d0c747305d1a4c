package com.phylotree.controller;

import com.phylotree.service.PhyloXmlTreeWriter;
import com.phylotree.service.WriterOptions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.xpath;

@SpringBootTest
@AutoConfigureMockMvc
class PhyloXmlControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private PhyloXmlTreeWriter treeWriter;

    private static final String THREE_NODE_TREE = """
            {
              "nodeCount": 3,
              "edges": [ {"parent": 0, "child": 1}, {"parent": 0, "child": 2} ],
              "nodeColumns": [
                {"name": "node name", "type": "string", "values": ["root", "leafA", "leafB"]},
                {"name": "phylogeny.name", "type": "string", "values": ["Primate phylogeny", "", ""]},
                {"name": "property.habitat", "type": "string", "values": ["", "", "forest"],
                 "metadata": {"authority": "ENVO"}}
              ],
              "edgeColumns": [
                {"name": "weight", "type": "double", "values": [1.5, 2.25]}
              ]
            }
            """;

    @Test
    void writesPostedTreeAsPhyloXml() throws Exception {
        mockMvc.perform(post("/api/phyloxml")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(THREE_NODE_TREE))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_XML))
                .andExpect(xpath("/phyloxml/phylogeny/@rooted").string("true"))
                .andExpect(xpath("/phyloxml/phylogeny/name").string("Primate phylogeny"))
                .andExpect(xpath("count(//clade)").number(3.0))
                .andExpect(xpath("/phyloxml/phylogeny/clade/@branch_length").doesNotExist())
                .andExpect(xpath("/phyloxml/phylogeny/clade/clade[1]/@branch_length").string("1.5"))
                .andExpect(xpath("/phyloxml/phylogeny/clade/clade[2]/@branch_length").string("2.25"))
                .andExpect(xpath("/phyloxml/phylogeny/clade/clade[2]/name").string("leafB"))
                .andExpect(xpath("count(//property)").number(1.0))
                .andExpect(xpath("/phyloxml/phylogeny/clade/clade[2]/property/@ref").string("ENVO:habitat"));
    }

    @Test
    void appliesPerRequestColumnNames() throws Exception {
        String body = """
                {
                  "nodeCount": 2,
                  "edges": [ {"parent": 0, "child": 1} ],
                  "nodeColumns": [ {"name": "taxon", "type": "string", "values": ["Hominidae", "Pan"]} ],
                  "edgeColumns": [ {"name": "distance", "type": "float", "values": [0.5]} ],
                  "edgeWeightColumn": "distance",
                  "nodeNameColumn": "taxon"
                }
                """;

        mockMvc.perform(post("/api/phyloxml")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(xpath("/phyloxml/phylogeny/clade/name").string("Hominidae"))
                .andExpect(xpath("/phyloxml/phylogeny/clade/clade/@branch_length").string("0.5"))
                .andExpect(xpath("count(//property)").number(0.0));
    }

    @Test
    void rejectsInvalidTree() throws Exception {
        String body = """
                {"nodeCount": 2, "edges": []}
                """;

        mockMvc.perform(post("/api/phyloxml")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("exactly one root")));
    }

    @Test
    void rejectsUnknownColumnType() throws Exception {
        String body = """
                {"nodeCount": 1, "nodeColumns": [ {"name": "x", "type": "decimal", "values": [1]} ]}
                """;

        mockMvc.perform(post("/api/phyloxml")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("Unknown type 'decimal'")));
    }

    @Test
    void rejectsIntegerTooLargeForColumnType() throws Exception {
        String body = """
                {"nodeCount": 1, "nodeColumns": [ {"name": "x", "type": "int", "values": [18446744073709551621]} ]}
                """;

        mockMvc.perform(post("/api/phyloxml")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("18446744073709551621")));
    }

    @Test
    void rejectsNullEdge() throws Exception {
        String body = """
                {"nodeCount": 2, "edges": [ {"parent": 0, "child": 1}, null ]}
                """;

        mockMvc.perform(post("/api/phyloxml")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("Null entry in edges")));
    }

    @Test
    void bindsWriterDefaultsFromConfiguration() {
        assertThat(treeWriter.defaultOptions()).isEqualTo(WriterOptions.defaults());
    }
}
