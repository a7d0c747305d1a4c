package com.phylotree.service;

import com.phylotree.model.AttributeColumn;
import com.phylotree.model.PhyloTree;
import com.phylotree.model.TreeRequest;
import com.phylotree.model.ValueKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TreeRequestMapperTest {

    private TreeRequestMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new TreeRequestMapper();
    }

    private static TreeRequest request(List<TreeRequest.Column> nodeColumns, List<TreeRequest.Column> edgeColumns) {
        return new TreeRequest(3,
                List.of(new TreeRequest.Edge(0, 1), new TreeRequest.Edge(0, 2)),
                nodeColumns, edgeColumns, null, null, null);
    }

    @Nested
    @DisplayName("toTree")
    class ToTree {

        @Test
        void buildsTreeWithTypedColumns() {
            TreeRequest request = request(
                    List.of(new TreeRequest.Column("node name", "string", null, List.of("r", "a", "b"), null),
                            new TreeRequest.Column("color", "unsigned char", 3,
                                    List.of(255, 0, 0, 0, 255, 0, 0, 0, 255), null)),
                    List.of(new TreeRequest.Column("weight", "double", null, List.of(1.5, 2), null)));

            PhyloTree tree = mapper.toTree(request);

            assertThat(tree.root()).isZero();
            assertThat(tree.children(0)).containsExactly(1, 2);
            AttributeColumn color = tree.nodeData().get("color").orElseThrow();
            assertThat(color.kind()).isEqualTo(ValueKind.UNSIGNED_BYTE);
            assertThat(color.components()).isEqualTo(3);
            assertThat(tree.edgeData().get("weight").orElseThrow().value(1).asDouble()).isEqualTo(2.0);
        }

        @Test
        void copiesColumnMetadata() {
            TreeRequest request = request(
                    List.of(new TreeRequest.Column("property.mass", "float", null, List.of(1, 2, 3),
                            Map.of("unit", "kg", "authority", "NCBI"))),
                    null);

            PhyloTree tree = mapper.toTree(request);

            AttributeColumn mass = tree.nodeData().get("property.mass").orElseThrow();
            assertThat(mass.metadata("unit")).contains("kg");
            assertThat(mass.metadata("authority")).contains("NCBI");
        }

        @Test
        void rejectsUnknownType() {
            TreeRequest request = request(
                    List.of(new TreeRequest.Column("x", "decimal", null, List.of(1, 2, 3), null)), null);

            assertThatThrownBy(() -> mapper.toTree(request))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unknown type 'decimal'");
        }

        @Test
        void rejectsUnnamedColumn() {
            TreeRequest request = request(
                    List.of(new TreeRequest.Column("", "int", null, List.of(1, 2, 3), null)), null);

            assertThatThrownBy(() -> mapper.toTree(request))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("without a name");
        }

        @Test
        void rejectsValuesThatDoNotFitType() {
            TreeRequest request = request(
                    List.of(new TreeRequest.Column("n", "int", null, List.of(1, "two", 3), null)), null);

            assertThatThrownBy(() -> mapper.toTree(request))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("'two'");

            TreeRequest overflowing = request(List.of(new TreeRequest.Column("n", "int", null,
                    List.of(1, BigInteger.TWO.pow(64).add(BigInteger.valueOf(5)), 3), null)), null);
            assertThatThrownBy(() -> mapper.toTree(overflowing))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("18446744073709551621");

            TreeRequest tooLarge = request(List.of(new TreeRequest.Column("n", "long", null,
                    List.of(1, 1e20, 3), null)), null);
            assertThatThrownBy(() -> mapper.toTree(tooLarge))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void rejectsNullEntries() {
            TreeRequest nullEdge = new TreeRequest(2, Arrays.asList(new TreeRequest.Edge(0, 1), null),
                    null, null, null, null, null);
            assertThatThrownBy(() -> mapper.toTree(nullEdge))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("edges");

            TreeRequest nullNodeColumn = request(Arrays.asList((TreeRequest.Column) null), null);
            assertThatThrownBy(() -> mapper.toTree(nullNodeColumn))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("nodeColumns");

            TreeRequest nullEdgeColumn = request(null, Arrays.asList((TreeRequest.Column) null));
            assertThatThrownBy(() -> mapper.toTree(nullEdgeColumn))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("edgeColumns");
        }

        @Test
        void rejectsColumnOfWrongLength() {
            TreeRequest request = request(
                    List.of(new TreeRequest.Column("n", "int", null, List.of(1, 2), null)), null);

            assertThatThrownBy(() -> mapper.toTree(request))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("has 2 rows");
        }
    }

    @Nested
    @DisplayName("toOptions")
    class ToOptions {

        @Test
        void keepsDefaultsWhenRequestIsSilent() {
            WriterOptions defaults = WriterOptions.defaults();

            WriterOptions options = mapper.toOptions(request(null, null), defaults);

            assertThat(options).isEqualTo(defaults);
        }

        @Test
        void overridesColumnsAndAddsIgnoredColumns() {
            WriterOptions defaults = WriterOptions.defaults().withIgnoredColumns(List.of("scratch"));
            TreeRequest request = new TreeRequest(1, List.of(), List.of(), List.of(),
                    "distance", "taxon", List.of("internal id"));

            WriterOptions options = mapper.toOptions(request, defaults);

            assertThat(options.edgeWeightColumn()).isEqualTo("distance");
            assertThat(options.nodeNameColumn()).isEqualTo("taxon");
            assertThat(options.ignoredColumns()).containsExactly("scratch", "internal id");
            assertThat(options.indent()).isEqualTo(defaults.indent());
        }
    }
}
