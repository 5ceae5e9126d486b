package com.purchasingpower.thesugraph.service.ids;

import com.purchasingpower.thesugraph.model.graph.GraphDocument;
import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.model.graph.NodeKind;
import com.purchasingpower.thesugraph.model.ids.IdSeed;
import com.purchasingpower.thesugraph.model.ids.MediatorId;
import com.purchasingpower.thesugraph.model.ids.RelationRole;
import com.purchasingpower.thesugraph.service.lowering.GraphEmitter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Mediator Id Generator Tests")
class MediatorIdGeneratorTest {

    private MediatorIdGenerator generator;
    private GraphEmitter emitter;

    @BeforeEach
    void setUp() {
        generator = new MediatorIdGenerator();
        emitter = new GraphEmitter(GraphDocument.withDefaultHeader());
    }

    @Test
    @DisplayName("Should shape ids by relation role")
    void testAllocate_RoleShapes() {
        assertEquals("T2_to_T1_1",
                generator.allocate(emitter, RelationRole.ENTAILMENT, "T1", "T2", IdSeed.numeric(1)).getValue());
        assertEquals("S1_to_omitted_TARGET_THESIS_2",
                generator.allocate(emitter, RelationRole.TARGET, "S1", "omitted_TARGET_THESIS", IdSeed.numeric(2)).getValue());
        assertEquals("M1_in_etiology_in_T1_1",
                generator.allocate(emitter, RelationRole.ETIOLOGY, "T1", "M1", IdSeed.numeric(1)).getValue());
        assertEquals("T3_analogy_to_T1_1",
                generator.allocate(emitter, RelationRole.ANALOGY, "T1", "T3", IdSeed.numeric(1)).getValue());
        assertEquals("M2_referenced-in_T1_1",
                generator.allocate(emitter, RelationRole.REFERENCE, "T1", "M2", IdSeed.numeric(1)).getValue());
    }

    @Test
    @DisplayName("Should step a numeric seed past ids already emitted")
    void testAllocate_NumericCollision() {
        // Given
        emitter.node(GraphNode.of("T2_to_T1_1", NodeKind.MEDIATOR));
        emitter.edge(GraphEdge.of("x", "T2_to_T1_2"));

        // When
        MediatorId id = generator.allocate(emitter, RelationRole.ENTAILMENT, "T1", "T2", IdSeed.numeric(1));

        // Then
        assertEquals("T2_to_T1_3", id.getValue());
        assertEquals(RelationRole.ENTAILMENT, id.getRole());
    }

    @Test
    @DisplayName("Should suffix a label seed on collision")
    void testAllocate_LabelCollision() {
        emitter.node(GraphNode.of("S1_to_omitted_ELEMENTS_unspecified", NodeKind.OMITTED));

        MediatorId id = generator.allocate(emitter, RelationRole.TARGET, "S1", "omitted_ELEMENTS", IdSeed.label("unspecified"));

        assertEquals("S1_to_omitted_ELEMENTS_unspecified_1", id.getValue());
    }

    @Test
    @DisplayName("Should treat a digit-only label seed as numeric")
    void testAllocate_DigitLabel() {
        MediatorId id = generator.allocate(emitter, RelationRole.TARGET, "S1", "omitted_TARGET_MISC", IdSeed.label("4"));

        assertEquals("S1_to_omitted_TARGET_MISC_4", id.getValue());
    }

    @Test
    @DisplayName("Should avoid etiology ids that occur inside longer emitted ids")
    void testAllocate_EtiologySubstringCollision() {
        emitter.node(GraphNode.of("x.M1_in_etiology_in_T1_1", NodeKind.MEDIATOR));

        MediatorId id = generator.allocate(emitter, RelationRole.ETIOLOGY, "T1", "M1", IdSeed.numeric(1));

        assertEquals("M1_in_etiology_in_T1_2", id.getValue());
    }

    @Test
    @DisplayName("Should reject composite values and blank owners")
    void testRejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> new MediatorId(RelationRole.TARGET, "('a', 'b')"));
        assertThrows(IllegalArgumentException.class,
                () -> generator.allocate(emitter, RelationRole.TARGET, " ", "T1", IdSeed.numeric(1)));
    }

    @Test
    @DisplayName("Should allocate the same ids for the same emitted set")
    void testAllocate_Deterministic() {
        GraphEmitter other = new GraphEmitter(GraphDocument.withDefaultHeader());
        emitter.node(GraphNode.of("P1_to_T1_1", NodeKind.MEDIATOR));
        other.node(GraphNode.of("P1_to_T1_1", NodeKind.MEDIATOR));

        assertEquals(
                generator.allocate(emitter, RelationRole.MATCHING_PROPOSITION, "T1", "P1", IdSeed.numeric(1)),
                generator.allocate(other, RelationRole.MATCHING_PROPOSITION, "T1", "P1", IdSeed.numeric(1)));
    }
}
