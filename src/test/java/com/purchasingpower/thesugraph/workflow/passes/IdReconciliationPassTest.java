package com.purchasingpower.thesugraph.workflow.passes;

import com.purchasingpower.thesugraph.model.graph.GraphDocument;
import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.model.graph.NodeKind;
import com.purchasingpower.thesugraph.workflow.pipeline.RewriteContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Id Reconciliation Pass Tests")
class IdReconciliationPassTest {

    @Test
    @DisplayName("Should point edges at emitted phase ids and drop the original id attribute")
    void testApply_RewritesEndpoints() {
        // Given
        GraphDocument graph = GraphDocument.withDefaultHeader();
        graph.add(GraphNode.of("src.A.q100001001", NodeKind.PHASE).put("original_xml_id", "src.A.H100001"));
        graph.add(GraphNode.of("src.A.S1_func", NodeKind.MEDIATOR));
        GraphEdge full = GraphEdge.of("src.A.S1_func", "src.A.H100001").put("color", "#112233");
        GraphEdge local = GraphEdge.of("src.B.H100001", "src.A.S1_func");
        GraphEdge untouched = GraphEdge.of("src.A.S1_func", "src.A.T1");
        graph.add(full);
        graph.add(local);
        graph.add(untouched);
        RewriteContext context = new RewriteContext(graph, null, Set.of());

        // When
        new IdReconciliationPass().apply(context);

        // Then
        assertEquals("src.A.q100001001", full.getTarget());
        assertEquals("#112233", full.get("color"), "Attributes survive the rewrite");
        assertEquals("src.B.q100001001", local.getSource(), "Local part is mapped under the edge's own prefix");
        assertEquals("src.A.T1", untouched.getTarget());
        assertFalse(graph.findNode("src.A.q100001001").orElseThrow().has("original_xml_id"));
        assertEquals(2, context.countOf("edges.reconciled"));
    }

    @Test
    @DisplayName("Should ignore nodes whose ids do not have the phase shapes")
    void testMapping_IgnoresOtherShapes() {
        GraphDocument graph = GraphDocument.withDefaultHeader();
        graph.add(GraphNode.of("src.A.T1", NodeKind.THESIS).put("original_xml_id", "src.A.H100001"));
        graph.add(GraphNode.of("src.A.q100001001", NodeKind.PHASE).put("original_xml_id", "phase-one"));

        assertTrue(IdReconciliationPass.mapping(new RewriteContext(graph, null, Set.of())).isEmpty());
    }

    @Test
    @DisplayName("Should resolve full ids before local parts")
    void testResolve() {
        Map<String, String> mapping = new LinkedHashMap<>();
        mapping.put("x.H000001", "y.q000001001");
        mapping.put("H000001", "q000001001");

        assertEquals("y.q000001001", IdReconciliationPass.resolve("x.H000001", mapping));
        assertEquals("z.q000001001", IdReconciliationPass.resolve("z.H000001", mapping));
        assertEquals("z.T1", IdReconciliationPass.resolve("z.T1", mapping));
    }
}
