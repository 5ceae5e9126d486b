package com.purchasingpower.thesugraph.workflow.passes;

import com.purchasingpower.thesugraph.model.graph.GraphDocument;
import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.model.graph.NodeKind;
import com.purchasingpower.thesugraph.model.graph.Subgraph;
import com.purchasingpower.thesugraph.model.graph.SubgraphKind;
import com.purchasingpower.thesugraph.util.DotWriter;
import com.purchasingpower.thesugraph.workflow.pipeline.RewriteContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Deduplication Pass Tests")
class DeduplicationPassTest {

    @Test
    @DisplayName("Should keep the first of identical statements, even across subgraphs")
    void testApply_RemovesRepeats() {
        // Given
        GraphDocument graph = GraphDocument.withDefaultHeader();
        Subgraph source = new Subgraph("source_A", SubgraphKind.SOURCE);
        source.add(GraphNode.of("T1", NodeKind.THESIS).put("label", "x"));
        source.add(GraphEdge.of("T1", "T2"));
        graph.add(source);
        graph.add(GraphNode.of("T1", NodeKind.THESIS).put("label", "x"));
        graph.add(GraphNode.of("T1", NodeKind.THESIS).put("label", "y"));
        graph.add(GraphEdge.of("T1", "T2"));
        graph.add(GraphEdge.of("T1", "T2").put("dir", "none"));
        RewriteContext context = new RewriteContext(graph, null, Set.of());

        // When
        new DeduplicationPass().apply(context);

        // Then
        assertEquals(2, context.countOf("statements.deduplicated"));
        assertEquals(2, graph.nodes().size(), "Differently attributed definitions are distinct");
        assertEquals(2, graph.edges().size());
        assertEquals(2, source.getStatements().size(), "First occurrences stay where they were");
    }

    @Test
    @DisplayName("Should be idempotent")
    void testApply_Idempotent() {
        GraphDocument graph = GraphDocument.withDefaultHeader();
        graph.add(GraphNode.of("a", NodeKind.MISC));
        graph.add(GraphNode.of("a", NodeKind.MISC));
        graph.add(GraphEdge.of("a", "a_func"));
        DeduplicationPass pass = new DeduplicationPass();

        pass.apply(new RewriteContext(graph, null, Set.of()));
        String once = DotWriter.write(graph);
        RewriteContext second = new RewriteContext(graph, null, Set.of());
        pass.apply(second);

        assertEquals(once, DotWriter.write(graph));
        assertEquals(0, second.countOf("statements.deduplicated"));
    }
}
