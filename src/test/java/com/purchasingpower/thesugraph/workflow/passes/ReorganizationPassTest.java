package com.purchasingpower.thesugraph.workflow.passes;

import com.purchasingpower.thesugraph.model.graph.AttributedStatement;
import com.purchasingpower.thesugraph.model.graph.Comment;
import com.purchasingpower.thesugraph.model.graph.GraphDocument;
import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.model.graph.GraphStatement;
import com.purchasingpower.thesugraph.model.graph.NodeKind;
import com.purchasingpower.thesugraph.model.graph.Subgraph;
import com.purchasingpower.thesugraph.model.graph.SubgraphKind;
import com.purchasingpower.thesugraph.workflow.pipeline.RewriteContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Reorganization Pass Tests")
class ReorganizationPassTest {

    private GraphDocument graph;
    private Subgraph source;

    @BeforeEach
    void setUp() {
        graph = GraphDocument.withDefaultHeader();
        source = new Subgraph("source_src_A", SubgraphKind.SOURCE).put("label", "src.A");
        source.add(owned(GraphNode.of("T1", NodeKind.THESIS), "T1"));
        source.add(owned(GraphNode.of("P1_to_T1_1", NodeKind.MEDIATOR).put("gephi_label", "matc"), "T1"));
        source.add(owned(GraphNode.of("P2_to_T1_1", NodeKind.MEDIATOR).put("gephi_label", "matc"), "T1"));
        source.add(owned(GraphNode.of("S1", NodeKind.SUPPORT), "S1"));
        source.add(owned(GraphNode.of("S1_func", NodeKind.MEDIATOR), "S1"));
        source.add(owned(GraphEdge.of("S1", "S1_func"), "S1"));
        graph.add(source);
        graph.add(owned(GraphNode.of("P1", NodeKind.PROPOSITION), "P1"));
        graph.add(owned(GraphNode.of("P2", NodeKind.PROPOSITION), "P2"));
        graph.add(owned(GraphNode.of("P3", NodeKind.PROPOSITION), "P3"));
        graph.add(owned(GraphEdge.of("P1", "P1_to_T1_1"), "T1"));
        graph.add(owned(GraphEdge.of("P2", "P2_to_T1_1"), "T1"));
        graph.add(GraphEdge.of("x", "y"));
    }

    private static <S extends AttributedStatement<S>> S owned(S statement, String owner) {
        statement.setOwner(owner);
        return statement;
    }

    private static List<String> describe(List<GraphStatement> statements) {
        return statements.stream().map(Object::toString).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should group statements by owner and place propositions around their thesis")
    void testApply_GroupsByOwner() {
        // When
        new ReorganizationPass().apply(new RewriteContext(graph, null, Set.of()));

        // Then
        List<GraphStatement> top = graph.getStatements();
        assertEquals(List.of("subgraph source_src_A", "PROPOSITION(P3)", "x -> y"), describe(top));

        Subgraph copy = (Subgraph) top.get(0);
        assertEquals("src.A", copy.get("label"));
        assertEquals(List.of(
                "PROPOSITION(P2)",
                "THESIS(T1)", "MEDIATOR(P1_to_T1_1)", "MEDIATOR(P2_to_T1_1)", "P1 -> P1_to_T1_1", "P2 -> P2_to_T1_1",
                "PROPOSITION(P1)",
                "SUPPORT(S1)", "MEDIATOR(S1_func)", "S1 -> S1_func"), describe(copy.getStatements()));
    }

    @Test
    @DisplayName("Should write every statement exactly once")
    void testApply_NothingLostOrDuplicated() {
        int nodes = graph.nodes().size();
        int edges = graph.edges().size();

        new ReorganizationPass().apply(new RewriteContext(graph, null, Set.of()));

        assertEquals(nodes, graph.nodes().size());
        assertEquals(edges, graph.edges().size());
    }

    @Test
    @DisplayName("Should put statements of unknown owners in a trailing catch-all section")
    void testApply_CatchAll() {
        graph.add(owned(GraphEdge.of("a", "b"), "ghost"));

        new ReorganizationPass().apply(new RewriteContext(graph, null, Set.of()));

        List<GraphStatement> top = graph.getStatements();
        GraphStatement marker = top.get(top.size() - 2);
        assertEquals(new Comment(ReorganizationPass.CATCH_ALL_COMMENT), marker);
        assertEquals("a -> b", top.get(top.size() - 1).toString());
    }
}
