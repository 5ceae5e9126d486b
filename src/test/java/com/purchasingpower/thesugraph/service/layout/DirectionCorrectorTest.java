package com.purchasingpower.thesugraph.service.layout;

import com.purchasingpower.thesugraph.exception.LayoutOracleException;
import com.purchasingpower.thesugraph.model.graph.GraphDocument;
import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.model.graph.NodeKind;
import com.purchasingpower.thesugraph.model.layout.NodePosition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Direction Corrector Tests")
class DirectionCorrectorTest {

    private GraphDocument graph;
    private GraphEdge upward;
    private GraphEdge downward;
    private GraphEdge undirected;
    private GraphEdge invisible;

    @BeforeEach
    void setUp() {
        graph = GraphDocument.withDefaultHeader();
        graph.add(GraphNode.of("low", NodeKind.THESIS));
        graph.add(GraphNode.of("high", NodeKind.THESIS));
        upward = GraphEdge.of("low", "high").put("color", "#000000");
        downward = GraphEdge.of("high", "low");
        undirected = GraphEdge.of("low", "high").put("dir", "none");
        invisible = GraphEdge.of("low", "high").put("style", "invis");
        graph.add(upward);
        graph.add(downward);
        graph.add(undirected);
        graph.add(invisible);
    }

    @Test
    @DisplayName("Should mark edges drawn upwards as dir=back")
    void testCorrect_ReversesUpwardEdges() {
        // Given: plain output has y growing upwards
        DirectionCorrector corrector = new DirectionCorrector((dot, rankDir) -> {
            assertEquals("TB", rankDir);
            assertTrue(dot.startsWith("digraph G {"));
            return Map.of("low", new NodePosition(1.0, 1.0), "high", new NodePosition(1.0, 3.0));
        });

        // When
        int reversed = corrector.correct(graph);

        // Then
        assertEquals(1, reversed);
        assertEquals("back", upward.get("dir"));
        assertEquals("#000000", upward.get("color"));
        assertFalse(downward.has("dir"));
        assertEquals("none", undirected.get("dir"), "Undirected edges keep their direction");
        assertFalse(invisible.has("dir"), "Invisible edges are skipped");
    }

    @Test
    @DisplayName("Should leave the graph untouched when the layout engine fails")
    void testCorrect_EngineFailure() {
        DirectionCorrector corrector = new DirectionCorrector((dot, rankDir) -> {
            throw new LayoutOracleException("dot not found", "");
        });

        assertEquals(-1, corrector.correct(graph));
        assertFalse(upward.has("dir"));
    }

    @Test
    @DisplayName("Should leave the graph untouched when no coordinates come back")
    void testCorrect_EmptyLayout() {
        DirectionCorrector corrector = new DirectionCorrector((dot, rankDir) -> Map.of());

        assertEquals(-1, corrector.correct(graph));
        assertFalse(upward.has("dir"));
    }
}
