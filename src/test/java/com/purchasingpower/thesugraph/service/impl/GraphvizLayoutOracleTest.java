package com.purchasingpower.thesugraph.service.impl;

import com.purchasingpower.thesugraph.model.layout.NodePosition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graphviz Layout Oracle Tests")
class GraphvizLayoutOracleTest {

    @Test
    @DisplayName("Should read node coordinates from plain output, quoted ids included")
    void testParsePlain() {
        // Given
        String plain = String.join("\n",
                "graph 1 4.5 6.25",
                "node src.A.T1 1.25 5.5 2 0.5 \"THESIS\" solid box black lightgrey",
                "node \"id with space\" 2 0.75 1 0.5 x solid ellipse black white",
                "node broken x y 1 1",
                "edge src.A.T1 \"id with space\" 4 1 1 1 1 1 1 1 1 solid black",
                "stop");

        // When
        Map<String, NodePosition> positions = GraphvizLayoutOracle.parsePlain(plain);

        // Then
        assertEquals(2, positions.size());
        assertEquals(new NodePosition(1.25, 5.5), positions.get("src.A.T1"));
        assertEquals(0.75, positions.get("id with space").getY());
    }

    @Test
    @DisplayName("Should split on spaces outside quotes and stop at the limit")
    void testTokenize() {
        List<String> tokens = GraphvizLayoutOracle.tokenize("node \"a \\\"b\\\" c\" 1 2 rest ignored", 4);

        assertEquals(List.of("node", "a \"b\" c", "1", "2"), tokens);
    }
}
