package com.purchasingpower.thesugraph.service.layout;

import com.purchasingpower.thesugraph.exception.LayoutOracleException;
import com.purchasingpower.thesugraph.model.graph.GraphDocument;
import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.layout.NodePosition;
import com.purchasingpower.thesugraph.service.LayoutOracle;
import com.purchasingpower.thesugraph.util.DotWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Flips the arrowhead of every edge that the top-to-bottom layout draws pointing upwards, so
 * arrows read downwards. Needs the layout engine; without it the graph is left as is.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DirectionCorrector {

    static final String RANK_DIR = "TB";
    private static final Set<String> FIXED_DIRECTIONS = Set.of("none", "back", "both");

    private final LayoutOracle layoutOracle;

    /**
     * @return number of edges marked {@code dir="back"}, or {@code -1} when the layout was unavailable
     */
    public int correct(GraphDocument graph) {
        Map<String, NodePosition> positions;
        try {
            positions = layoutOracle.layout(DotWriter.write(graph), RANK_DIR);
        } catch (LayoutOracleException e) {
            log.warn("⚠️ Layout engine unavailable, arrow directions left unchanged: {}", e.getMessage());
            return -1;
        }
        if (positions == null || positions.isEmpty()) {
            log.warn("⚠️ Layout engine returned no coordinates, arrow directions left unchanged");
            return -1;
        }

        int reversed = 0;
        for (GraphEdge edge : graph.edges()) {
            if (edge.hasValue("style", "invis") || (edge.has("dir") && FIXED_DIRECTIONS.contains(edge.get("dir")))) {
                continue;
            }
            NodePosition source = positions.get(edge.getSource());
            NodePosition target = positions.get(edge.getTarget());
            if (source != null && target != null && source.getY() < target.getY()) {
                edge.put("dir", "back");
                reversed++;
            }
        }
        log.info("✅ Direction correction reversed {} edge(s)", reversed);
        return reversed;
    }
}
