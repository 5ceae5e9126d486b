package com.purchasingpower.thesugraph.service;

import com.purchasingpower.thesugraph.exception.LayoutOracleException;
import com.purchasingpower.thesugraph.model.layout.NodePosition;

import java.util.Map;

/**
 * Lays out DOT text and reports where each node ended up.
 */
public interface LayoutOracle {

    /**
     * @param dotText  the graph to lay out
     * @param rankDir  rank direction forced on the graph, e.g. {@code TB}
     * @return node id to position; empty when the engine placed nothing
     * @throws LayoutOracleException if the engine is missing, fails or times out
     */
    Map<String, NodePosition> layout(String dotText, String rankDir);
}
