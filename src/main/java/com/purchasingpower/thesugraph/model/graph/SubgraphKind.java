package com.purchasingpower.thesugraph.model.graph;

/**
 * Role of a subgraph in the emitted graph.
 */
public enum SubgraphKind {
    SOURCE,
    SEQUENCE,
    ENTAILMENT
}
