package com.purchasingpower.thesugraph.model.graph;

/**
 * One statement of a DOT graph body: a node, an edge, a subgraph or a comment.
 */
public interface GraphStatement {
}
