package com.purchasingpower.thesugraph.model.graph;

import java.util.List;

/**
 * Anything that holds an ordered statement list: the graph root or a subgraph.
 */
public interface StatementContainer {

    List<GraphStatement> getStatements();

    default void add(GraphStatement statement) {
        getStatements().add(statement);
    }
}
