package com.purchasingpower.thesugraph.model.graph;

import com.google.common.base.Preconditions;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Named subgraph. Its own attributes are written as {@code key=value;} declaration lines
 * directly after the opening brace.
 */
@Getter
public class Subgraph extends AttributedStatement<Subgraph> implements StatementContainer {

    private final String name;
    private final SubgraphKind kind;
    private final List<GraphStatement> statements = new ArrayList<>();

    public Subgraph(String name, SubgraphKind kind) {
        Preconditions.checkNotNull(name, "Subgraph name cannot be null");
        this.name = name;
        this.kind = kind;
    }

    public boolean isCluster() {
        return name.startsWith("cluster_");
    }

    @Override
    protected Subgraph self() {
        return this;
    }

    @Override
    public String toString() {
        return "subgraph " + name;
    }
}
