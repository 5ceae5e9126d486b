package com.purchasingpower.thesugraph.model.graph;

import com.google.common.base.Preconditions;
import lombok.Getter;

@Getter
public class GraphNode extends AttributedStatement<GraphNode> {

    private final String id;
    private final NodeKind kind;

    public GraphNode(String id, NodeKind kind) {
        Preconditions.checkNotNull(id, "Node id cannot be null");
        Preconditions.checkNotNull(kind, "Node kind cannot be null");
        this.id = id;
        this.kind = kind;
    }

    public static GraphNode of(String id, NodeKind kind) {
        return new GraphNode(id, kind);
    }

    @Override
    protected GraphNode self() {
        return this;
    }

    @Override
    public String toString() {
        return kind + "(" + id + ")";
    }
}
