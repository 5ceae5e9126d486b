package com.purchasingpower.thesugraph.model.graph;

import com.google.common.base.Preconditions;
import lombok.Getter;
import lombok.Setter;

/**
 * Directed edge between two node ids. Endpoints may be rewritten in place by the rewrite passes;
 * the attribute list is never touched when they are.
 */
@Getter
@Setter
public class GraphEdge extends AttributedStatement<GraphEdge> {

    private String source;
    private String target;

    public GraphEdge(String source, String target) {
        Preconditions.checkNotNull(source, "Edge source cannot be null");
        Preconditions.checkNotNull(target, "Edge target cannot be null");
        this.source = source;
        this.target = target;
    }

    public static GraphEdge of(String source, String target) {
        return new GraphEdge(source, target);
    }

    public boolean touches(String nodeId) {
        return source.equals(nodeId) || target.equals(nodeId);
    }

    public boolean isSelfLoop() {
        return source.equals(target);
    }

    @Override
    protected GraphEdge self() {
        return this;
    }

    @Override
    public String toString() {
        return source + " -> " + target;
    }
}
