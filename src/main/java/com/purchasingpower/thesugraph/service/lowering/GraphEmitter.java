package com.purchasingpower.thesugraph.service.lowering;

import com.purchasingpower.thesugraph.model.graph.AttributedStatement;
import com.purchasingpower.thesugraph.model.graph.GraphDocument;
import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.model.graph.GraphStatement;
import com.purchasingpower.thesugraph.model.graph.StatementContainer;
import com.purchasingpower.thesugraph.model.graph.Subgraph;
import com.purchasingpower.thesugraph.model.ids.EmittedIds;
import lombok.Getter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Append-only writer used during lowering. Statements go to the innermost open subgraph;
 * every node id and edge endpoint is recorded for mediator id allocation.
 */
public class GraphEmitter implements EmittedIds {

    @Getter
    private final GraphDocument document;
    private final Deque<StatementContainer> open = new ArrayDeque<>();
    private final Set<String> emittedIds = new LinkedHashSet<>();
    private final Deque<String> owners = new ArrayDeque<>();

    public GraphEmitter(GraphDocument document) {
        this.document = document;
        this.open.push(document);
    }

    public GraphNode node(GraphNode node) {
        emittedIds.add(node.getId());
        append(node);
        return node;
    }

    public GraphEdge edge(GraphEdge edge) {
        emittedIds.add(edge.getSource());
        emittedIds.add(edge.getTarget());
        append(edge);
        return edge;
    }

    public Subgraph openSubgraph(Subgraph subgraph) {
        append(subgraph);
        open.push(subgraph);
        return subgraph;
    }

    public void closeSubgraph() {
        if (open.size() > 1) {
            open.pop();
        }
    }

    /**
     * Statements appended until the matching {@link #endOwner()} are stamped with {@code ownerId}.
     */
    public void beginOwner(String ownerId) {
        owners.push(ownerId);
    }

    public void endOwner() {
        owners.poll();
    }

    public String currentOwner() {
        return owners.peek();
    }

    /**
     * Appends to the graph root regardless of open subgraphs.
     */
    public void appendToRoot(GraphStatement statement) {
        if (statement instanceof GraphEdge edge) {
            emittedIds.add(edge.getSource());
            emittedIds.add(edge.getTarget());
        } else if (statement instanceof GraphNode node) {
            emittedIds.add(node.getId());
        }
        document.add(statement);
    }

    public boolean isNodeDefined(String id) {
        return document.nodes().stream().anyMatch(n -> n.getId().equals(id));
    }

    @Override
    public boolean contains(String id) {
        return emittedIds.contains(id);
    }

    @Override
    public boolean anyContains(String fragment) {
        for (String id : emittedIds) {
            if (id.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    private void append(GraphStatement statement) {
        if (statement instanceof AttributedStatement<?> attributed && attributed.getOwner() == null) {
            attributed.setOwner(owners.peek());
        }
        open.peek().add(statement);
    }
}
