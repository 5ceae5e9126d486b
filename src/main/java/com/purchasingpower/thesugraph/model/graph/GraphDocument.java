package com.purchasingpower.thesugraph.model.graph;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * In-memory DOT digraph: graph-level attributes plus an ordered tree of statements.
 *
 * <p>Built once by lowering, mutated by the rewrite passes and serialized once by
 * {@link com.purchasingpower.thesugraph.util.DotWriter}.
 */
@Getter
public class GraphDocument implements StatementContainer {

    private final String name;
    private final Map<String, String> graphAttributes = new LinkedHashMap<>();
    private final List<GraphStatement> statements = new ArrayList<>();

    public GraphDocument(String name) {
        this.name = name;
    }

    /**
     * Creates an empty graph carrying the standard header.
     */
    public static GraphDocument withDefaultHeader() {
        GraphDocument document = new GraphDocument("G");
        document.graphAttributes.put("compound", "true");
        document.graphAttributes.put("newrank", "true");
        document.graphAttributes.put("rankdir", "TB");
        document.graphAttributes.put("splines", "curved");
        return document;
    }

    /**
     * All node definitions in document order, including those nested in subgraphs.
     */
    public List<GraphNode> nodes() {
        List<GraphNode> result = new ArrayList<>();
        collect(statements, GraphNode.class, result);
        return result;
    }

    public List<GraphEdge> edges() {
        List<GraphEdge> result = new ArrayList<>();
        collect(statements, GraphEdge.class, result);
        return result;
    }

    public List<Subgraph> subgraphs() {
        List<Subgraph> result = new ArrayList<>();
        collect(statements, Subgraph.class, result);
        return result;
    }

    public Set<String> nodeIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (GraphNode node : nodes()) {
            ids.add(node.getId());
        }
        return ids;
    }

    public Optional<GraphNode> findNode(String id) {
        return nodes().stream().filter(n -> n.getId().equals(id)).findFirst();
    }

    /**
     * Removes every matching statement at any depth. Subgraphs themselves are only removed
     * when the predicate matches them.
     *
     * @return number of removed statements
     */
    public int removeIf(Predicate<GraphStatement> predicate) {
        return removeIf(statements, predicate);
    }

    private static int removeIf(List<GraphStatement> list, Predicate<GraphStatement> predicate) {
        int removed = 0;
        Iterator<GraphStatement> it = list.iterator();
        while (it.hasNext()) {
            GraphStatement statement = it.next();
            if (predicate.test(statement)) {
                it.remove();
                removed++;
            } else if (statement instanceof Subgraph subgraph) {
                removed += removeIf(subgraph.getStatements(), predicate);
            }
        }
        return removed;
    }

    private static <T> void collect(List<GraphStatement> list, Class<T> type, List<T> sink) {
        for (GraphStatement statement : list) {
            if (type.isInstance(statement)) {
                sink.add(type.cast(statement));
            }
            if (statement instanceof Subgraph subgraph) {
                collect(subgraph.getStatements(), type, sink);
            }
        }
    }
}
