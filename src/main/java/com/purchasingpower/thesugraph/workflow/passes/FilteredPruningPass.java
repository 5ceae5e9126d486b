package com.purchasingpower.thesugraph.workflow.passes;

import com.purchasingpower.thesugraph.model.graph.GraphDocument;
import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.model.graph.NodeKind;
import com.purchasingpower.thesugraph.workflow.pipeline.RewriteContext;
import com.purchasingpower.thesugraph.workflow.pipeline.RewritePass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Prunes filtered placeholders that no longer lead anywhere.
 *
 * <ol>
 *   <li>A placeholder is kept when a path through mediators alone reaches a real node.</li>
 *   <li>Mediators are swept until none is removed: a mediator survives while it links two
 *       surviving nodes, directly or through a chain of surviving mediators.</li>
 *   <li>Kept placeholders that were joined only through discarded placeholders get a direct dashed
 *       edge, oriented by the majority of hop directions on the connecting path.</li>
 * </ol>
 *
 * Runs only when elements were excluded.
 */
@Slf4j
@Component
@Order(5)
public class FilteredPruningPass implements RewritePass {

    static final String INDIRECT_COLOR = "#999999";

    @Override
    public void apply(RewriteContext context) {
        if (!context.hasExclusions()) {
            return;
        }
        GraphDocument graph = context.getGraph();
        Set<String> filtered = new LinkedHashSet<>();
        Set<String> mediators = new LinkedHashSet<>();
        Set<String> real = new LinkedHashSet<>();
        for (GraphNode node : graph.nodes()) {
            if (isFiltered(node)) {
                filtered.add(node.getId());
            } else if (isMediator(node.getId())) {
                mediators.add(node.getId());
            } else {
                real.add(node.getId());
            }
        }
        if (filtered.isEmpty()) {
            return;
        }

        List<GraphEdge> edges = graph.edges();
        Map<String, Set<String>> adjacency = adjacency(edges, null);

        Set<String> kept = new LinkedHashSet<>();
        for (String node : filtered) {
            if (reachesReal(node, adjacency, mediators, real)) {
                kept.add(node);
            }
        }
        Set<String> discarded = new LinkedHashSet<>(filtered);
        discarded.removeAll(kept);

        List<IndirectLink> links = indirectLinks(edges, filtered, mediators, kept);

        Set<String> survivingNodes = new HashSet<>(real);
        survivingNodes.addAll(kept);
        List<GraphEdge> survivingEdges = new ArrayList<>();
        for (GraphEdge edge : edges) {
            if (!discarded.contains(edge.getSource()) && !discarded.contains(edge.getTarget())) {
                survivingEdges.add(edge);
            }
        }
        Set<String> danglingMediators = sweepMediators(survivingEdges, mediators, survivingNodes);

        Set<String> purge = new HashSet<>(discarded);
        purge.addAll(danglingMediators);
        int removedEdges = graph.removeIf(statement -> statement instanceof GraphEdge edge
                && (purge.contains(edge.getSource()) || purge.contains(edge.getTarget())));
        graph.removeIf(statement -> statement instanceof GraphNode node && purge.contains(node.getId()));

        for (IndirectLink link : links) {
            graph.add(GraphEdge.of(link.source(), link.target())
                    .put("style", "dashed")
                    .put("color", INDIRECT_COLOR)
                    .put("xlabel", link.collapsed() > 0 ? "via " + link.collapsed() + " filtered" : "indirectly connected")
                    .put("fontsize", "9")
                    .put("fontcolor", INDIRECT_COLOR));
        }

        context.count("nodes.filteredPruned", discarded.size());
        context.count("nodes.mediatorsPruned", danglingMediators.size());
        context.count("edges.pruned", removedEdges);
        context.count("edges.indirect", links.size());
        log.info("Pruned {} filtered node(s), {} dangling mediator(s), {} edge(s); added {} indirect edge(s)",
                discarded.size(), danglingMediators.size(), removedEdges, links.size());
    }

    /**
     * Relation mediators: function and employed mediators plus the two-hop relation nodes.
     */
    public static boolean isMediator(String nodeId) {
        return nodeId.endsWith("_func")
                || nodeId.endsWith("_employed")
                || nodeId.contains("_to_")
                || nodeId.contains("_in_etiology_in_")
                || nodeId.contains("_analogy_to_")
                || nodeId.contains("_referenced-in_");
    }

    static boolean isFiltered(GraphNode node) {
        return node.getKind() == NodeKind.FILTERED_PLACEHOLDER || node.getId().endsWith(EdgeValidationPass.PLACEHOLDER_SUFFIX);
    }

    private static boolean reachesReal(String start, Map<String, Set<String>> adjacency, Set<String> mediators, Set<String> real) {
        Set<String> visited = new HashSet<>();
        visited.add(start);
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            for (String neighbour : adjacency.getOrDefault(queue.poll(), Collections.emptySet())) {
                if (!visited.add(neighbour)) {
                    continue;
                }
                if (real.contains(neighbour)) {
                    return true;
                }
                if (mediators.contains(neighbour)) {
                    queue.add(neighbour);
                }
            }
        }
        return false;
    }

    /**
     * Walks each connected component of the placeholder-and-mediator subgraph as a spanning tree
     * over its kept placeholders, counting the discarded placeholders crossed on the way.
     */
    private static List<IndirectLink> indirectLinks(List<GraphEdge> edges, Set<String> filtered, Set<String> mediators,
                                                    Set<String> kept) {
        List<IndirectLink> links = new ArrayList<>();
        if (kept.size() < 2) {
            return links;
        }
        Set<String> restricted = new HashSet<>(filtered);
        restricted.addAll(mediators);
        Map<String, Set<String>> adjacency = adjacency(edges, restricted);
        Set<String> forward = new HashSet<>();
        for (GraphEdge edge : edges) {
            if (restricted.contains(edge.getSource()) && restricted.contains(edge.getTarget())) {
                forward.add(edge.getSource() + "\u0000" + edge.getTarget());
            }
        }

        Set<String> componentVisited = new HashSet<>();
        for (String start : filtered) {
            if (!componentVisited.add(start)) {
                continue;
            }
            Set<String> componentFiltered = new LinkedHashSet<>();
            Deque<String> queue = new ArrayDeque<>();
            queue.add(start);
            while (!queue.isEmpty()) {
                String node = queue.poll();
                if (filtered.contains(node)) {
                    componentFiltered.add(node);
                }
                for (String neighbour : adjacency.getOrDefault(node, Collections.emptySet())) {
                    if (componentVisited.add(neighbour)) {
                        queue.add(neighbour);
                    }
                }
            }
            Set<String> keptInComponent = new LinkedHashSet<>(componentFiltered);
            keptInComponent.retainAll(kept);
            if (keptInComponent.size() >= 2) {
                links.addAll(spanningLinks(keptInComponent, filtered, mediators, adjacency, forward));
            }
        }
        return links;
    }

    private static List<IndirectLink> spanningLinks(Set<String> keptInComponent, Set<String> filtered, Set<String> mediators,
                                                    Map<String, Set<String>> adjacency, Set<String> forward) {
        List<IndirectLink> links = new ArrayList<>();
        String root = keptInComponent.iterator().next();
        Set<String> treeVisited = new HashSet<>();
        treeVisited.add(root);
        Deque<String> treeQueue = new ArrayDeque<>();
        treeQueue.add(root);
        while (!treeQueue.isEmpty()) {
            String from = treeQueue.poll();
            Set<String> visited = new HashSet<>();
            visited.add(from);
            Deque<Hop> queue = new ArrayDeque<>();
            queue.add(new Hop(from, 0, 0, 0));
            while (!queue.isEmpty()) {
                Hop hop = queue.poll();
                for (String neighbour : adjacency.getOrDefault(hop.node(), Collections.emptySet())) {
                    if (!visited.add(neighbour)) {
                        continue;
                    }
                    boolean isForward = forward.contains(hop.node() + "\u0000" + neighbour);
                    int fwd = hop.forward() + (isForward ? 1 : 0);
                    int bwd = hop.backward() + (isForward ? 0 : 1);
                    if (keptInComponent.contains(neighbour)) {
                        if (treeVisited.add(neighbour)) {
                            treeQueue.add(neighbour);
                            links.add(fwd >= bwd
                                    ? new IndirectLink(from, neighbour, hop.collapsed())
                                    : new IndirectLink(neighbour, from, hop.collapsed()));
                        }
                    } else if (mediators.contains(neighbour)) {
                        queue.add(new Hop(neighbour, hop.collapsed(), fwd, bwd));
                    } else if (filtered.contains(neighbour)) {
                        queue.add(new Hop(neighbour, hop.collapsed() + 1, fwd, bwd));
                    }
                }
            }
        }
        return links;
    }

    /**
     * Fixed-point sweep over mediators.
     *
     * @return mediators to discard
     */
    private static Set<String> sweepMediators(List<GraphEdge> survivingEdges, Set<String> mediators, Set<String> survivingNodes) {
        Set<String> removed = new LinkedHashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            Map<String, Set<String>> adjacency = new LinkedHashMap<>();
            for (GraphEdge edge : survivingEdges) {
                if (removed.contains(edge.getSource()) || removed.contains(edge.getTarget())) {
                    continue;
                }
                link(adjacency, edge.getSource(), edge.getTarget());
            }
            for (String mediator : mediators) {
                if (removed.contains(mediator)) {
                    continue;
                }
                Set<String> neighbours = adjacency.getOrDefault(mediator, Collections.emptySet());
                long realNeighbours = neighbours.stream().filter(survivingNodes::contains).count();
                boolean mediatorNeighbour = neighbours.stream().anyMatch(n -> mediators.contains(n) && !removed.contains(n));
                if (realNeighbours >= 2) {
                    continue;
                }
                if (realNeighbours == 1 && mediatorNeighbour
                        && chainReach(mediator, adjacency, mediators, removed, survivingNodes) >= 2) {
                    continue;
                }
                removed.add(mediator);
                changed = true;
            }
        }
        return removed;
    }

    private static int chainReach(String mediator, Map<String, Set<String>> adjacency, Set<String> mediators,
                                  Set<String> removed, Set<String> survivingNodes) {
        Set<String> visited = new HashSet<>();
        visited.add(mediator);
        Set<String> reached = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(mediator);
        while (!queue.isEmpty()) {
            for (String neighbour : adjacency.getOrDefault(queue.poll(), Collections.emptySet())) {
                if (removed.contains(neighbour) || !visited.add(neighbour)) {
                    continue;
                }
                if (survivingNodes.contains(neighbour)) {
                    reached.add(neighbour);
                } else if (mediators.contains(neighbour)) {
                    queue.add(neighbour);
                }
            }
        }
        return reached.size();
    }

    /**
     * Undirected adjacency, optionally restricted to edges with both ends in {@code within}.
     */
    private static Map<String, Set<String>> adjacency(List<GraphEdge> edges, Set<String> within) {
        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        for (GraphEdge edge : edges) {
            if (within == null || (within.contains(edge.getSource()) && within.contains(edge.getTarget()))) {
                link(adjacency, edge.getSource(), edge.getTarget());
            }
        }
        return adjacency;
    }

    private static void link(Map<String, Set<String>> adjacency, String a, String b) {
        adjacency.computeIfAbsent(a, k -> new LinkedHashSet<>()).add(b);
        adjacency.computeIfAbsent(b, k -> new LinkedHashSet<>()).add(a);
    }

    private record Hop(String node, int collapsed, int forward, int backward) {
    }

    record IndirectLink(String source, String target, int collapsed) {
    }
}
