package com.purchasingpower.thesugraph.workflow.passes;

import com.purchasingpower.thesugraph.model.graph.AttributedStatement;
import com.purchasingpower.thesugraph.model.graph.Comment;
import com.purchasingpower.thesugraph.model.graph.GraphDocument;
import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.model.graph.GraphStatement;
import com.purchasingpower.thesugraph.model.graph.NodeKind;
import com.purchasingpower.thesugraph.model.graph.StatementContainer;
import com.purchasingpower.thesugraph.model.graph.Subgraph;
import com.purchasingpower.thesugraph.model.graph.SubgraphKind;
import com.purchasingpower.thesugraph.workflow.pipeline.RewriteContext;
import com.purchasingpower.thesugraph.workflow.pipeline.RewritePass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Regroups the graph by owning element.
 *
 * <p>Every statement stamped with an owner is written in one block with its owner's other
 * statements, inside the source subgraph where the owner first appears. Each proposition is moved
 * next to the first thesis it matches: of the n propositions paired with a thesis, the first
 * ceil(n/2) follow it and the rest precede it. Unpaired propositions, then statements without an
 * owner, follow the sources; anything still unwritten lands in a trailing catch-all section.
 * Cluster subgraphs move as a whole. No statement is written twice.
 */
@Slf4j
@Component
@Order(2)
public class ReorganizationPass implements RewritePass {

    static final String CATCH_ALL_COMMENT = "Unplaced statements";

    private static final Set<NodeKind> ELEMENT_KINDS = Set.of(NodeKind.THESIS, NodeKind.SUPPORT, NodeKind.MISC);

    @Override
    public void apply(RewriteContext context) {
        GraphDocument graph = context.getGraph();
        Layout layout = Layout.of(graph);

        Map<String, List<String>> before = new HashMap<>();
        Map<String, List<String>> after = new HashMap<>();
        List<String> unpaired = new ArrayList<>();
        pairPropositions(graph, layout, before, after, unpaired);

        Writer writer = new Writer(layout);
        List<GraphStatement> output = new ArrayList<>();
        for (Subgraph source : layout.sources) {
            Subgraph copy = new Subgraph(source.getName(), source.getKind());
            copy.getAttributes().putAll(source.getAttributes());
            writeOwners(source, copy, layout, before, after, writer);
            if (!copy.getStatements().isEmpty()) {
                output.add(copy);
            }
        }
        StatementContainer root = new ListContainer(output);
        writeOwners(null, root, layout, before, after, writer);
        for (String proposition : unpaired) {
            writer.writeBlock(proposition, root);
        }
        for (GraphStatement unit : layout.units) {
            if (ownerOf(unit) == null) {
                writer.write(unit, root);
            }
        }
        List<GraphStatement> leftovers = writer.unwritten();
        if (!leftovers.isEmpty()) {
            log.warn("⚠️ {} statement(s) could not be placed by owner", leftovers.size());
            output.add(new Comment(CATCH_ALL_COMMENT));
            leftovers.forEach(unit -> writer.write(unit, root));
        }

        graph.getStatements().clear();
        graph.getStatements().addAll(output);
        context.count("statements.reorganized", layout.units.size());
        log.debug("Reorganized {} statement(s), {} proposition(s) paired",
                layout.units.size(), layout.propositions().size() - unpaired.size());
    }

    private static void writeOwners(Subgraph container, StatementContainer target, Layout layout,
                                    Map<String, List<String>> before, Map<String, List<String>> after, Writer writer) {
        for (Map.Entry<String, Subgraph> entry : layout.ownerContainers.entrySet()) {
            String owner = entry.getKey();
            NodeKind kind = layout.kinds.get(owner);
            if (entry.getValue() != container || kind == null || !ELEMENT_KINDS.contains(kind)) {
                continue;
            }
            before.getOrDefault(owner, Collections.emptyList()).forEach(p -> writer.writeBlock(p, target));
            writer.writeBlock(owner, target);
            after.getOrDefault(owner, Collections.emptyList()).forEach(p -> writer.writeBlock(p, target));
        }
    }

    /**
     * Pairs each proposition with the owner of the first MATCHES mediator it points at.
     */
    private static void pairPropositions(GraphDocument graph, Layout layout, Map<String, List<String>> before,
                                         Map<String, List<String>> after, List<String> unpaired) {
        Map<String, GraphNode> nodes = new HashMap<>();
        for (GraphNode node : graph.nodes()) {
            nodes.putIfAbsent(node.getId(), node);
        }
        Map<String, List<String>> byThesis = new LinkedHashMap<>();
        for (String proposition : layout.propositions()) {
            String thesis = null;
            for (GraphEdge edge : graph.edges()) {
                GraphNode mediator = nodes.get(edge.getTarget());
                if (edge.getSource().equals(proposition) && mediator != null && mediator.hasValue("gephi_label", "matc")
                        && layout.kinds.get(mediator.getOwner()) == NodeKind.THESIS) {
                    thesis = mediator.getOwner();
                    break;
                }
            }
            if (thesis == null) {
                unpaired.add(proposition);
            } else {
                byThesis.computeIfAbsent(thesis, k -> new ArrayList<>()).add(proposition);
            }
        }
        for (Map.Entry<String, List<String>> entry : byThesis.entrySet()) {
            List<String> paired = entry.getValue();
            int followCount = (paired.size() + 1) / 2;
            after.put(entry.getKey(), new ArrayList<>(paired.subList(0, followCount)));
            before.put(entry.getKey(), new ArrayList<>(paired.subList(followCount, paired.size())));
        }
    }

    static String ownerOf(GraphStatement statement) {
        return statement instanceof AttributedStatement<?> attributed ? attributed.getOwner() : null;
    }

    /**
     * Statements flattened out of the source subgraphs, with the source each owner first appears in.
     */
    private static final class Layout {

        private final List<Subgraph> sources = new ArrayList<>();
        private final List<GraphStatement> units = new ArrayList<>();
        private final Map<String, Subgraph> ownerContainers = new LinkedHashMap<>();
        private final Map<String, NodeKind> kinds = new HashMap<>();

        static Layout of(GraphDocument graph) {
            Layout layout = new Layout();
            for (GraphNode node : graph.nodes()) {
                layout.kinds.putIfAbsent(node.getId(), node.getKind());
            }
            for (GraphStatement statement : graph.getStatements()) {
                if (statement instanceof Subgraph subgraph && subgraph.getKind() == SubgraphKind.SOURCE) {
                    layout.sources.add(subgraph);
                    subgraph.getStatements().forEach(unit -> layout.add(unit, subgraph));
                } else {
                    layout.add(statement, null);
                }
            }
            return layout;
        }

        private void add(GraphStatement unit, Subgraph container) {
            units.add(unit);
            String owner = ownerOf(unit);
            if (owner != null && !ownerContainers.containsKey(owner)) {
                ownerContainers.put(owner, container);
            }
        }

        List<String> propositions() {
            List<String> result = new ArrayList<>();
            for (String owner : ownerContainers.keySet()) {
                if (kinds.get(owner) == NodeKind.PROPOSITION) {
                    result.add(owner);
                }
            }
            return result;
        }
    }

    /**
     * Write-once placement of units.
     */
    private static final class Writer {

        private final Layout layout;
        private final Set<GraphStatement> written = Collections.newSetFromMap(new IdentityHashMap<>());

        Writer(Layout layout) {
            this.layout = layout;
        }

        void writeBlock(String owner, StatementContainer target) {
            for (GraphStatement unit : layout.units) {
                if (owner.equals(ownerOf(unit))) {
                    write(unit, target);
                }
            }
        }

        void write(GraphStatement unit, StatementContainer target) {
            if (written.add(unit)) {
                target.add(unit);
            }
        }

        List<GraphStatement> unwritten() {
            List<GraphStatement> result = new ArrayList<>();
            for (GraphStatement unit : layout.units) {
                if (!written.contains(unit)) {
                    result.add(unit);
                }
            }
            return result;
        }
    }

    private record ListContainer(List<GraphStatement> statements) implements StatementContainer {

        @Override
        public List<GraphStatement> getStatements() {
            return statements;
        }
    }
}
