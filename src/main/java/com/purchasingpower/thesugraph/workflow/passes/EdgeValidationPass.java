package com.purchasingpower.thesugraph.workflow.passes;

import com.purchasingpower.thesugraph.model.graph.GraphDocument;
import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.model.graph.GraphStatement;
import com.purchasingpower.thesugraph.model.graph.NodeKind;
import com.purchasingpower.thesugraph.model.style.Palette;
import com.purchasingpower.thesugraph.util.XmlNodes;
import com.purchasingpower.thesugraph.workflow.pipeline.RewriteContext;
import com.purchasingpower.thesugraph.workflow.pipeline.RewritePass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Makes every edge endpoint a defined node. A missing endpoint is replaced by a
 * {@code <id>_filtered} placeholder when it was excluded on purpose, otherwise redirected to the
 * nearest enclosing THESIS that is defined; edges that cannot be repaired, and self-loops
 * created by a redirect, are dropped. Edge attributes are never touched.
 */
@Slf4j
@Component
@Order(4)
public class EdgeValidationPass implements RewritePass {

    public static final String PLACEHOLDER_SUFFIX = "_filtered";

    @Override
    public void apply(RewriteContext context) {
        GraphDocument graph = context.getGraph();
        Set<String> defined = graph.nodeIds();
        Map<String, GraphNode> placeholders = new LinkedHashMap<>();
        Set<GraphStatement> doomed = Collections.newSetFromMap(new IdentityHashMap<>());
        int redirected = 0;

        for (GraphEdge edge : graph.edges()) {
            boolean sourceMissing = !defined.contains(edge.getSource());
            boolean targetMissing = !defined.contains(edge.getTarget());
            if (!sourceMissing && !targetMissing) {
                continue;
            }
            Optional<String> source = sourceMissing
                    ? repair(edge.getSource(), context, defined, placeholders)
                    : Optional.of(edge.getSource());
            Optional<String> target = source.isPresent() && targetMissing
                    ? repair(edge.getTarget(), context, defined, placeholders)
                    : Optional.of(edge.getTarget());
            if (source.isEmpty() || target.isEmpty() || source.get().equals(target.get())) {
                log.debug("Dropping edge {}", edge);
                doomed.add(edge);
                continue;
            }
            edge.setSource(source.get());
            edge.setTarget(target.get());
            redirected++;
        }

        int removed = graph.removeIf(doomed::contains);
        placeholders.values().forEach(graph::add);

        context.count("edges.redirected", redirected);
        context.count("edges.dropped", removed);
        context.count("nodes.placeholders", placeholders.size());
        if (removed > 0 || !placeholders.isEmpty()) {
            log.info("Edge validation: {} repaired, {} dropped, {} placeholder(s) added",
                    redirected, removed, placeholders.size());
        }
    }

    private Optional<String> repair(String missing, RewriteContext context, Set<String> defined,
                                    Map<String, GraphNode> placeholders) {
        if (context.getExcludedIds().contains(missing)) {
            if (!defined.contains(missing + PLACEHOLDER_SUFFIX)) {
                placeholders.computeIfAbsent(missing,
                        id -> placeholder(id, PlaceholderTypeInference.resolve(id, context.getOriginalDocument())));
            }
            return Optional.of(missing + PLACEHOLDER_SUFFIX);
        }
        return thesisAncestor(missing, context.getOriginalDocument(), defined);
    }

    /**
     * The element itself when it is a defined THESIS, else its nearest defined THESIS ancestor.
     */
    static Optional<String> thesisAncestor(String missing, Document originalDocument, Set<String> defined) {
        if (originalDocument == null || originalDocument.getDocumentElement() == null) {
            return Optional.empty();
        }
        Element found = PlaceholderTypeInference.lookup(originalDocument.getDocumentElement(), missing);
        if (found == null) {
            return Optional.empty();
        }
        for (Element current = found; current != null; current = XmlNodes.nearestAncestor(current, "THESIS").orElse(null)) {
            if (XmlNodes.is(current, "THESIS")) {
                String id = XmlNodes.xmlId(current);
                if (id != null && defined.contains(id)) {
                    return Optional.of(id);
                }
            }
        }
        return Optional.empty();
    }

    static GraphNode placeholder(String excludedId, NodeKind kind) {
        boolean support = kind == NodeKind.SUPPORT;
        Palette palette = support ? Palette.SUPPORT_DEFAULT : Palette.THESIS;
        int dot = excludedId.lastIndexOf('.');
        return GraphNode.of(excludedId + PLACEHOLDER_SUFFIX, NodeKind.FILTERED_PLACEHOLDER)
                .put("label", "<<b>" + (support ? "SUPPORT" : "THESIS") + "</b><br/><i>(filtered)</i>>")
                .put("gephi_label", support ? "SUPP" : "THES")
                .put("gephi_filtered", "true")
                .put("fontsize", "11")
                .put("fillcolor", palette.fill())
                .put("color", palette.border())
                .put("style", "rounded,filled")
                .put("shape", support ? "ellipse" : "box")
                .put("source", dot > 0 ? excludedId.substring(0, dot) : null);
    }
}
