package com.purchasingpower.thesugraph.workflow.passes;

import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.workflow.pipeline.RewriteContext;
import com.purchasingpower.thesugraph.workflow.pipeline.RewritePass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Phase nodes are emitted under their sequence-derived id ({@code X.q123456001}) but other
 * elements point at them by document id ({@code Y.H123456}). Rewrites those edge endpoints to
 * the emitted id, then drops the {@code original_xml_id} attribute.
 */
@Slf4j
@Component
@Order(1)
public class IdReconciliationPass implements RewritePass {

    static final String ORIGINAL_ID_ATTRIBUTE = "original_xml_id";

    private static final Pattern EMITTED_ID = Pattern.compile("^(?:.*\\.)?(q\\d{9})$");
    private static final Pattern DOCUMENT_ID = Pattern.compile("^(?:.*\\.)?(H\\d{6})$");

    @Override
    public void apply(RewriteContext context) {
        Map<String, String> mapping = mapping(context);
        int rewritten = 0;
        if (!mapping.isEmpty()) {
            for (GraphEdge edge : context.getGraph().edges()) {
                String source = resolve(edge.getSource(), mapping);
                String target = resolve(edge.getTarget(), mapping);
                if (!source.equals(edge.getSource()) || !target.equals(edge.getTarget())) {
                    edge.setSource(source);
                    edge.setTarget(target);
                    rewritten++;
                }
            }
        }
        for (GraphNode node : context.getGraph().nodes()) {
            node.remove(ORIGINAL_ID_ATTRIBUTE);
        }
        context.count("ids.mapped", mapping.size());
        context.count("edges.reconciled", rewritten);
        log.debug("Reconciled {} edge(s) using {} id mapping(s)", rewritten, mapping.size());
    }

    /**
     * Document id to emitted id, both in full and as bare local parts.
     */
    static Map<String, String> mapping(RewriteContext context) {
        Map<String, String> mapping = new LinkedHashMap<>();
        for (GraphNode node : context.getGraph().nodes()) {
            String original = node.get(ORIGINAL_ID_ATTRIBUTE);
            if (original == null) {
                continue;
            }
            Matcher emitted = EMITTED_ID.matcher(node.getId());
            Matcher document = DOCUMENT_ID.matcher(original);
            if (emitted.matches() && document.matches()) {
                mapping.putIfAbsent(original, node.getId());
                mapping.putIfAbsent(document.group(1), emitted.group(1));
            }
        }
        return mapping;
    }

    static String resolve(String endpoint, Map<String, String> mapping) {
        String full = mapping.get(endpoint);
        if (full != null) {
            return full;
        }
        int dot = endpoint.lastIndexOf('.');
        if (dot > 0) {
            String local = mapping.get(endpoint.substring(dot + 1));
            if (local != null) {
                return endpoint.substring(0, dot + 1) + local;
            }
        }
        return endpoint;
    }
}
