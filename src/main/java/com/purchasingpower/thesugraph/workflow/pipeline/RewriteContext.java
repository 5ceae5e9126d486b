package com.purchasingpower.thesugraph.workflow.pipeline;

import com.google.common.base.Preconditions;
import com.purchasingpower.thesugraph.model.graph.GraphDocument;
import lombok.Getter;
import org.w3c.dom.Document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The box that travels through the rewrite passes.
 */
@Getter
public class RewriteContext {

    private final GraphDocument graph;

    /** Unfiltered document, used to type placeholders. May be {@code null}. */
    private final Document originalDocument;

    private final Set<String> excludedIds;

    /** Per-pass counters, e.g. {@code "edges.redirected" -> 3}. */
    private final Map<String, Integer> statistics = new LinkedHashMap<>();

    public RewriteContext(GraphDocument graph, Document originalDocument, Set<String> excludedIds) {
        Preconditions.checkNotNull(graph, "Graph cannot be null");
        this.graph = graph;
        this.originalDocument = originalDocument;
        this.excludedIds = excludedIds == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(excludedIds));
    }

    public boolean hasExclusions() {
        return !excludedIds.isEmpty();
    }

    public void count(String key, int amount) {
        statistics.merge(key, amount, Integer::sum);
    }

    public int countOf(String key) {
        return statistics.getOrDefault(key, 0);
    }
}
