package com.purchasingpower.thesugraph.service.lowering;

import com.purchasingpower.thesugraph.model.filter.FilterSettings;
import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.xml.LoadedDocument;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one lowering run.
 */
@Getter
public class LoweringContext {

    private final LoadedDocument document;
    private final FilterSettings settings;
    private final GraphEmitter emitter;

    private final Set<String> processedElements = new LinkedHashSet<>();
    private final Set<String> processedPropositions = new LinkedHashSet<>();

    /** Proposition-to-thesis edges, appended to the graph root after every element is lowered. */
    private final List<GraphEdge> deferredEdges = new ArrayList<>();

    /** Proposition phases already emitted, by phase id. */
    private final Map<String, PhaseRecord> propositionPhases = new LinkedHashMap<>();

    public LoweringContext(LoadedDocument document, FilterSettings settings, GraphEmitter emitter) {
        this.document = document;
        this.settings = settings;
        this.emitter = emitter;
    }

    public void defer(GraphEdge edge) {
        if (edge.getOwner() == null) {
            edge.setOwner(emitter.currentOwner());
        }
        deferredEdges.add(edge);
    }

    /**
     * Whether phase colours should reflect matching-phase coverage.
     */
    public boolean isMatchingCoverageShown() {
        return !settings.isFilterPropositions() && !settings.isFilterMatchingPropositionSequences();
    }
}
