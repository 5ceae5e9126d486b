package com.purchasingpower.thesugraph.service;

import com.purchasingpower.thesugraph.model.filter.FilterSettings;
import com.purchasingpower.thesugraph.model.graph.GraphDocument;
import com.purchasingpower.thesugraph.model.xml.LoadedDocument;

/**
 * Walks a filtered document and emits the graph it describes.
 */
public interface GraphLoweringService {

    /**
     * Lowers every source, then the elements outside any source, then the propositions those
     * elements reference. Proposition-to-thesis edges come last.
     */
    GraphDocument lower(LoadedDocument document, FilterSettings settings);
}
