package com.purchasingpower.thesugraph.service;

import com.purchasingpower.thesugraph.model.filter.FilterSettings;
import com.purchasingpower.thesugraph.model.xml.LoadedDocument;

import java.util.Map;

/**
 * Prunes a loaded document in place before it is lowered to a graph.
 */
public interface DocumentFilterService {

    /**
     * Runs every document filter in precedence order.
     *
     * @return removed element counts per filter
     */
    Map<String, Integer> applyFilters(LoadedDocument document, FilterSettings settings);
}
