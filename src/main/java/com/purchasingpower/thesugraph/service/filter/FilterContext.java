package com.purchasingpower.thesugraph.service.filter;

import com.purchasingpower.thesugraph.model.filter.FilterSettings;
import com.purchasingpower.thesugraph.model.xml.LoadedDocument;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * State shared by the document filters of one run.
 */
@Getter
@RequiredArgsConstructor
public class FilterContext {

    private final LoadedDocument document;
    private final FilterSettings settings;

    /** Removed element count per filter, for the run summary. */
    private final Map<String, Integer> removals = new LinkedHashMap<>();

    public void countRemovals(String filter, int count) {
        removals.merge(filter, count, Integer::sum);
    }

    public int removalsOf(String filter) {
        return removals.getOrDefault(filter, 0);
    }
}
