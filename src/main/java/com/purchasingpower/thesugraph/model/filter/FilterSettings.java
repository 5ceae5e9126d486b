package com.purchasingpower.thesugraph.model.filter;

import com.purchasingpower.thesugraph.configuration.FilterProperties;
import com.purchasingpower.thesugraph.util.FilterRuleParser;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Normalized, immutable filter configuration for one render.
 */
@Value
@Builder
public class FilterSettings {

    @Singular("sourceToSelect")
    Set<String> sourcesToSelect;

    @Singular
    List<String> thesisFocusIds;

    @Singular("elementToExclude")
    Set<String> elementsToExclude;

    boolean filterPropositions;

    @Builder.Default
    boolean filterMatchingPropositionSequences = true;

    boolean filterAllSequences;

    boolean filterExtrinsicElements;

    /** propositionId -> thesis ids whose link to that proposition is removed. */
    @Singular
    Map<String, List<String>> customPropositions;

    /** sequenceId -> thesis ids whose link to that sequence is removed. */
    @Singular
    Map<String, List<String>> customSequences;

    public static FilterSettings from(FilterProperties properties) {
        return FilterSettings.builder()
                .sourcesToSelect(strip(properties.getSourcesToSelect()))
                .thesisFocusIds(strip(properties.getThesisFocusIds()))
                .elementsToExclude(strip(properties.getElementsToExclude()))
                .filterPropositions(properties.isFilterPropositions())
                .filterMatchingPropositionSequences(properties.isFilterMatchingPropositionSequences())
                .filterAllSequences(properties.isFilterAllSequences())
                .filterExtrinsicElements(properties.isFilterExtrinsicElements())
                .customPropositions(FilterRuleParser.parse(properties.getCustomPropositions()))
                .customSequences(FilterRuleParser.parse(properties.getCustomSequences()))
                .build();
    }

    public static FilterSettings defaults() {
        return FilterSettings.builder().build();
    }

    /**
     * The single global toggle that applies, propositions taking precedence over
     * matching sequences, which take precedence over all sequences.
     */
    public GlobalToggle activeToggle() {
        if (filterPropositions) {
            return GlobalToggle.PROPOSITIONS;
        }
        if (filterMatchingPropositionSequences) {
            return GlobalToggle.MATCHING_SEQUENCES;
        }
        if (filterAllSequences) {
            return GlobalToggle.ALL_SEQUENCES;
        }
        return GlobalToggle.NONE;
    }

    private static List<String> strip(List<String> ids) {
        return new LinkedHashSet<>(ids.stream()
                .filter(id -> id != null && !id.isBlank())
                .map(id -> FilterRuleParser.stripHash(id.trim()))
                .toList()).stream().toList();
    }

    public enum GlobalToggle {
        NONE,
        PROPOSITIONS,
        MATCHING_SEQUENCES,
        ALL_SEQUENCES
    }
}
