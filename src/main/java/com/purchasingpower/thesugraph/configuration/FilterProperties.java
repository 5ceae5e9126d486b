package com.purchasingpower.thesugraph.configuration;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw filter settings as written in {@code application.yml}.
 * See {@link com.purchasingpower.thesugraph.model.filter.FilterSettings} for the normalized form.
 */
@Data
public class FilterProperties {

    /** {@code xml:id}s of the sources to keep; empty keeps every source. */
    private List<String> sourcesToSelect = new ArrayList<>();

    private List<String> thesisFocusIds = new ArrayList<>();

    private List<String> elementsToExclude = new ArrayList<>();

    private boolean filterPropositions = false;

    private boolean filterMatchingPropositionSequences = true;

    private boolean filterAllSequences = false;

    private boolean filterExtrinsicElements = false;

    /** Rules of the form {@code "<thesisId> to <propositionId>"}. */
    private List<String> customPropositions = new ArrayList<>();

    /** Rules of the form {@code "<thesisId> to <sequenceId>"}. */
    private List<String> customSequences = new ArrayList<>();
}
