package com.purchasingpower.thesugraph.model.xml;

import lombok.Builder;
import lombok.Value;

/**
 * Display text of an argumentative element, gathered from all of its segments.
 */
@Value
@Builder
public class ElementText {

    public static final ElementText EMPTY = ElementText.builder().text("").snippet("").locus("").build();

    /** Whole passage, abbreviated past 100 words. */
    String text;

    /** Short form shown inside the node label. */
    String snippet;

    String locus;
}
