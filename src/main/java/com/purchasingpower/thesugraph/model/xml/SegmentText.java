package com.purchasingpower.thesugraph.model.xml;

import lombok.Value;

/**
 * Text and locus of one {@code thesu:segment}.
 */
@Value
public class SegmentText {

    public static final SegmentText EMPTY = new SegmentText("", "");

    String text;
    String locus;
}
