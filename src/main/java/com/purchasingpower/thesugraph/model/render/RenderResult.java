package com.purchasingpower.thesugraph.model.render;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary of one render.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RenderResult {

    private String outputFile;

    private int nodeCount;

    private int edgeCount;

    private int placeholderCount;

    /** Whether the layout engine was reachable and arrow directions were checked. */
    private boolean directionCorrected;

    private int reversedEdges;

    /** Removed element counts per document filter. */
    @Builder.Default
    private Map<String, Integer> filterRemovals = new LinkedHashMap<>();

    /** Counters reported by the rewrite passes. */
    @Builder.Default
    private Map<String, Integer> rewriteStatistics = new LinkedHashMap<>();

    private long durationMs;
}
