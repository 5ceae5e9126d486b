package com.purchasingpower.thesugraph.model.graph;

/**
 * Semantic category of an emitted graph node.
 *
 * <p>Source containers are not nodes; they are modelled as {@link SubgraphKind#SOURCE} subgraphs.
 */
public enum NodeKind {
    THESIS,
    SUPPORT,
    MISC,
    PROPOSITION,
    PHASE,
    MEDIATOR,
    /** Stands in for an omitted or unspecified relation member declared in the document. */
    OMITTED,
    /** Synthesized during rewriting for an excluded element that edges still point at. */
    FILTERED_PLACEHOLDER
}
