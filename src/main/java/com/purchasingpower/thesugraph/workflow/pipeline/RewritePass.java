package com.purchasingpower.thesugraph.workflow.pipeline;

/**
 * One ordered rewrite over the lowered graph.
 * Implementations are detected by Spring and sorted by @Order.
 */
public interface RewritePass {

    /**
     * Rewrites the graph held by the context in place.
     *
     * <p>Malformed statements (an endpoint already removed, a repeated id) are skipped; a pass
     * only throws on a programming error, which aborts the run.
     *
     * @param context the graph being rewritten and what the passes know about the run
     */
    void apply(RewriteContext context);
}
