package com.purchasingpower.thesugraph.workflow.pipeline;

import com.google.common.base.Preconditions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RewritePipelineEngine {

    /**
     * Spring injects every RewritePass bean, sorted by its @Order annotation.
     */
    private final List<RewritePass> passes;

    /**
     * Runs every pass in order. A pass that throws aborts the run; there is no partial graph.
     */
    public RewriteContext run(RewriteContext context) {
        Preconditions.checkNotNull(context, "Rewrite context cannot be null");
        log.info("Starting rewrite pipeline: {} node(s), {} edge(s), {} excluded id(s)",
                context.getGraph().nodes().size(), context.getGraph().edges().size(), context.getExcludedIds().size());

        for (RewritePass pass : passes) {
            log.info(">> Executing Pass: {}", pass.getClass().getSimpleName());
            pass.apply(context);
        }

        log.info("✅ Rewrite pipeline completed: {}", context.getStatistics());
        return context;
    }

    public List<RewritePass> getPasses() {
        return passes;
    }
}
