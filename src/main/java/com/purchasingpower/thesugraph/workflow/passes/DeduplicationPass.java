package com.purchasingpower.thesugraph.workflow.passes;

import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.util.DotWriter;
import com.purchasingpower.thesugraph.workflow.pipeline.RewriteContext;
import com.purchasingpower.thesugraph.workflow.pipeline.RewritePass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Drops repeated node and edge statements; the first occurrence in document order wins.
 * Two statements are repeats when they render to the same DOT text.
 */
@Slf4j
@Component
@Order(6)
public class DeduplicationPass implements RewritePass {

    @Override
    public void apply(RewriteContext context) {
        Set<String> seen = new HashSet<>();
        int removed = context.getGraph().removeIf(statement ->
                (statement instanceof GraphNode || statement instanceof GraphEdge)
                        && !seen.add(DotWriter.render(statement)));
        context.count("statements.deduplicated", removed);
        if (removed > 0) {
            log.info("Removed {} duplicate statement(s)", removed);
        }
    }
}
