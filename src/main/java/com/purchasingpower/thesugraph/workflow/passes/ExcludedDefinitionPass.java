package com.purchasingpower.thesugraph.workflow.passes;

import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.workflow.pipeline.RewriteContext;
import com.purchasingpower.thesugraph.workflow.pipeline.RewritePass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Removes the definitions of excluded elements. Edges pointing at them are kept so that
 * {@link EdgeValidationPass} can substitute placeholders.
 */
@Slf4j
@Component
@Order(3)
public class ExcludedDefinitionPass implements RewritePass {

    @Override
    public void apply(RewriteContext context) {
        if (!context.hasExclusions()) {
            return;
        }
        int removed = context.getGraph().removeIf(statement -> statement instanceof GraphNode node
                && context.getExcludedIds().contains(node.getId()));
        context.count("nodes.excluded", removed);
        log.info("Removed {} excluded node definition(s)", removed);
    }
}
