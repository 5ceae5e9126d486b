package com.purchasingpower.thesugraph.service.filter;

import com.purchasingpower.thesugraph.util.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.Set;

/**
 * Drops every {@code thesu:source} whose {@code xml:id} is not on the allow-list.
 */
@Slf4j
@Component
@Order(1)
public class SourceSelectionFilter implements DocumentFilter {

    @Override
    public void apply(FilterContext context) {
        Set<String> selected = context.getSettings().getSourcesToSelect();
        if (selected.isEmpty()) {
            return;
        }
        int removed = 0;
        for (Element source : XmlNodes.descendants(context.getDocument().root(), "source")) {
            String id = XmlNodes.xmlId(source);
            if (!selected.contains(id) && XmlNodes.detach(source)) {
                log.info("Removed source: {}", id);
                removed++;
            }
        }
        context.countRemovals("sources", removed);
    }
}
