package com.purchasingpower.thesugraph.service.filter;

import com.purchasingpower.thesugraph.util.XmlNodes;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes every element flagged {@code thesu:extrinsic="true"}.
 */
@Component
@Order(5)
public class ExtrinsicElementFilter implements DocumentFilter {

    @Override
    public void apply(FilterContext context) {
        if (!context.getSettings().isFilterExtrinsicElements()) {
            return;
        }
        NodeList all = context.getDocument().root().getElementsByTagName("*");
        List<Element> flagged = new ArrayList<>();
        for (int i = 0; i < all.getLength(); i++) {
            Element element = (Element) all.item(i);
            if ("true".equals(XmlNodes.thesuAttr(element, "extrinsic"))) {
                flagged.add(element);
            }
        }
        int removed = 0;
        for (Element element : flagged) {
            if (XmlNodes.detach(element)) {
                removed++;
            }
        }
        context.countRemovals("extrinsic", removed);
    }
}
