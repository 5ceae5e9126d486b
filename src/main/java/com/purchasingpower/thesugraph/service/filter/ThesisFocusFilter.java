package com.purchasingpower.thesugraph.service.filter;

import com.purchasingpower.thesugraph.util.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keeps only the argumentative path touching the focus theses: among the siblings of each
 * focus THESIS, anything that neither is nor contains a focus THESIS is removed.
 */
@Slf4j
@Component
@Order(6)
public class ThesisFocusFilter implements DocumentFilter {

    @Override
    public void apply(FilterContext context) {
        List<String> focusIds = context.getSettings().getThesisFocusIds();
        if (focusIds.isEmpty()) {
            return;
        }
        Set<String> focus = new LinkedHashSet<>(focusIds);
        Element root = context.getDocument().root();
        Set<Element> toRemove = new LinkedHashSet<>();

        for (String focusId : focusIds) {
            List<Element> matches = XmlNodes.descendants(root, "THESIS").stream()
                    .filter(thesis -> focusId.equals(XmlNodes.xmlId(thesis)))
                    .collect(Collectors.toList());
            if (matches.isEmpty()) {
                log.warn("⚠️ Focus THESIS '{}' not found, skipping", focusId);
                continue;
            }
            if (matches.size() > 1) {
                log.warn("⚠️ Several THESIS elements carry id '{}', using the first", focusId);
            }
            Element target = matches.get(0);
            if (XmlNodes.nearestAncestor(target, "source").isEmpty()) {
                log.warn("⚠️ Focus THESIS '{}' is not inside a source, skipping", focusId);
                continue;
            }
            Element parent = (Element) target.getParentNode();
            for (Element sibling : XmlNodes.childElements(parent)) {
                if (sibling != target && !isProtected(sibling, focus)) {
                    toRemove.add(sibling);
                }
            }
        }

        int removed = 0;
        for (Element element : toRemove) {
            if (XmlNodes.detach(element)) {
                removed++;
            }
        }
        log.info("Thesis focus removed {} element(s)", removed);
        context.countRemovals("focus", removed);
    }

    private static boolean isProtected(Element sibling, Set<String> focus) {
        if (XmlNodes.is(sibling, "THESIS") && focus.contains(XmlNodes.xmlId(sibling))) {
            return true;
        }
        return XmlNodes.descendants(sibling, "THESIS").stream()
                .anyMatch(thesis -> focus.contains(XmlNodes.xmlId(thesis)));
    }
}
