package com.purchasingpower.thesugraph.service.filter;

import com.purchasingpower.thesugraph.model.filter.FilterSettings.GlobalToggle;
import com.purchasingpower.thesugraph.model.xml.LoadedDocument;
import com.purchasingpower.thesugraph.util.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies the highest-precedence global toggle: propositions, then matching sequences,
 * then all sequences. Only one of them fires.
 */
@Slf4j
@Component
@Order(4)
public class GlobalToggleFilter implements DocumentFilter {

    @Override
    public void apply(FilterContext context) {
        GlobalToggle toggle = context.getSettings().activeToggle();
        LoadedDocument document = context.getDocument();
        Element root = document.root();
        List<Element> targets = new ArrayList<>();

        switch (toggle) {
            case PROPOSITIONS -> {
                document.getPropositions().clear();
                targets.addAll(XmlNodes.descendants(root, "matchingProposition"));
            }
            case MATCHING_SEQUENCES -> {
                targets.addAll(XmlNodes.descendants(root, "matchingPropositionSequence"));
                targets.addAll(XmlNodes.descendants(root, "matchingPropositionPhases"));
                for (Element proposition : document.getPropositions().values()) {
                    targets.addAll(XmlNodes.descendants(proposition, "sequence"));
                }
            }
            case ALL_SEQUENCES -> {
                targets.addAll(XmlNodes.descendants(root, "sequence"));
                for (Element proposition : document.getPropositions().values()) {
                    targets.addAll(XmlNodes.descendants(proposition, "sequence"));
                }
            }
            case NONE -> {
                return;
            }
        }

        int removed = 0;
        for (Element target : targets) {
            if (XmlNodes.detach(target)) {
                removed++;
            }
        }
        log.info("Global toggle {} removed {} element(s)", toggle, removed);
        context.countRemovals("toggle", removed);
    }
}
