package com.purchasingpower.thesugraph.service.filter;

import com.purchasingpower.thesugraph.util.FilterRuleParser;
import com.purchasingpower.thesugraph.util.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Removes the link between one proposition and one thesis, then the matching sequence
 * and phase records that pointed from that thesis into the proposition's sequences.
 */
@Slf4j
@Component
@Order(2)
public class CustomPropositionFilter implements DocumentFilter {

    @Override
    public void apply(FilterContext context) {
        Map<String, List<String>> rules = context.getSettings().getCustomPropositions();
        if (rules.isEmpty()) {
            return;
        }
        Element root = context.getDocument().root();

        // propositionId -> theses that lost their link to it
        Map<String, Set<Element>> affected = new LinkedHashMap<>();
        List<Element> links = new ArrayList<>();
        for (Element link : XmlNodes.descendants(root, "matchingProposition")) {
            String propRef = XmlNodes.thesuAttr(link, "propRef");
            if (propRef == null) {
                continue;
            }
            String propositionId = FilterRuleParser.stripHash(propRef);
            List<String> theses = rules.get(propositionId);
            if (theses == null) {
                continue;
            }
            XmlNodes.nearestAncestor(link, "THESIS").ifPresent(thesis -> {
                if (theses.contains(XmlNodes.xmlId(thesis))) {
                    links.add(link);
                    affected.computeIfAbsent(propositionId, k -> new LinkedHashSet<>()).add(thesis);
                }
            });
        }
        int removedLinks = 0;
        for (Element link : links) {
            if (XmlNodes.detach(link)) {
                removedLinks++;
            }
        }

        MatchingSequencePruner pruner = new MatchingSequencePruner();
        int removedPhases = 0;
        for (Map.Entry<String, Set<Element>> entry : affected.entrySet()) {
            Element proposition = context.getDocument().getPropositions().get(entry.getKey());
            if (proposition == null) {
                continue;
            }
            Set<String> sequenceIds = new LinkedHashSet<>();
            for (Element sequence : XmlNodes.descendants(proposition, "sequence")) {
                String id = XmlNodes.xmlId(sequence);
                if (id != null) {
                    sequenceIds.add(id);
                }
            }
            if (sequenceIds.isEmpty()) {
                continue;
            }
            for (Element thesis : entry.getValue()) {
                for (Element record : XmlNodes.descendants(thesis, "matchingPropositionSequence")) {
                    String sequenceRef = XmlNodes.thesuAttr(record, "sequenceRef");
                    if (sequenceRef != null && sequenceIds.contains(FilterRuleParser.stripHash(sequenceRef))) {
                        pruner.queue(record);
                    }
                }
                removedPhases += pruner.flush();
                log.info("Removed link from thesis {} to proposition {}", XmlNodes.xmlId(thesis), entry.getKey());
            }
        }
        context.countRemovals("customPropositionLinks", removedLinks);
        context.countRemovals("customPropositionPhases", removedPhases);
    }

    @Override
    public boolean isFailSoft() {
        return true;
    }
}
