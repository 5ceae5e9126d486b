package com.purchasingpower.thesugraph.service.filter;

import com.purchasingpower.thesugraph.util.FilterRuleParser;
import com.purchasingpower.thesugraph.util.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Removes matching sequence records keyed by sequence id, scoped to the nearest
 * enclosing thesis, together with their positionally aligned phase records.
 */
@Slf4j
@Component
@Order(3)
public class CustomSequenceFilter implements DocumentFilter {

    @Override
    public void apply(FilterContext context) {
        Map<String, List<String>> rules = context.getSettings().getCustomSequences();
        if (rules.isEmpty()) {
            return;
        }
        MatchingSequencePruner pruner = new MatchingSequencePruner();
        int queued = 0;
        for (Element record : XmlNodes.descendants(context.getDocument().root(), "matchingPropositionSequence")) {
            String sequenceRef = XmlNodes.thesuAttr(record, "sequenceRef");
            if (sequenceRef == null) {
                continue;
            }
            String sequenceId = FilterRuleParser.stripHash(sequenceRef);
            List<String> theses = rules.get(sequenceId);
            if (theses == null) {
                continue;
            }
            Optional<Element> thesis = XmlNodes.nearestAncestor(record, "THESIS");
            if (thesis.isEmpty()) {
                log.debug("Skipping sequence {} without an enclosing THESIS", sequenceId);
                continue;
            }
            if (theses.contains(XmlNodes.xmlId(thesis.get())) && pruner.queue(record)) {
                log.info("Removing sequence link {} from thesis {}", sequenceId, XmlNodes.xmlId(thesis.get()));
                queued++;
            }
        }
        int removedPhases = pruner.flush();
        context.countRemovals("customSequenceLinks", queued);
        context.countRemovals("customSequencePhases", removedPhases);
    }

    @Override
    public boolean isFailSoft() {
        return true;
    }
}
