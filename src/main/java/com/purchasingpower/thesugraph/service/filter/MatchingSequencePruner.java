package com.purchasingpower.thesugraph.service.filter;

import com.purchasingpower.thesugraph.util.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Removes {@code matchingPropositionSequence} records and the {@code matchingPropositionPhases}
 * records aligned with them.
 *
 * <p>Alignment is positional: with a single sequence record and a single phase record the
 * phase record goes; otherwise the phase record at the same index as the removed sequence
 * record goes. Indexes are taken before anything is removed. Each parent sequence is
 * processed at most once per pruner.
 */
@Slf4j
class MatchingSequencePruner {

    private final Map<Element, List<Entry>> queued = new LinkedHashMap<>();
    private final Set<Element> processed = new LinkedHashSet<>();

    /**
     * Queues a record for removal.
     *
     * @return false when the record does not sit directly in a {@code thesu:sequence}
     */
    boolean queue(Element matchingSequence) {
        if (!(matchingSequence.getParentNode() instanceof Element parent) || !XmlNodes.is(parent, "sequence")) {
            log.debug("Skipping matchingPropositionSequence outside a sequence");
            return false;
        }
        if (processed.contains(parent)) {
            return true;
        }
        List<Element> siblings = XmlNodes.children(parent, "matchingPropositionSequence");
        int index = siblings.indexOf(matchingSequence);
        if (index < 0) {
            return false;
        }
        List<Entry> entries = queued.computeIfAbsent(parent, k -> new ArrayList<>());
        if (entries.stream().noneMatch(e -> e.element == matchingSequence)) {
            entries.add(new Entry(matchingSequence, index, siblings.size()));
        }
        return true;
    }

    /**
     * Performs the queued removals.
     *
     * @return number of phase records removed
     */
    int flush() {
        int phasesRemoved = 0;
        for (Map.Entry<Element, List<Entry>> item : queued.entrySet()) {
            Element parent = item.getKey();
            if (!processed.add(parent)) {
                continue;
            }
            List<Entry> entries = item.getValue();
            entries.sort((a, b) -> Integer.compare(b.index, a.index));

            Map<Element, List<Element>> phaseRemovals = new LinkedHashMap<>();
            for (Element phase : phasesWithMatchingRecords(parent)) {
                List<Element> records = XmlNodes.children(phase, "matchingPropositionPhases");
                for (Entry entry : entries) {
                    Element toRemove = null;
                    if (entry.siblingCount == 1 && records.size() == 1) {
                        toRemove = records.get(0);
                    } else if (!records.isEmpty() && entry.index < records.size()) {
                        toRemove = records.get(entry.index);
                    }
                    if (toRemove != null) {
                        List<Element> list = phaseRemovals.computeIfAbsent(phase, k -> new ArrayList<>());
                        if (!list.contains(toRemove)) {
                            list.add(toRemove);
                        }
                    }
                }
            }

            for (Entry entry : entries) {
                XmlNodes.detach(entry.element);
            }
            for (List<Element> records : phaseRemovals.values()) {
                for (Element record : records) {
                    if (XmlNodes.detach(record)) {
                        phasesRemoved++;
                    }
                }
            }
        }
        queued.clear();
        return phasesRemoved;
    }

    private static List<Element> phasesWithMatchingRecords(Element sequence) {
        List<Element> result = new ArrayList<>();
        for (Element newPhases : XmlNodes.descendants(sequence, "newPhases")) {
            for (Element phase : XmlNodes.children(newPhases, "phase")) {
                if (!XmlNodes.children(phase, "matchingPropositionPhases").isEmpty()) {
                    result.add(phase);
                }
            }
        }
        return result;
    }

    private record Entry(Element element, int index, int siblingCount) {
    }
}
