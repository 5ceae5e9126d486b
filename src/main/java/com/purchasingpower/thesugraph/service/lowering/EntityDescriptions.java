package com.purchasingpower.thesugraph.service.lowering;

import com.purchasingpower.thesugraph.util.DotText;
import com.purchasingpower.thesugraph.util.XmlNodes;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Display fields shared by THESIS, SUPPORT and MISC nodes.
 */
final class EntityDescriptions {

    static final int PARAPHRASIS_WIDTH = 50;
    static final int PHASE_PARAPHRASIS_WIDTH = 30;
    static final int SPEAKER_WIDTH = 30;

    private EntityDescriptions() {
    }

    /**
     * Names of the lowest-ranked speakers, comma separated. A missing or non-numeric rank counts as 1.
     */
    static String speakers(Element element) {
        Map<String, Integer> ranked = new LinkedHashMap<>();
        for (Element group : XmlNodes.ownDescendants(element, "speakersGroup")) {
            for (Element speaker : XmlNodes.children(group, "speaker")) {
                String name = XmlNodes.thesuAttr(speaker, "name");
                if (name == null || name.isEmpty()) {
                    continue;
                }
                String rank = XmlNodes.thesuAttr(speaker, "rank");
                int value = rank != null && rank.chars().allMatch(Character::isDigit) && !rank.isEmpty()
                        ? Integer.parseInt(rank) : 1;
                ranked.putIfAbsent(DotText.afterHash(name), value);
            }
        }
        if (ranked.isEmpty()) {
            return "";
        }
        int min = ranked.values().stream().mapToInt(Integer::intValue).min().orElse(1);
        List<String> top = new ArrayList<>();
        ranked.forEach((name, rank) -> {
            if (rank == min) {
                top.add(name);
            }
        });
        return String.join(", ", top);
    }

    /**
     * Raw paraphrasis text of the direct {@code thesu:paraphrasis} child, whitespace collapsed.
     */
    static String paraphrasisText(Element element) {
        Optional<Element> paraphrasis = XmlNodes.firstChild(element, "paraphrasis");
        return paraphrasis.map(p -> DotText.collapseWhitespace(p.getTextContent())).orElse("");
    }

    /**
     * Phase paraphrasis, falling back to {@code microThemedFreeText/freeText}.
     */
    static String phaseText(Element phase) {
        Optional<Element> paraphrasis = XmlNodes.firstChild(phase, "paraphrasis");
        if (paraphrasis.isPresent()) {
            return DotText.collapseWhitespace(paraphrasis.get().getTextContent());
        }
        return XmlNodes.path(phase, "microThemedFreeText", "freeText").stream()
                .findFirst()
                .map(free -> DotText.collapseWhitespace(free.getTextContent()))
                .orElse("");
    }

    /**
     * Label fragment for the speaker line.
     */
    static String speakerLine(String speakers) {
        return DotText.escapeHtml(DotText.pad(speakers, SPEAKER_WIDTH));
    }
}
