package com.purchasingpower.thesugraph.service.lowering;

import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.model.graph.NodeKind;
import com.purchasingpower.thesugraph.model.graph.Subgraph;
import com.purchasingpower.thesugraph.model.graph.SubgraphKind;
import com.purchasingpower.thesugraph.model.ids.IdSeed;
import com.purchasingpower.thesugraph.model.ids.MediatorId;
import com.purchasingpower.thesugraph.model.ids.RelationRole;
import com.purchasingpower.thesugraph.model.style.MatchingQualifier;
import com.purchasingpower.thesugraph.model.style.Palette;
import com.purchasingpower.thesugraph.service.ids.MediatorIdGenerator;
import com.purchasingpower.thesugraph.util.DotText;
import com.purchasingpower.thesugraph.util.PhasesRefParser;
import com.purchasingpower.thesugraph.util.XmlNodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lowers the sequence of a THESIS into a cluster of chained phase nodes and links its phases to
 * the phases of the proposition sequences they match.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SequenceLowering {

    static final int SEQUENCE_NUMBER = 100_000;

    private final MediatorIdGenerator idGenerator;

    /**
     * Lowers the first sequence of {@code thesisType/sequencesGroup} that has no {@code maySubstitute}.
     */
    public void lowerThesisSequence(Element thesis, String thesisId, ThesisStyle style, LoweringContext context) {
        Optional<Element> candidate = firstPlainSequence(thesis);
        if (candidate.isEmpty()) {
            return;
        }
        Element sequence = candidate.get();
        String sequenceId = sequenceId(sequence, thesisId);
        List<PhaseRecord> phases = phases(sequence, sequenceId);
        if (phases.isEmpty()) {
            return;
        }

        String clusterId = (thesisId + "_" + sequenceId).replace('.', '_');
        GraphEmitter emitter = context.getEmitter();
        emitter.openSubgraph(new Subgraph("cluster_" + clusterId, SubgraphKind.SEQUENCE)
                .put("label", "<<font color='" + style.palette().border() + "'>Sequence</font>>")
                .put("peripheries", "1"));

        Palette lastPalette = style.palette();
        for (PhaseRecord phase : phases) {
            lastPalette = phasePalette(sequence, phase.getElement(), style.palette(), context);
            emitter.node(GraphNode.of(phase.getPhaseId(), NodeKind.PHASE)
                    .put("label", "<<b>" + phase.getPhaseNumber() + "</b><br/><i>" + phase.getParaphrasis() + "</i>>")
                    .put("gephi_label", "ph.")
                    .put("phase_number", String.valueOf(phase.getPhaseNumber()))
                    .put("paraphrasis", EntityDescriptions.phaseText(phase.getElement()))
                    .put("shape", "box")
                    .put("fillcolor", lastPalette.fill())
                    .put("color", lastPalette.border())
                    .put("style", style.style())
                    .put("original_xml_id", phase.getOriginalXmlId()));
        }
        String chainStyle = style.manifestation().isUnstated() ? "dashed" : "solid";
        for (int i = 0; i + 1 < phases.size(); i++) {
            emitter.edge(GraphEdge.of(phases.get(i).getPhaseId(), phases.get(i + 1).getPhaseId())
                    .put("dir", "none")
                    .put("color", lastPalette.border())
                    .put("style", chainStyle));
        }
        emitter.closeSubgraph();

        String firstPhaseId = phases.get(0).getPhaseId();
        emitter.edge(GraphEdge.of(thesisId, firstPhaseId)
                .put("dir", "none")
                .put("lhead", "cluster_" + clusterId)
                .put("color", lastPalette.border()));

        linkMatchingSequences(sequence, phases, clusterId, context);
    }

    private void linkMatchingSequences(Element sequence, List<PhaseRecord> phases, String clusterId, LoweringContext context) {
        Set<String> matchedSequenceIds = new LinkedHashSet<>();
        for (Element record : XmlNodes.descendants(sequence, "matchingPropositionSequence")) {
            String ref = XmlNodes.thesuAttr(record, "sequenceRef");
            if (ref != null) {
                matchedSequenceIds.add(DotText.afterHash(ref));
            }
        }

        int sequenceIndex = 0;
        for (String matchedId : matchedSequenceIds) {
            int index = sequenceIndex++;
            if (!isPropositionSequence(matchedId, context)) {
                log.debug("Matched sequence {} is not part of any loaded proposition", matchedId);
                continue;
            }
            List<PhaseRecord> propositionPhases = context.getPropositionPhases().values().stream()
                    .filter(p -> isSameSequence(p.getSequenceId(), matchedId))
                    .collect(Collectors.toList());
            if (propositionPhases.isEmpty()) {
                continue;
            }
            PhaseRecord firstPropositionPhase = propositionPhases.get(0);
            String propositionClusterId = firstPropositionPhase.getClusterId();

            bridge(clusterId, phases.get(0).getPhaseId(), propositionClusterId, firstPropositionPhase.getPhaseId(), context);

            Map<Integer, List<PhaseRecord>> byGroup = groupByPhasesGroup(propositionPhases);
            for (PhaseRecord phase : phases) {
                List<Element> matchRecords = XmlNodes.descendants(phase.getElement(), "matchingPropositionPhases");
                if (index >= matchRecords.size()) {
                    continue;
                }
                Element matchRecord = matchRecords.get(index);
                Map<Integer, List<Integer>> ranges = PhasesRefParser.parse(XmlNodes.thesuAttr(matchRecord, "phasesRef"));
                linkPhase(phase.getPhaseId(), ranges, MatchingQualifier.of(matchRecord), byGroup, context.getEmitter());
            }
        }
    }

    /**
     * Invisible point node that pulls the two sequence clusters next to each other.
     */
    private void bridge(String clusterId, String firstPhaseId, String propositionClusterId, String firstPropositionPhaseId,
                        LoweringContext context) {
        GraphEmitter emitter = context.getEmitter();
        MediatorId bridge = idGenerator.allocate(emitter, RelationRole.MATCHING_SEQUENCE, clusterId, propositionClusterId,
                IdSeed.numeric(1));
        emitter.node(GraphNode.of(bridge.getValue(), NodeKind.MEDIATOR)
                .put("shape", "point")
                .put("style", "invis")
                .put("gephi_invis", "true"));
        emitter.edge(GraphEdge.of(bridge.getValue(), firstPropositionPhaseId)
                .put("dir", "none")
                .put("lhead", "cluster_" + propositionClusterId)
                .put("style", "invis")
                .put("gephi_invis", "true"));
        emitter.edge(GraphEdge.of(bridge.getValue(), firstPhaseId)
                .put("dir", "none")
                .put("lhead", "cluster_" + clusterId)
                .put("style", "invis")
                .put("gephi_invis", "true"));
    }

    private static void linkPhase(String phaseId, Map<Integer, List<Integer>> ranges, List<MatchingQualifier> qualifiers,
                                  Map<Integer, List<PhaseRecord>> byGroup, GraphEmitter emitter) {
        String label = qualifiers.isEmpty()
                ? "matches"
                : qualifiers.stream().map(MatchingQualifier::getVerb).collect(Collectors.joining(",<br/>"));
        String gephiLabel = qualifiers.isEmpty() ? "matc" : qualifiers.get(qualifiers.size() - 1).getGephiLabel();

        for (Map.Entry<Integer, List<Integer>> range : ranges.entrySet()) {
            List<PhaseRecord> group = byGroup.getOrDefault(range.getKey(), List.of());
            List<PhaseRecord> matched = new ArrayList<>();
            if (range.getValue().isEmpty()) {
                matched.addAll(group);
            } else {
                for (Integer number : range.getValue()) {
                    if (number >= 1 && number <= group.size()) {
                        matched.add(group.get(number - 1));
                    }
                }
            }
            for (PhaseRecord propositionPhase : matched) {
                emitter.edge(GraphEdge.of(propositionPhase.getPhaseId(), phaseId)
                        .put("xlabel", "<" + label + ">")
                        .put("fontsize", "10")
                        .put("fontcolor", Palette.PROPOSITION.border())
                        .put("fontname", "bold")
                        .put("color", Palette.PROPOSITION.border())
                        .put("style", "dotted")
                        .put("penwidth", "1.25")
                        .put("gephi_label", gephiLabel));
            }
        }
    }

    private static Map<Integer, List<PhaseRecord>> groupByPhasesGroup(List<PhaseRecord> phases) {
        Map<Integer, List<PhaseRecord>> byGroup = new LinkedHashMap<>();
        for (PhaseRecord phase : phases) {
            byGroup.computeIfAbsent(phase.getGroupNumber(), k -> new ArrayList<>()).add(phase);
        }
        byGroup.values().forEach(list -> list.sort(Comparator.comparingInt(PhaseRecord::getNumberInGroup)));
        return byGroup;
    }

    /** Exact id, or the local part of a synthesized {@code <proposition>_<sequence>} id. */
    private static boolean isSameSequence(String sequenceId, String matchedId) {
        return sequenceId.equals(matchedId) || sequenceId.endsWith("_" + matchedId);
    }

    private static boolean isPropositionSequence(String sequenceId, LoweringContext context) {
        for (Element proposition : context.getDocument().getPropositions().values()) {
            for (Element sequence : XmlNodes.descendants(proposition, "sequence")) {
                if (sequenceId.equals(XmlNodes.xmlId(sequence))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Phase colour: the thesis colours when matching sequences are filtered or absent, otherwise a
     * blend from dark green towards them by the share of matching-phase records that resolve.
     */
    private static Palette phasePalette(Element sequence, Element phase, Palette thesisPalette, LoweringContext context) {
        if (!context.isMatchingCoverageShown()) {
            return thesisPalette;
        }
        int expected = XmlNodes.children(sequence, "matchingPropositionSequence").size();
        if (expected == 0) {
            return thesisPalette;
        }
        List<Element> records = XmlNodes.children(phase, "matchingPropositionPhases");
        int valid = 0;
        for (int i = 0; i < records.size() && i < expected; i++) {
            String ref = XmlNodes.thesuAttr(records.get(i), "phasesRef");
            if (ref != null && !ref.isBlank() && !"/".equals(ref) && !PhasesRefParser.parse(ref).isEmpty()) {
                valid++;
            }
        }
        return Palette.PHASE_UNMATCHED.blend(thesisPalette, (double) valid / expected);
    }

    private static Optional<Element> firstPlainSequence(Element thesis) {
        for (Element type : XmlNodes.ownDescendants(thesis, "thesisType")) {
            for (Element group : XmlNodes.children(type, "sequencesGroup")) {
                for (Element sequence : XmlNodes.descendants(group, "sequence")) {
                    if (XmlNodes.firstDescendant(sequence, "maySubstitute").isEmpty()) {
                        return Optional.of(sequence);
                    }
                }
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static String sequenceId(Element sequence, String thesisId) {
        String thesuId = XmlNodes.thesuAttr(sequence, "id");
        if (thesuId != null) {
            return thesisId + "_" + thesuId;
        }
        String xmlId = XmlNodes.xmlId(sequence);
        return xmlId != null ? xmlId : thesisId + "_Q" + SEQUENCE_NUMBER;
    }

    /**
     * Every phase below the sequence, numbered from 1, with its position inside its phases group.
     */
    private static List<PhaseRecord> phases(Element sequence, String sequenceId) {
        List<Element> groups = XmlNodes.descendants(sequence, "phasesGroup");
        List<PhaseRecord> result = new ArrayList<>();
        Integer lastGroup = null;
        int inGroup = 0;
        int number = 0;
        for (Element phase : XmlNodes.descendants(sequence, "phase")) {
            number++;
            Integer group = null;
            for (int g = 0; g < groups.size(); g++) {
                if (XmlNodes.isDescendantOf(phase, groups.get(g))) {
                    group = g + 1;
                    break;
                }
            }
            inGroup = Objects.equals(group, lastGroup) ? inGroup + 1 : 1;
            lastGroup = group;
            result.add(PhaseRecord.builder()
                    .phaseId(sequenceId.replace("Q", "q") + String.format("%03d", number))
                    .sequenceId(sequenceId)
                    .phaseNumber(number)
                    .groupNumber(group)
                    .numberInGroup(inGroup)
                    .paraphrasis(DotText.paraphrasis(EntityDescriptions.phaseText(phase),
                            EntityDescriptions.PHASE_PARAPHRASIS_WIDTH))
                    .originalXmlId(XmlNodes.xmlId(phase))
                    .element(phase)
                    .build());
        }
        return result;
    }
}
