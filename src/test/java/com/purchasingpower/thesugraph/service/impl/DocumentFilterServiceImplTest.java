package com.purchasingpower.thesugraph.service.impl;

import com.purchasingpower.thesugraph.TestDocuments;
import com.purchasingpower.thesugraph.model.filter.FilterSettings;
import com.purchasingpower.thesugraph.model.xml.LoadedDocument;
import com.purchasingpower.thesugraph.model.xml.RunCaches;
import com.purchasingpower.thesugraph.service.filter.CustomPropositionFilter;
import com.purchasingpower.thesugraph.service.filter.CustomSequenceFilter;
import com.purchasingpower.thesugraph.service.filter.ExtrinsicElementFilter;
import com.purchasingpower.thesugraph.service.filter.GlobalToggleFilter;
import com.purchasingpower.thesugraph.service.filter.SourceSelectionFilter;
import com.purchasingpower.thesugraph.service.filter.ThesisFocusFilter;
import com.purchasingpower.thesugraph.util.XmlNodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Document Filter Service Tests")
class DocumentFilterServiceImplTest {

    private ThesuDocumentLoaderImpl loader;
    private DocumentFilterServiceImpl filterService;

    @BeforeEach
    void setUp() {
        loader = new ThesuDocumentLoaderImpl();
        filterService = new DocumentFilterServiceImpl(List.of(
                new SourceSelectionFilter(),
                new CustomPropositionFilter(),
                new CustomSequenceFilter(),
                new GlobalToggleFilter(),
                new ExtrinsicElementFilter(),
                new ThesisFocusFilter()));
    }

    private LoadedDocument load(String fixture) {
        return loader.load(TestDocuments.fixture(fixture), null, new RunCaches());
    }

    private static Element phase(LoadedDocument document, String id) {
        return XmlNodes.findByXmlId(document.root(), id).get(0);
    }

    private static List<String> phaseRefs(Element phase) {
        return XmlNodes.children(phase, "matchingPropositionPhases").stream()
                .map(record -> XmlNodes.thesuAttr(record, "phasesRef"))
                .collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should cut a thesis-proposition link together with its aligned sequence and phase records")
    void testCustomProposition_RemovesAlignedRecords() {
        // Given
        LoadedDocument document = load("matching.xml");
        FilterSettings settings = FilterSettings.builder()
                .filterMatchingPropositionSequences(false)
                .customProposition("P1", List.of("src.B.T1"))
                .build();

        // When
        Map<String, Integer> removals = filterService.applyFilters(document, settings);

        // Then
        List<Element> links = XmlNodes.descendants(document.root(), "matchingProposition");
        assertEquals(1, links.size());
        assertEquals("#P2", XmlNodes.thesuAttr(links.get(0), "propRef"));

        List<Element> sequences = XmlNodes.descendants(document.root(), "matchingPropositionSequence");
        assertEquals(1, sequences.size());
        assertEquals("#P2.Q300001", XmlNodes.thesuAttr(sequences.get(0), "sequenceRef"));

        assertEquals(List.of("1.2"), phaseRefs(phase(document, "src.B.H100001")));
        assertEquals(List.of("1.1-2"), phaseRefs(phase(document, "src.B.H100002")));
        assertEquals(1, removals.get("customPropositionLinks"));
        assertEquals(2, removals.get("customPropositionPhases"));
    }

    @Test
    @DisplayName("Should remove the second sequence link and the phase records at its position")
    void testCustomSequence_RemovesSecondRecord() {
        LoadedDocument document = load("matching.xml");
        FilterSettings settings = FilterSettings.builder()
                .filterMatchingPropositionSequences(false)
                .customSequence("P2.Q300001", List.of("src.B.T1"))
                .build();

        filterService.applyFilters(document, settings);

        List<Element> sequences = XmlNodes.descendants(document.root(), "matchingPropositionSequence");
        assertEquals(1, sequences.size());
        assertEquals("#P1.Q200001", XmlNodes.thesuAttr(sequences.get(0), "sequenceRef"));
        assertEquals(List.of("1.1"), phaseRefs(phase(document, "src.B.H100001")));
        assertEquals(List.of("1.2"), phaseRefs(phase(document, "src.B.H100002")));
    }

    @Test
    @DisplayName("Should remove a sequence link only once when proposition and sequence rules target the same pair")
    void testCustomPropositionAndSequence_SamePair() {
        // Given
        LoadedDocument document = load("matching.xml");
        FilterSettings settings = FilterSettings.builder()
                .filterMatchingPropositionSequences(false)
                .customProposition("P1", List.of("src.B.T1"))
                .customSequence("P1.Q200001", List.of("src.B.T1"))
                .build();

        // When
        Map<String, Integer> removals = filterService.applyFilters(document, settings);

        // Then
        List<Element> sequences = XmlNodes.descendants(document.root(), "matchingPropositionSequence");
        assertTrue(sequences.stream()
                .noneMatch(record -> "#P1.Q200001".equals(XmlNodes.thesuAttr(record, "sequenceRef"))));
        assertEquals(1, sequences.size());
        assertEquals("#P2.Q300001", XmlNodes.thesuAttr(sequences.get(0), "sequenceRef"));

        assertEquals(List.of("1.2"), phaseRefs(phase(document, "src.B.H100001")), "Surviving record is not shifted");
        assertEquals(List.of("1.1-2"), phaseRefs(phase(document, "src.B.H100002")));
        assertEquals(2, removals.get("customPropositionPhases"));
        assertEquals(0, removals.getOrDefault("customSequencePhases", 0), "Nothing left for the sequence rule");
    }

    @Test
    @DisplayName("Should leave rules for other theses alone")
    void testCustomSequence_OtherThesisUntouched() {
        LoadedDocument document = load("matching.xml");
        FilterSettings settings = FilterSettings.builder()
                .filterMatchingPropositionSequences(false)
                .customSequence("P2.Q300001", List.of("src.B.T99"))
                .build();

        filterService.applyFilters(document, settings);

        assertEquals(2, XmlNodes.descendants(document.root(), "matchingPropositionSequence").size());
    }

    @Test
    @DisplayName("Should apply only the proposition toggle when several toggles are on")
    void testGlobalToggle_Precedence() {
        LoadedDocument document = load("matching.xml");
        FilterSettings settings = FilterSettings.builder()
                .filterPropositions(true)
                .filterAllSequences(true)
                .build();

        filterService.applyFilters(document, settings);

        assertTrue(XmlNodes.descendants(document.root(), "matchingProposition").isEmpty());
        assertTrue(document.getPropositions().isEmpty());
        Element thesis = XmlNodes.findByXmlId(document.root(), "src.B.T1").get(0);
        assertEquals(1, XmlNodes.descendants(thesis, "sequence").size(), "Thesis sequences survive");
        assertEquals(2, XmlNodes.descendants(thesis, "matchingPropositionSequence").size());
    }

    @Test
    @DisplayName("Should strip matching records and proposition sequences by default")
    void testGlobalToggle_DefaultMatchingSequences() {
        LoadedDocument document = load("matching.xml");

        filterService.applyFilters(document, FilterSettings.defaults());

        assertTrue(XmlNodes.descendants(document.root(), "matchingPropositionSequence").isEmpty());
        assertTrue(XmlNodes.descendants(document.root(), "matchingPropositionPhases").isEmpty());
        assertTrue(XmlNodes.descendants(document.getPropositions().get("P1"), "sequence").isEmpty());
        assertEquals(2, XmlNodes.descendants(document.root(), "matchingProposition").size());
        Element thesis = XmlNodes.findByXmlId(document.root(), "src.B.T1").get(0);
        assertEquals(1, XmlNodes.descendants(thesis, "sequence").size());
    }

    @Test
    @DisplayName("Should drop sources that are not selected")
    void testSourceSelection() {
        LoadedDocument document = load("matching.xml");

        Map<String, Integer> removals = filterService.applyFilters(document,
                FilterSettings.builder().sourceToSelect("src.other").build());

        assertTrue(XmlNodes.descendants(document.root(), "source").isEmpty());
        assertEquals(1, removals.get("sources"));
        assertNotNull(document.getOriginalDocument().getElementsByTagNameNS("*", "source").item(0),
                "The unfiltered copy is not touched");
    }

    @Test
    @DisplayName("Should keep only the focus thesis among its siblings")
    void testThesisFocus() {
        LoadedDocument document = load("argumentation.xml");

        filterService.applyFilters(document, FilterSettings.builder().thesisFocusId("src.A.T2").build());

        Element source = XmlNodes.descendants(document.root(), "source").get(0);
        List<Element> remaining = XmlNodes.childElements(source);
        assertEquals(1, remaining.size());
        assertEquals("src.A.T2", XmlNodes.xmlId(remaining.get(0)));
    }
}
