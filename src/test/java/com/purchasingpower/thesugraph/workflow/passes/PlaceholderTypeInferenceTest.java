package com.purchasingpower.thesugraph.workflow.passes;

import com.purchasingpower.thesugraph.TestDocuments;
import com.purchasingpower.thesugraph.model.graph.NodeKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Placeholder Type Inference Tests")
class PlaceholderTypeInferenceTest {

    private static final Document DOCUMENT = TestDocuments.parse(
            "<thesu:AEsystem " + TestDocuments.NS + ">"
                    + "<thesu:source xml:id=\"src.A\">"
                    + "<thesu:SUPPORT xml:id=\"src.A.T9\"/>"
                    + "<thesu:THESIS xml:id=\"S4\"/>"
                    + "</thesu:source></thesu:AEsystem>");

    @Test
    @DisplayName("Should prefer the element type found in the unfiltered document")
    void testResolve_FromDocument() {
        // Id pattern says THESIS, document says SUPPORT
        assertEquals(NodeKind.SUPPORT, PlaceholderTypeInference.resolve("src.A.T9", DOCUMENT));
        // Found through its last segment only
        assertEquals(NodeKind.THESIS, PlaceholderTypeInference.resolve("other.S4", DOCUMENT));
    }

    @Test
    @DisplayName("Should fall back to the id pattern when the element is unknown")
    void testResolve_Fallback() {
        assertEquals(NodeKind.SUPPORT, PlaceholderTypeInference.resolve("src.B.S12", DOCUMENT));
        assertEquals(NodeKind.THESIS, PlaceholderTypeInference.resolve("src.B.T3", null));
    }

    @Test
    @DisplayName("Should infer from the last id segment, defaulting to THESIS")
    void testInferFromId() {
        assertEquals(NodeKind.SUPPORT, PlaceholderTypeInference.inferFromId("a.b.s7"));
        assertEquals(NodeKind.THESIS, PlaceholderTypeInference.inferFromId("a.b.T7"));
        assertEquals(NodeKind.THESIS, PlaceholderTypeInference.inferFromId("Summary"));
        assertEquals(NodeKind.THESIS, PlaceholderTypeInference.inferFromId("S"));
    }
}
