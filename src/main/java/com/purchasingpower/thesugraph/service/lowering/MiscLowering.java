package com.purchasingpower.thesugraph.service.lowering;

import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.model.graph.NodeKind;
import com.purchasingpower.thesugraph.model.style.Manifestation;
import com.purchasingpower.thesugraph.model.style.Palette;
import com.purchasingpower.thesugraph.model.xml.ElementText;
import com.purchasingpower.thesugraph.service.TextExtractionService;
import com.purchasingpower.thesugraph.util.DotText;
import com.purchasingpower.thesugraph.util.XmlNodes;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

@Component
@RequiredArgsConstructor
public class MiscLowering implements ElementLowering {

    private final TextExtractionService textExtractionService;

    @Override
    public boolean supports(Element element) {
        return XmlNodes.is(element, "MISC");
    }

    @Override
    public void lower(Element element, String sourceId, LoweringContext context) {
        String id = XmlNodes.elementId(element);
        Manifestation manifestation = Manifestation.of(element);
        Palette palette = manifestation.isUnstated() ? Palette.MISC_UNSTATED : Palette.MISC;
        String style = manifestation.isUnstated() ? "dashed,filled" : "filled";

        ElementText text = textExtractionService.extract(element, context.getDocument());
        String speakers = EntityDescriptions.speakers(element);
        String paraphrasisText = EntityDescriptions.paraphrasisText(element);
        String label = "<<br/><b>" + manifestation.getLabelPrefix() + "MISC</b><br/>"
                + EntityDescriptions.speakerLine(speakers) + "<br/>"
                + DotText.escapeHtml(text.getLocus()) + "<br/>"
                + "<i>" + DotText.paraphrasis(paraphrasisText, EntityDescriptions.PARAPHRASIS_WIDTH) + "</i><br/>"
                + "<font point-size=\"12\">\"" + DotText.escapeHtml(text.getSnippet()) + "\"</font>>";

        context.getEmitter().node(GraphNode.of(id, NodeKind.MISC)
                .put("label", label)
                .put("gephi_label", "MISC")
                .put("text", text.getText())
                .put("locus", text.getLocus())
                .put("speaker", speakers)
                .put("manifestation", manifestation.getAttributeValue())
                .put("source", sourceId)
                .put("fillcolor", palette.fill())
                .put("color", palette.border())
                .put("style", style)
                .put("shape", "cylinder")
                .put("margin", "0.30,0.1"));
    }
}
