package com.purchasingpower.thesugraph.workflow.passes;

import com.purchasingpower.thesugraph.model.graph.NodeKind;
import com.purchasingpower.thesugraph.util.XmlNodes;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.List;

/**
 * Decides whether an excluded element was a THESIS or a SUPPORT.
 */
public final class PlaceholderTypeInference {

    private PlaceholderTypeInference() {
    }

    /**
     * Looks the id up in the unfiltered document (full id, then its last dot segment) and falls
     * back to {@link #inferFromId(String)} when the document is missing or has no such element.
     */
    public static NodeKind resolve(String elementId, Document originalDocument) {
        if (originalDocument != null && originalDocument.getDocumentElement() != null) {
            Element found = lookup(originalDocument.getDocumentElement(), elementId);
            if (found != null) {
                if (XmlNodes.is(found, "THESIS")) {
                    return NodeKind.THESIS;
                }
                if (XmlNodes.is(found, "SUPPORT")) {
                    return NodeKind.SUPPORT;
                }
            }
        }
        return inferFromId(elementId);
    }

    /**
     * Last dot-separated segment starting with {@code T} + digit is a THESIS, with {@code S} +
     * digit a SUPPORT; anything else defaults to THESIS.
     */
    public static NodeKind inferFromId(String elementId) {
        String last = lastSegment(elementId).toUpperCase();
        if (last.length() > 1 && last.charAt(0) == 'S' && Character.isDigit(last.charAt(1))) {
            return NodeKind.SUPPORT;
        }
        return NodeKind.THESIS;
    }

    static Element lookup(Element root, String elementId) {
        List<Element> found = XmlNodes.findByXmlId(root, elementId);
        if (found.isEmpty()) {
            String last = lastSegment(elementId);
            if (!last.equals(elementId)) {
                found = XmlNodes.findByXmlId(root, last);
            }
        }
        return found.isEmpty() ? null : found.get(0);
    }

    static String lastSegment(String elementId) {
        int dot = elementId.lastIndexOf('.');
        return dot < 0 ? elementId : elementId.substring(dot + 1);
    }
}
