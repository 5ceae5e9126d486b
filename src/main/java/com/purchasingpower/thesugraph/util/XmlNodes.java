package com.purchasingpower.thesugraph.util;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.purchasingpower.thesugraph.model.xml.ThesuNamespaces.THESU;
import static com.purchasingpower.thesugraph.model.xml.ThesuNamespaces.XML;

/**
 * DOM navigation helpers for namespace-aware TheSu trees.
 *
 * <p>Lookups in the {@code thesu} namespace take a local name only. Missing attributes are
 * reported as {@code null} rather than the empty string DOM returns.
 */
public final class XmlNodes {

    private XmlNodes() {
    }

    public static boolean is(Node node, String localName) {
        return node instanceof Element element
                && THESU.equals(element.getNamespaceURI())
                && localName.equals(element.getLocalName());
    }

    public static List<Element> children(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (is(child, localName)) {
                result.add((Element) child);
            }
        }
        return result;
    }

    public static List<Element> childElements(Element parent) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element) {
                result.add(element);
            }
        }
        return result;
    }

    public static Optional<Element> firstChild(Element parent, String localName) {
        List<Element> matches = children(parent, localName);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    /**
     * Descendants in document order, excluding {@code root} itself.
     */
    public static List<Element> descendants(Element root, String localName) {
        List<Element> result = new ArrayList<>();
        NodeList list = root.getElementsByTagNameNS(THESU, localName);
        for (int i = 0; i < list.getLength(); i++) {
            result.add((Element) list.item(i));
        }
        return result;
    }

    /**
     * Descendants that belong to {@code owner} itself, skipping anything inside a nested
     * THESIS, SUPPORT, MISC or PROPOSITION.
     */
    public static List<Element> ownDescendants(Element owner, String localName) {
        List<Element> result = new ArrayList<>();
        for (Element candidate : descendants(owner, localName)) {
            if (owningEntity(candidate) == owner) {
                result.add(candidate);
            }
        }
        return result;
    }

    /**
     * Nearest enclosing THESIS, SUPPORT, MISC or PROPOSITION, or {@code null}.
     */
    public static Element owningEntity(Element element) {
        for (Node parent = element.getParentNode(); parent != null; parent = parent.getParentNode()) {
            if (isEntity(parent)) {
                return (Element) parent;
            }
        }
        return null;
    }

    public static boolean isEntity(Node node) {
        return is(node, "THESIS") || is(node, "SUPPORT") || is(node, "MISC") || is(node, "PROPOSITION");
    }

    public static Optional<Element> firstDescendant(Element root, String localName) {
        NodeList list = root.getElementsByTagNameNS(THESU, localName);
        return list.getLength() == 0 ? Optional.empty() : Optional.of((Element) list.item(0));
    }

    /**
     * Follows a path of child steps, collecting every match, e.g. {@code path(el, "thesisType", "etiologiesGroup")}.
     */
    public static List<Element> path(Element root, String... steps) {
        List<Element> current = List.of(root);
        for (String step : steps) {
            List<Element> next = new ArrayList<>();
            for (Element element : current) {
                next.addAll(children(element, step));
            }
            current = next;
        }
        return current;
    }

    public static String attr(Element element, String namespace, String localName) {
        if (element == null || !element.hasAttributeNS(namespace, localName)) {
            return null;
        }
        return element.getAttributeNS(namespace, localName);
    }

    public static String thesuAttr(Element element, String localName) {
        return attr(element, THESU, localName);
    }

    public static String xmlId(Element element) {
        return attr(element, XML, "id");
    }

    /**
     * Element identifier: {@code thesu:id} first, then {@code xml:id}.
     */
    public static String elementId(Element element) {
        String id = thesuAttr(element, "id");
        return id != null ? id : xmlId(element);
    }

    public static Optional<Element> nearestAncestor(Element element, String localName) {
        for (Node parent = element.getParentNode(); parent != null; parent = parent.getParentNode()) {
            if (is(parent, localName)) {
                return Optional.of((Element) parent);
            }
        }
        return Optional.empty();
    }

    public static boolean isDescendantOf(Node node, Element ancestor) {
        for (Node parent = node.getParentNode(); parent != null; parent = parent.getParentNode()) {
            if (parent == ancestor) {
                return true;
            }
        }
        return false;
    }

    /**
     * Detaches {@code element}; a no-op when it was already removed.
     *
     * @return whether the element was attached
     */
    public static boolean detach(Element element) {
        Node parent = element.getParentNode();
        if (parent == null) {
            return false;
        }
        parent.removeChild(element);
        return true;
    }

    /**
     * Elements carrying the given {@code xml:id} anywhere below {@code root}, in document order.
     */
    public static List<Element> findByXmlId(Element root, String id) {
        List<Element> result = new ArrayList<>();
        NodeList all = root.getElementsByTagName("*");
        for (int i = 0; i < all.getLength(); i++) {
            Element element = (Element) all.item(i);
            if (id.equals(xmlId(element))) {
                result.add(element);
            }
        }
        return result;
    }
}
