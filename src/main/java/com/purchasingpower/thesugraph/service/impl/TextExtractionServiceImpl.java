package com.purchasingpower.thesugraph.service.impl;

import com.purchasingpower.thesugraph.model.xml.ElementText;
import com.purchasingpower.thesugraph.model.xml.LoadedDocument;
import com.purchasingpower.thesugraph.model.xml.SegmentText;
import com.purchasingpower.thesugraph.service.TextExtractionService;
import com.purchasingpower.thesugraph.service.ThesuDocumentLoader;
import com.purchasingpower.thesugraph.util.DotText;
import com.purchasingpower.thesugraph.util.XmlNodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Follows {@code thesu:from}/{@code thesu:to} segment references ({@code file#id}) into the source
 * documents. Lookups go through the run caches, so each file is parsed once and each segment
 * resolved once per render.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TextExtractionServiceImpl implements TextExtractionService {

    private static final int MAX_WORDS_EACH_SIDE = 50;
    private static final Pattern HAS_DIGIT = Pattern.compile(".*\\d.*");

    private final ThesuDocumentLoader documentLoader;

    @Override
    public ElementText extract(Element element, LoadedDocument document) {
        List<String> texts = new ArrayList<>();
        String locus = "";
        for (Element segment : segmentsOf(element)) {
            SegmentText resolved = resolveSegment(segment, document);
            if (!resolved.getText().isEmpty()) {
                texts.add(resolved.getText());
            }
            if (locus.isEmpty()) {
                locus = resolved.getLocus();
            }
        }
        if (texts.isEmpty() && locus.isEmpty()) {
            return ElementText.EMPTY;
        }
        String text = DotText.collapseWhitespace(String.join(" ... ", texts));
        return ElementText.builder()
                .text(DotText.abbreviateWords(text, MAX_WORDS_EACH_SIDE))
                .snippet(DotText.snippet(text))
                .locus(locus)
                .build();
    }

    private List<Element> segmentsOf(Element element) {
        List<Element> segments = new ArrayList<>();
        for (Element text : XmlNodes.ownDescendants(element, "text")) {
            for (Element textRef : XmlNodes.children(text, "textRef")) {
                segments.addAll(XmlNodes.children(textRef, "segment"));
            }
        }
        return segments;
    }

    private SegmentText resolveSegment(Element segment, LoadedDocument document) {
        String from = XmlNodes.thesuAttr(segment, "from");
        if (from == null || from.isBlank()) {
            return SegmentText.EMPTY;
        }
        String to = XmlNodes.thesuAttr(segment, "to");
        String fromFile = fileOf(from);
        String fromId = DotText.afterHash(from);
        String toId = to == null ? null : DotText.afterHash(to);
        boolean sameFile = to == null || fileOf(to).equals(fromFile);

        return document.getCaches().getSegments().get(fromFile, fromId, sameFile ? toId : to,
                () -> resolve(fromFile, fromId, sameFile ? toId : null, document));
    }

    private SegmentText resolve(String file, String fromId, String toId, LoadedDocument document) {
        Optional<Document> source = sourceDocument(file, document);
        if (source.isEmpty()) {
            return SegmentText.EMPTY;
        }
        Element root = source.get().getDocumentElement();
        Element fromElement = findById(root, fromId);
        if (fromElement == null) {
            log.warn("⚠️ Segment start '{}' not found in {}", fromId, file);
            return SegmentText.EMPTY;
        }
        String text;
        if (toId == null || toId.equals(fromId)) {
            text = DotText.collapseWhitespace(fromElement.getTextContent());
        } else {
            Element toElement = findById(root, toId);
            text = toElement == null
                    ? DotText.collapseWhitespace(fromElement.getTextContent()) + " ... "
                    : collectRange(root, fromElement, toElement);
        }
        return new SegmentText(cleanPunctuation(text), locusOf(root, fromElement));
    }

    private Optional<Document> sourceDocument(String file, LoadedDocument document) {
        if (file.isEmpty()) {
            return Optional.of(document.getDocument());
        }
        for (Path candidate : candidatePaths(file, document)) {
            if (Files.isRegularFile(candidate)) {
                return documentLoader.loadAuxiliary(candidate, document.getCaches());
            }
        }
        log.warn("⚠️ Source file '{}' not found; element text left empty", file);
        return Optional.empty();
    }

    private List<Path> candidatePaths(String file, LoadedDocument document) {
        List<Path> candidates = new ArrayList<>();
        try {
            if (file.startsWith("file:")) {
                candidates.add(Path.of(URI.create(file)));
            }
        } catch (IllegalArgumentException e) {
            log.debug("Not a usable file URI: {}", file);
        }
        String decoded = URLDecoder.decode(file.replaceFirst("^file:/+", ""), StandardCharsets.UTF_8);
        Path relative = Path.of(decoded);
        candidates.add(relative);
        if (document.getBaseDir() != null) {
            candidates.add(document.getBaseDir().resolve(decoded));
            candidates.add(document.getBaseDir().resolve(relative.getFileName()));
        }
        Path xmlDir = document.getXmlFile().toAbsolutePath().getParent();
        if (xmlDir != null) {
            candidates.add(xmlDir.resolve(decoded));
        }
        return candidates;
    }

    /**
     * Text nodes from the start of {@code from} through the end of {@code to}, in document order.
     */
    private String collectRange(Element root, Element from, Element to) {
        StringBuilder sb = new StringBuilder();
        collect(root, from, to, sb, new boolean[]{false, false});
        return DotText.collapseWhitespace(sb.toString());
    }

    private void collect(Node node, Element from, Element to, StringBuilder sb, boolean[] state) {
        if (state[1]) {
            return;
        }
        if (node == from) {
            state[0] = true;
        }
        if (state[0] && node.getNodeType() == Node.TEXT_NODE) {
            sb.append(node.getNodeValue());
        }
        for (Node child = node.getFirstChild(); child != null && !state[1]; child = child.getNextSibling()) {
            collect(child, from, to, sb, state);
        }
        if (node == to && state[0]) {
            state[1] = true;
        }
    }

    private String locusOf(Element root, Element element) {
        String[] lastPage = {null};
        String[] lastMilestone = {null};
        findPrecedingMarkers(root, element, lastPage, lastMilestone, new boolean[]{false});
        if (lastMilestone[0] != null) {
            return lastMilestone[0];
        }
        List<String> divNumbers = new ArrayList<>();
        for (Node parent = element.getParentNode(); parent != null; parent = parent.getParentNode()) {
            if (parent instanceof Element div && "div".equals(div.getLocalName()) && div.hasAttribute("n")) {
                divNumbers.add(0, div.getAttribute("n"));
            }
        }
        if (!divNumbers.isEmpty()) {
            return String.join(".", divNumbers);
        }
        return lastPage[0] != null ? "p. " + lastPage[0] : "";
    }

    private void findPrecedingMarkers(Node node, Element target, String[] page, String[] milestone, boolean[] done) {
        if (done[0]) {
            return;
        }
        if (node == target) {
            done[0] = true;
            return;
        }
        if (node instanceof Element element && element.hasAttribute("n")) {
            String n = element.getAttribute("n");
            if ("pb".equals(element.getLocalName())) {
                page[0] = n;
            } else if ("milestone".equals(element.getLocalName()) && HAS_DIGIT.matcher(n).matches()) {
                milestone[0] = n;
            }
        }
        for (Node child = node.getFirstChild(); child != null && !done[0]; child = child.getNextSibling()) {
            findPrecedingMarkers(child, target, page, milestone, done);
        }
    }

    private Element findById(Element root, String id) {
        if (id == null) {
            return null;
        }
        NodeList all = root.getElementsByTagName("*");
        Element byPlainId = null;
        Element byThesuId = null;
        for (int i = 0; i < all.getLength(); i++) {
            Element candidate = (Element) all.item(i);
            if (id.equals(XmlNodes.xmlId(candidate))) {
                return candidate;
            }
            if (byPlainId == null && id.equals(candidate.getAttribute("id"))) {
                byPlainId = candidate;
            }
            if (byThesuId == null && id.equals(XmlNodes.thesuAttr(candidate, "id"))) {
                byThesuId = candidate;
            }
        }
        return byPlainId != null ? byPlainId : byThesuId;
    }

    private static String fileOf(String reference) {
        int idx = reference.lastIndexOf('#');
        return idx >= 0 ? reference.substring(0, idx) : "";
    }

    private static String cleanPunctuation(String text) {
        return text.replaceAll("\\s+([,.;:!?])", "$1").replaceAll("([(\\[])\\s+", "$1").trim();
    }
}
