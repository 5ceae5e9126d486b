package com.purchasingpower.thesugraph.service.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.thesugraph.exception.DocumentLoadException;
import com.purchasingpower.thesugraph.model.xml.LoadedDocument;
import com.purchasingpower.thesugraph.model.xml.RunCaches;
import com.purchasingpower.thesugraph.service.ThesuDocumentLoader;
import com.purchasingpower.thesugraph.util.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.purchasingpower.thesugraph.model.xml.ThesuNamespaces.XINCLUDE;

@Slf4j
@Service
public class ThesuDocumentLoaderImpl implements ThesuDocumentLoader {

    @Override
    public LoadedDocument load(Path xmlFile, Path baseDir, RunCaches caches) {
        Preconditions.checkNotNull(xmlFile, "XML file cannot be null");
        Preconditions.checkNotNull(caches, "Run caches cannot be null");

        log.info("Loading TheSu document: {}", xmlFile.toAbsolutePath());
        Document document;
        try {
            document = parse(xmlFile);
        } catch (IOException | SAXException | ParserConfigurationException e) {
            throw new DocumentLoadException("Cannot parse TheSu document " + xmlFile + ": " + e.getMessage(), xmlFile, e);
        }

        Document original = (Document) document.cloneNode(true);
        Path resolvedBase = baseDir != null ? baseDir : xmlFile.toAbsolutePath().getParent();

        Map<String, Element> propositions = new LinkedHashMap<>();
        collectPropositions(document.getDocumentElement(), propositions);
        loadIncludedPropositions(document.getDocumentElement(), resolvedBase, caches, propositions);

        log.info("✅ Loaded {} with {} proposition(s)", xmlFile.getFileName(), propositions.size());
        return LoadedDocument.builder()
                .xmlFile(xmlFile)
                .baseDir(resolvedBase)
                .document(document)
                .originalDocument(original)
                .propositions(propositions)
                .caches(caches)
                .build();
    }

    @Override
    public Optional<Document> loadAuxiliary(Path path, RunCaches caches) {
        return caches.getDocuments().get(path, p -> {
            if (!Files.isRegularFile(p)) {
                log.warn("⚠️ Auxiliary document not found: {}", p);
                return Optional.empty();
            }
            try {
                return Optional.of(parse(p));
            } catch (IOException | SAXException | ParserConfigurationException e) {
                log.warn("⚠️ Cannot parse auxiliary document {}: {}", p, e.getMessage());
                return Optional.empty();
            }
        });
    }

    private void loadIncludedPropositions(Element root, Path baseDir, RunCaches caches, Map<String, Element> propositions) {
        NodeList includes = root.getElementsByTagNameNS(XINCLUDE, "include");
        for (int i = 0; i < includes.getLength(); i++) {
            Element include = (Element) includes.item(i);
            if (!XmlNodes.is(include.getParentNode(), "propositions")) {
                continue;
            }
            String href = include.getAttribute("href");
            if (href.isBlank()) {
                continue;
            }
            Path path = baseDir.resolve(URLDecoder.decode(href, StandardCharsets.UTF_8));
            loadAuxiliary(path, caches).ifPresent(doc -> {
                int before = propositions.size();
                collectPropositions(doc.getDocumentElement(), propositions);
                log.debug("Included {} proposition(s) from {}", propositions.size() - before, path);
            });
        }
    }

    private void collectPropositions(Element root, Map<String, Element> propositions) {
        for (Element proposition : XmlNodes.descendants(root, "PROPOSITION")) {
            String id = XmlNodes.elementId(proposition);
            if (id != null) {
                propositions.putIfAbsent(id, proposition);
            }
        }
        if (XmlNodes.is(root, "PROPOSITION") && XmlNodes.elementId(root) != null) {
            propositions.putIfAbsent(XmlNodes.elementId(root), root);
        }
    }

    private Document parse(Path path) throws IOException, SAXException, ParserConfigurationException {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        dbf.setValidating(false);
        dbf.setXIncludeAware(false);
        dbf.setExpandEntityReferences(false);

        DocumentBuilder builder = dbf.newDocumentBuilder();
        // external DTDs of TEI sources are never fetched
        builder.setEntityResolver((publicId, systemId) -> new InputSource(new StringReader("")));
        try (InputStream in = Files.newInputStream(path)) {
            return builder.parse(in, path.toUri().toString());
        }
    }
}
