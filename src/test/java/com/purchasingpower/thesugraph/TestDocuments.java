package com.purchasingpower.thesugraph;

import org.w3c.dom.Document;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;

/**
 * Shared helpers for tests that need TheSu XML.
 */
public final class TestDocuments {

    public static final String NS = "xmlns:thesu=\"http://alchemeast.eu/thesu/ns/1.0\"";

    private TestDocuments() {
    }

    public static Document parse(String xml) {
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(true);
            return dbf.newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
        } catch (Exception e) {
            throw new IllegalStateException("Invalid test XML", e);
        }
    }

    public static Path fixture(String name) {
        URL url = TestDocuments.class.getResource("/fixtures/" + name);
        if (url == null) {
            throw new IllegalStateException("Missing fixture " + name);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Bad fixture location " + url, e);
        }
    }
}
