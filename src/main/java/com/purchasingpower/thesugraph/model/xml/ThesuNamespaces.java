package com.purchasingpower.thesugraph.model.xml;

/**
 * Namespace URIs used by TheSu documents and the TEI sources they point into.
 */
public final class ThesuNamespaces {

    public static final String THESU = "http://alchemeast.eu/thesu/ns/1.0";
    public static final String XML = "http://www.w3.org/XML/1998/namespace";
    public static final String XINCLUDE = "http://www.w3.org/2001/XInclude";
    public static final String TEI = "http://www.tei-c.org/ns/1.0";

    private ThesuNamespaces() {
    }
}
