package org.ptnet.utils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.apache.log4j.Logger;
import org.ptnet.exceptions.PnmlSyntaxException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * DOM helpers: namespace-aware parsing and lookups by local name.
 */
public final class XmlDocuments {

    private static final Logger logger = Logger.getLogger(XmlDocuments.class);

    private XmlDocuments() {
    }

    public static Document parse(byte[] xml) throws PnmlSyntaxException, IOException {
        return parse(new ByteArrayInputStream(xml));
    }

    /**
     * Parse a document. External entities and DTD loading are disabled.
     *
     * @throws PnmlSyntaxException when the input is not well-formed
     */
    public static Document parse(InputStream in) throws PnmlSyntaxException, IOException {
        DocumentBuilder db = newBuilder();
        try {
            return db.parse(new InputSource(in));
        } catch (SAXParseException e) {
            throw new PnmlSyntaxException("XML not well formed at line " + e.getLineNumber() + ", column "
                    + e.getColumnNumber() + ": " + e.getMessage(), e, e.getLineNumber(), e.getColumnNumber());
        } catch (SAXException e) {
            throw new PnmlSyntaxException("XML not well formed: " + e.getMessage(), e);
        }
    }

    private static DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(true);
            dbf.setExpandEntityReferences(false);
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            dbf.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            DocumentBuilder db = dbf.newDocumentBuilder();
            db.setErrorHandler(QUIET_HANDLER);
            return db;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser not available", e);
        }
    }

    /**
     * Local name of an element, ignoring any prefix.
     */
    public static String localName(Node node) {
        String name = node.getLocalName();
        return name != null ? name : node.getNodeName();
    }

    /**
     * First direct child element with the given local name, or null.
     */
    public static Element child(Element parent, String localName) {
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE && localName.equals(localName(n))) {
                return (Element) n;
            }
        }
        return null;
    }

    /**
     * Follow a path of direct children, e.g. {@code name/graphics/offset}. Null when any step is missing.
     */
    public static Element path(Element start, String... localNames) {
        Element current = start;
        for (String name : localNames) {
            if (current == null) {
                return null;
            }
            current = child(current, name);
        }
        return current;
    }

    /**
     * Direct child elements with the given local name, in document order.
     */
    public static List<Element> children(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE && localName.equals(localName(n))) {
                result.add((Element) n);
            }
        }
        return result;
    }

    /**
     * All descendant elements with the given local name, in document order.
     */
    public static List<Element> descendants(Element root, String localName) {
        NodeList nodes = root.getElementsByTagNameNS("*", localName);
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    /**
     * Attribute value, or null when the attribute is not present.
     * (DOM returns "" for both absent and empty attributes.)
     */
    public static String attribute(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    /**
     * Text content of an element, or null for a missing element.
     */
    public static String text(Element element) {
        return element == null ? null : element.getTextContent();
    }

    private static final ErrorHandler QUIET_HANDLER = new ErrorHandler() {
        @Override
        public void warning(SAXParseException e) {
            logger.warn("XML warning at line " + e.getLineNumber() + ": " + e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    };
}
