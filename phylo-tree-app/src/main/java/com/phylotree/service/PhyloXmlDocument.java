package com.phylotree.service;

import com.phylotree.service.PhyloXmlWriteException.ErrorCode;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerConfigurationException;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * DOM document rooted at {@code <phyloxml>}, holding a single {@code <phylogeny rooted="true">}.
 * All elements are created in the PhyloXML namespace.
 */
public class PhyloXmlDocument {

    public static final String PHYLOXML_NS = "http://www.phyloxml.org";
    public static final String XSI_NS = XMLConstants.W3C_XML_SCHEMA_INSTANCE_NS_URI;
    public static final String SCHEMA_LOCATION = PHYLOXML_NS + " http://www.phyloxml.org/1.10/phyloxml.xsd";

    private static final String INDENT_AMOUNT = "{http://xml.apache.org/xslt}indent-amount";

    private final Document doc;
    private final Element phylogeny;

    private PhyloXmlDocument(Document doc) {
        this.doc = doc;

        Element root = doc.createElementNS(PHYLOXML_NS, "phyloxml");
        root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns", PHYLOXML_NS);
        root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:xsi", XSI_NS);
        root.setAttributeNS(XSI_NS, "xsi:schemaLocation", SCHEMA_LOCATION);
        doc.appendChild(root);

        this.phylogeny = element("phylogeny");
        phylogeny.setAttribute("rooted", "true");
        root.appendChild(phylogeny);
    }

    public static PhyloXmlDocument create() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            Document doc = factory.newDocumentBuilder().newDocument();
            doc.setXmlStandalone(true);
            return new PhyloXmlDocument(doc);
        } catch (ParserConfigurationException e) {
            throw new PhyloXmlWriteException(ErrorCode.DOCUMENT_SETUP_FAILED,
                    "Cannot create XML document: " + e.getMessage(), e);
        }
    }

    public Element phylogeny() {
        return phylogeny;
    }

    public Element element(String name) {
        return doc.createElementNS(PHYLOXML_NS, name);
    }

    public Element textElement(String name, String text) {
        Element element = element(name);
        element.setTextContent(xmlSafe(text));
        return element;
    }

    public void attribute(Element element, String name, String value) {
        element.setAttribute(name, xmlSafe(value));
    }

    /**
     * Drop characters XML 1.0 cannot carry, even as character references.
     */
    static String xmlSafe(String text) {
        if (text == null || text.codePoints().allMatch(PhyloXmlDocument::isXmlChar)) {
            return text;
        }
        StringBuilder safe = new StringBuilder(text.length());
        text.codePoints().filter(PhyloXmlDocument::isXmlChar).forEach(safe::appendCodePoint);
        return safe.toString();
    }

    private static boolean isXmlChar(int c) {
        return c == 0x9 || c == 0xA || c == 0xD
                || (c >= 0x20 && c <= 0xD7FF)
                || (c >= 0xE000 && c <= 0xFFFD)
                || (c >= 0x10000 && c <= 0x10FFFF);
    }

    /**
     * Serialize the document as UTF-8. The stream is flushed but not closed.
     */
    public void writeTo(OutputStream out, int indent, boolean xmlDeclaration) {
        Transformer transformer = newTransformer(indent, xmlDeclaration);
        try {
            transformer.transform(new DOMSource(doc), new StreamResult(out));
            out.flush();
        } catch (TransformerException | IOException e) {
            throw new PhyloXmlWriteException(ErrorCode.WRITE_FAILED,
                    "Failed to write PhyloXML document: " + e.getMessage(), e);
        }
    }

    private Transformer newTransformer(int indent, boolean xmlDeclaration) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, xmlDeclaration ? "no" : "yes");
            transformer.setOutputProperty(OutputKeys.INDENT, indent > 0 ? "yes" : "no");
            if (indent > 0) {
                transformer.setOutputProperty(INDENT_AMOUNT, String.valueOf(indent));
            }
            return transformer;
        } catch (TransformerConfigurationException e) {
            throw new PhyloXmlWriteException(ErrorCode.DOCUMENT_SETUP_FAILED,
                    "Cannot configure XML serializer: " + e.getMessage(), e);
        }
    }
}
