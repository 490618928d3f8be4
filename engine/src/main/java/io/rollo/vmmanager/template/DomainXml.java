package io.rollo.vmmanager.template;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * DOM helpers shared by the generator and the manifest parser.
 */
final class DomainXml {

    private DomainXml() {
    }

    @Nonnull
    static Document newDocument() throws ParserConfigurationException {
        return builder().newDocument();
    }

    @Nonnull
    static Document parse(@Nonnull String xml) throws ParserConfigurationException, SAXException, IOException {
        return builder().parse(new org.xml.sax.InputSource(new StringReader(xml)));
    }

    @Nonnull
    static String serialize(@Nonnull Document document) throws TransformerException {
        TransformerFactory factory = TransformerFactory.newInstance();
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
        Transformer transformer = factory.newTransformer();
        transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
        transformer.setOutputProperty(OutputKeys.INDENT, "yes");
        transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
        StringWriter writer = new StringWriter();
        transformer.transform(new DOMSource(document), new StreamResult(writer));
        return writer.toString();
    }

    private static DocumentBuilder builder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        return factory.newDocumentBuilder();
    }

    @Nonnull
    static Element append(@Nonnull Element parent, @Nonnull String name) {
        Element child = parent.getOwnerDocument().createElement(name);
        parent.appendChild(child);
        return child;
    }

    @Nonnull
    static Element append(@Nonnull Element parent, @Nonnull String name, @Nonnull String text) {
        Element child = append(parent, name);
        child.setTextContent(text);
        return child;
    }

    /**
     * Direct child elements with the given tag name.
     */
    @Nonnull
    static List<Element> children(@Nonnull Element parent, @Nonnull String name) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(node.getNodeName())) {
                result.add((Element) node);
            }
        }
        return result;
    }

    @Nullable
    static Element child(@Nonnull Element parent, @Nonnull String name) {
        List<Element> found = children(parent, name);
        return found.isEmpty() ? null : found.get(0);
    }

    @Nullable
    static String childAttribute(@Nonnull Element parent, @Nonnull String child, @Nonnull String attribute) {
        Element element = child(parent, child);
        if (element == null || !element.hasAttribute(attribute)) {
            return null;
        }
        return element.getAttribute(attribute);
    }
}
