/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.apache.brooklyn.modelmap.xml;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.Nullable;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import com.google.common.collect.ImmutableList;

/**
 * DOM helpers for handlers working on XML native data:
 * reading it ({@link #parse(String)}, {@link #xpath(Node, String)}, {@link #findText(Element, String)})
 * and building it ({@link #subElement(Element, String)}, {@link #findOrCreate(Element, String)}).
 */
public class XmlElements {

    /** attribute marking an element as to be deleted from the target configuration */
    public static final String DELETE = "delete";

    /** one step of a {@link #findOrCreate(Element, String)} path, e.g. <code>interface[name='ge-0/0/0']</code> */
    private static final Pattern STEP = Pattern.compile("([\\w-]+)(?:\\[([\\w-]+)='([^']*)'\\])?(?:/|$)");

    private XmlElements() {}

    /** {@link DocumentBuilder} instances are not thread-safe, so one is kept per thread */
    private static class SharedDocumentBuilder {
        private static final ThreadLocal<DocumentBuilder> instance = new ThreadLocal<DocumentBuilder>();

        public static DocumentBuilder get() throws ParserConfigurationException {
            DocumentBuilder result = instance.get();
            if (result == null) {
                DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
                factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
                result = factory.newDocumentBuilder();
                instance.set(result);
            } else {
                result.reset();
            }
            return result;
        }
    }

    /**
     * Parses the document, dropping whitespace-only text nodes so that indentation does not
     * show up as content.
     *
     * @return the document element
     * @throws IllegalArgumentException if the text is not well-formed XML
     */
    public static Element parse(String xml) {
        try {
            Document doc = SharedDocumentBuilder.get().parse(new InputSource(new StringReader(xml)));
            Element root = doc.getDocumentElement();
            stripWhitespace(root);
            return root;
        } catch (SAXException e) {
            throw new IllegalArgumentException("Invalid XML: "+e.getMessage(), e);
        } catch (IOException | ParserConfigurationException e) {
            throw new IllegalStateException("Cannot parse XML", e);
        }
    }

    /** a new document whose (empty) document element has the given name */
    public static Element newRoot(String name) {
        try {
            Document doc = SharedDocumentBuilder.get().newDocument();
            Element root = doc.createElement(name);
            doc.appendChild(root);
            return root;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Cannot create XML document", e);
        }
    }

    /** the elements the expression selects, evaluated against the given node */
    public static List<Element> xpath(Node context, String expression) {
        try {
            NodeList nodes = (NodeList) XPathFactory.newInstance().newXPath().compile(expression).evaluate(context, XPathConstants.NODESET);
            ImmutableList.Builder<Element> result = ImmutableList.builder();
            for (int i=0; i<nodes.getLength(); i++) {
                if (nodes.item(i) instanceof Element) result.add((Element) nodes.item(i));
            }
            return result.build();
        } catch (XPathExpressionException e) {
            throw new IllegalArgumentException("Invalid xpath "+expression, e);
        }
    }

    public static List<Element> children(Element parent, String name) {
        ImmutableList.Builder<Element> result = ImmutableList.builder();
        for (Node n = parent.getFirstChild(); n!=null; n = n.getNextSibling()) {
            if (n instanceof Element && name.equals(n.getNodeName())) result.add((Element) n);
        }
        return result.build();
    }

    @Nullable
    public static Element findChild(Element parent, String name) {
        for (Node n = parent.getFirstChild(); n!=null; n = n.getNextSibling()) {
            if (n instanceof Element && name.equals(n.getNodeName())) return (Element) n;
        }
        return null;
    }

    /** text of the first child element of that name, or null if there is none */
    @Nullable
    public static String findText(Element parent, String name) {
        Element child = findChild(parent, name);
        return child==null ? null : child.getTextContent();
    }

    /** true if the child element is present and not marked for deletion */
    public static boolean isSet(Element parent, String name) {
        Element child = findChild(parent, name);
        return child!=null && !child.hasAttribute(DELETE);
    }

    public static Element subElement(Element parent, String name) {
        Element child = parent.getOwnerDocument().createElement(name);
        parent.appendChild(child);
        return child;
    }

    public static Element subElement(Element parent, String name, String text) {
        Element child = subElement(parent, name);
        child.setTextContent(text);
        return child;
    }

    /** appends an element carrying the {@link #DELETE} marker */
    public static Element deleteElement(Element parent, String name) {
        Element child = subElement(parent, name);
        child.setAttribute(DELETE, DELETE);
        return child;
    }

    /**
     * Walks a path of child element names from <code>root</code>, creating what is missing.
     * A step may select by the text of a child, as in <code>interface[name='ge-0/0/0']/unit</code>;
     * when no such element exists one is created with that child.
     *
     * @throws IllegalArgumentException if the path cannot be read
     */
    public static Element findOrCreate(Element root, String path) {
        Matcher m = STEP.matcher(path);
        Element element = root;
        int pos = 0;
        while (pos < path.length()) {
            m.region(pos, path.length());
            if (!m.lookingAt()) {
                throw new IllegalArgumentException("Invalid path "+path+" at position "+pos);
            }
            String name = m.group(1);
            String keyName = m.group(2);
            Element found = null;
            if (keyName==null) {
                found = findChild(element, name);
            } else {
                for (Element candidate: children(element, name)) {
                    if (m.group(3).equals(findText(candidate, keyName))) {
                        found = candidate;
                        break;
                    }
                }
            }
            if (found==null) {
                found = subElement(element, name);
                if (keyName!=null) subElement(found, keyName, m.group(3));
            }
            element = found;
            pos = m.end();
        }
        return element;
    }

    /** indented rendering of the node, without XML declaration */
    public static String toString(Node node) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "4");
            StringWriter out = new StringWriter();
            transformer.transform(new DOMSource(node), new StreamResult(out));
            return out.toString();
        } catch (TransformerException e) {
            throw new IllegalStateException("Cannot render XML", e);
        }
    }

    private static void stripWhitespace(Node node) {
        Node child = node.getFirstChild();
        while (child!=null) {
            Node next = child.getNextSibling();
            if (child.getNodeType()==Node.TEXT_NODE && child.getTextContent().trim().isEmpty()) {
                node.removeChild(child);
            } else if (child.getNodeType()==Node.ELEMENT_NODE) {
                stripWhitespace(child);
            }
            child = next;
        }
    }

}
