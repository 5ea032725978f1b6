package com.sharedsource.webapi.codec;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.XMLReader;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParserFactory;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Parses an XML document into a Gson tree so XML bodies bind through the same type adapters as JSON.
 *
 * <p>Mapping rules:
 * <ul>
 *   <li>The root element becomes the top level value, its own name is dropped.</li>
 *   <li>Attributes and child elements become object members, named as in the document.</li>
 *   <li>Repeated sibling elements with the same name become an array.</li>
 *   <li>Leaf elements become string primitives, empty leaf elements become null.</li>
 *   <li>Text of an element that also has attributes or children is kept under {@link #TEXT_MEMBER}.</li>
 * </ul>
 *
 * <p>Document type declarations are rejected.
 */
public final class XmlTreeParser {

    /**
     * Member holding the text of elements that also carry attributes or children.
     */
    public static final String TEXT_MEMBER = "#text";

    /**
     * Private constructor.
     */
    private XmlTreeParser() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Parses XML into a JsonElement.
     *
     * @param xml XML string.
     * @return JsonElement.
     * @throws IOException If the document is not well formed.
     */
    public static JsonElement parse(String xml) throws IOException {
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setValidating(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            XMLReader reader = factory.newSAXParser().getXMLReader();

            TreeHandler handler = new TreeHandler();
            reader.setContentHandler(handler);
            reader.setErrorHandler(handler);
            reader.parse(new InputSource(new StringReader(xml)));

            return handler.getRoot();
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("XML parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * SAX content handler building the tree.
     */
    private static class TreeHandler extends DefaultHandler {

        private final Deque<Frame> stack = new ArrayDeque<>();
        private JsonElement root = JsonNull.INSTANCE;

        JsonElement getRoot() {
            return root;
        }

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes) {
            Frame frame = new Frame(name(localName, qName));
            for (int i = 0; i < attributes.getLength(); i++) {
                frame.object.addProperty(name(attributes.getLocalName(i), attributes.getQName(i)), attributes.getValue(i));
            }
            stack.push(frame);
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            if (!stack.isEmpty()) {
                stack.peek().text.append(ch, start, length);
            }
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            Frame frame = stack.pop();
            JsonElement value = frame.toElement();

            if (stack.isEmpty()) {
                root = value;
                return;
            }

            JsonObject parent = stack.peek().object;
            JsonElement existing = parent.get(frame.name);
            if (existing == null) {
                parent.add(frame.name, value);
            } else if (existing.isJsonArray()) {
                existing.getAsJsonArray().add(value);
            } else {
                JsonArray array = new JsonArray();
                array.add(existing);
                array.add(value);
                parent.add(frame.name, array);
            }
        }

        private static String name(String localName, String qName) {
            return localName != null && !localName.isEmpty() ? localName : qName;
        }
    }

    /**
     * Element under construction.
     */
    private static class Frame {
        private final String name;
        private final JsonObject object = new JsonObject();
        private final StringBuilder text = new StringBuilder();

        Frame(String name) {
            this.name = name;
        }

        JsonElement toElement() {
            String value = text.toString().trim();

            if (object.size() > 0) {
                if (!value.isEmpty()) {
                    object.addProperty(TEXT_MEMBER, value);
                }
                return object;
            }

            return value.isEmpty() ? JsonNull.INSTANCE : new JsonPrimitive(value);
        }
    }
}
