package com.sharedsource.webapi.codec;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class XmlTreeParserTest {

    @Test
    void testRootNameDropped() throws IOException {
        JsonElement tree = XmlTreeParser.parse("<PublicKey><Modulus>abc</Modulus><Exponent>AQAB</Exponent></PublicKey>");

        assertTrue(tree.isJsonObject());
        assertEquals("abc", tree.getAsJsonObject().get("Modulus").getAsString());
        assertEquals("AQAB", tree.getAsJsonObject().get("Exponent").getAsString());
        assertNull(tree.getAsJsonObject().get("PublicKey"));
    }

    @Test
    void testRepeatedElementsBecomeArray() throws IOException {
        JsonObject tree = XmlTreeParser.parse("<r><items><item>a</item><item>b</item><item>c</item></items></r>")
                .getAsJsonObject();

        JsonElement items = tree.getAsJsonObject("items").get("item");
        assertTrue(items.isJsonArray());
        assertEquals(3, items.getAsJsonArray().size());
        assertEquals("c", items.getAsJsonArray().get(2).getAsString());
    }

    @Test
    void testAttributesAndEmptyElements() throws IOException {
        JsonObject tree = XmlTreeParser.parse("<r><field Name=\"Title\" Type=\"Single-Line Text\"/><empty></empty></r>")
                .getAsJsonObject();

        assertEquals("Title", tree.getAsJsonObject("field").get("Name").getAsString());
        assertEquals("Single-Line Text", tree.getAsJsonObject("field").get("Type").getAsString());
        assertTrue(tree.get("empty").isJsonNull());
    }

    @Test
    void testTextNextToAttributesKept() throws IOException {
        JsonObject tree = XmlTreeParser.parse("<r><field Name=\"Title\">Welcome</field><wrapper>\n  <child>x</child>\n</wrapper></r>")
                .getAsJsonObject();

        JsonObject field = tree.getAsJsonObject("field");
        assertEquals("Title", field.get("Name").getAsString());
        assertEquals("Welcome", field.get(XmlTreeParser.TEXT_MEMBER).getAsString());

        // Indentation between children is not text.
        assertNull(tree.getAsJsonObject("wrapper").get(XmlTreeParser.TEXT_MEMBER));
    }

    @Test
    void testMalformed() {
        assertThrows(IOException.class, () -> XmlTreeParser.parse("<r><unclosed></r>"));
    }

    @Test
    void testDoctypeRejected() {
        String xml = "<?xml version=\"1.0\"?><!DOCTYPE r [<!ENTITY x SYSTEM \"file:///etc/passwd\">]><r>&x;</r>";

        assertThrows(IOException.class, () -> XmlTreeParser.parse(xml));
    }
}
