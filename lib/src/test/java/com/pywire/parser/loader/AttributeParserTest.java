package com.pywire.parser.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.pywire.parser.loader.ast.AttributeNode;
import com.pywire.parser.loader.ast.PlainAttributeNode;
import com.pywire.parser.loader.ast.ShorthandAttributeNode;
import com.pywire.parser.loader.ast.SpreadAttributeNode;
import com.pywire.parser.loader.cst.CstNode;
import com.pywire.parser.loader.cst.SyntaxKind;
import org.junit.jupiter.api.Test;

class AttributeParserTest {

    private static AttributeNode plain(String source, String name, String value) {
        CstFixture fixture = new CstFixture(source);
        CstNode.Builder attribute =
                fixture.node(SyntaxKind.ATTRIBUTE, 0, source.length())
                        .field(SyntaxKind.FIELD_NAME, fixture.leaf(SyntaxKind.ATTRIBUTE_NAME, name));
        if (value != null) {
            int equals = fixture.offsetOf("=");
            attribute.child(fixture.leaf("=", "="));
            attribute.field(SyntaxKind.FIELD_VALUE, fixture.leaf(SyntaxKind.ATTRIBUTE_VALUE, value, equals));
        }
        return AttributeParser.parse(attribute.build(), source);
    }

    private static AttributeNode wrapped(String kind, String source) {
        CstFixture fixture = new CstFixture(source);
        CstNode attribute =
                fixture.node(SyntaxKind.ATTRIBUTE, 0, source.length())
                        .child(fixture.leaf(kind, source))
                        .build();
        return AttributeParser.parse(attribute, source);
    }

    @Test
    void doubleQuotedValueLosesQuotes() {
        PlainAttributeNode attribute =
                assertInstanceOf(PlainAttributeNode.class, plain("class=\"btn primary\"", "class", "\"btn primary\""));

        assertEquals("class", attribute.getName());
        assertEquals("btn primary", attribute.getValue());
        assertEquals("class", attribute.getKey());
    }

    @Test
    void singleQuotedValueLosesQuotes() {
        assertEquals("it's", plain("title='it's'", "title", "'it's'").getValue());
    }

    @Test
    void mismatchedQuotesAreKept() {
        assertEquals("\"x'", plain("data-x=\"x'", "data-x", "\"x'").getValue());
    }

    @Test
    void braceValueIsKeptVerbatim() {
        assertEquals("{handle_click}", plain("@click={handle_click}", "@click", "{handle_click}").getValue());
    }

    @Test
    void attributeWithoutValueIsBoolean() {
        PlainAttributeNode attribute =
                assertInstanceOf(PlainAttributeNode.class, plain("disabled", "disabled", null));

        assertTrue(attribute.isBoolean());
        assertNull(attribute.getValue());
    }

    @Test
    void attributeWithoutNameFieldHasEmptyName() {
        String source = "=\"x\"";
        CstFixture fixture = new CstFixture(source);
        CstNode attribute =
                fixture.node(SyntaxKind.ATTRIBUTE, 0, source.length())
                        .field(SyntaxKind.FIELD_VALUE, fixture.leaf(SyntaxKind.ATTRIBUTE_VALUE, "\"x\""))
                        .build();

        PlainAttributeNode parsed = assertInstanceOf(PlainAttributeNode.class, AttributeParser.parse(attribute, source));
        assertEquals("", parsed.getName());
        assertEquals("x", parsed.getValue());
    }

    @Test
    void shorthandKeepsBracketedText() {
        ShorthandAttributeNode attribute =
                assertInstanceOf(
                        ShorthandAttributeNode.class, wrapped(SyntaxKind.ATTRIBUTE_SHORTHAND, "{ value }"));

        assertEquals("value", attribute.getName());
        assertEquals("{ value }", attribute.getSourceText());
        assertEquals("__pw_sh_value", attribute.getKey());
        assertEquals("{ value }", attribute.getValue());
    }

    @Test
    void spreadShorthandUsesReservedKey() {
        SpreadAttributeNode attribute =
                assertInstanceOf(SpreadAttributeNode.class, wrapped(SyntaxKind.SPREAD_SHORTHAND, "{**attrs}"));

        assertEquals(AttributeNode.SPREAD_KEY, attribute.getKey());
        assertEquals("{**attrs}", attribute.getValue());
        assertEquals("attrs", attribute.getExpression());
    }

    @Test
    void spreadReportedAsShorthandIsNormalizedToSpread() {
        SpreadAttributeNode attribute =
                assertInstanceOf(SpreadAttributeNode.class, wrapped(SyntaxKind.ATTRIBUTE_SHORTHAND, "{**props}"));

        assertEquals("__pywire_spread__", attribute.getKey());
        assertEquals("{**props}", attribute.getValue());
    }

    @Test
    void unquoteLeavesShortTextAlone() {
        assertEquals("\"", AttributeParser.unquote("\""));
        assertEquals("", AttributeParser.unquote("\"\""));
        assertEquals("plain", AttributeParser.unquote("plain"));
    }
}
