package com.pywire.parser.loader;

import com.pywire.parser.loader.ast.AttributeNode;
import com.pywire.parser.loader.ast.PlainAttributeNode;
import com.pywire.parser.loader.ast.ShorthandAttributeNode;
import com.pywire.parser.loader.ast.SpreadAttributeNode;
import com.pywire.parser.loader.cst.SyntaxKind;
import com.pywire.parser.loader.cst.SyntaxNode;

/** Maps an {@code attribute} CST node to a plain, shorthand or spread attribute. */
final class AttributeParser {

    private AttributeParser() {}

    static AttributeNode parse(SyntaxNode attribute, String source) {
        for (SyntaxNode child : attribute.getChildren()) {
            if (child.isKind(SyntaxKind.ATTRIBUTE_SHORTHAND)) {
                String text = child.text(source);
                String inner = UnicodeWhitespace.strip(stripBraces(text));
                // The grammar can report {**expr} as a shorthand.
                if (inner.startsWith("**")) {
                    return new SpreadAttributeNode(text);
                }
                return new ShorthandAttributeNode(inner, text);
            }
            if (child.isKind(SyntaxKind.SPREAD_SHORTHAND)) {
                return new SpreadAttributeNode(child.text(source));
            }
        }

        SyntaxNode nameNode = attribute.getField(SyntaxKind.FIELD_NAME);
        SyntaxNode valueNode = attribute.getField(SyntaxKind.FIELD_VALUE);
        String name = nameNode == null ? "" : nameNode.text(source);
        String value = valueNode == null ? null : unquote(valueNode.text(source));
        return new PlainAttributeNode(name, value);
    }

    /** Removes one pair of surrounding quotes when both ends carry the same quote character. */
    static String unquote(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return text.substring(1, text.length() - 1);
            }
        }
        return text;
    }

    private static String stripBraces(String text) {
        int start = text.startsWith("{") ? 1 : 0;
        int end = text.endsWith("}") && text.length() > start ? text.length() - 1 : text.length();
        return text.substring(start, end);
    }
}
