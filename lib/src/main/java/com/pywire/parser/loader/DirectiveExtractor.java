package com.pywire.parser.loader;

import com.pywire.parser.loader.ast.DirectiveNode;
import com.pywire.parser.loader.cst.SyntaxNode;

/** Splits a {@code !name content} directive line into its name and trimmed content. */
final class DirectiveExtractor {

    private DirectiveExtractor() {}

    static DirectiveNode extract(SyntaxNode node, String source) {
        String text = UnicodeWhitespace.strip(node.text(source));
        if (text.startsWith("!")) {
            text = text.substring(1);
        }
        int nameEnd = 0;
        while (nameEnd < text.length()) {
            int codePoint = text.codePointAt(nameEnd);
            if (!Character.isLetterOrDigit(codePoint) && codePoint != '_') {
                break;
            }
            nameEnd += Character.charCount(codePoint);
        }
        String name = text.substring(0, nameEnd);
        String content = UnicodeWhitespace.strip(text.substring(nameEnd));
        return new DirectiveNode(
                name, content.isEmpty() ? null : content, TemplateNodeBuilder.positionOf(node));
    }
}
