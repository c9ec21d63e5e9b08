package com.pywire.parser.loader;

import com.pywire.parser.loader.ast.SourcePosition;
import com.pywire.parser.loader.ast.TemplateNode;
import com.pywire.parser.loader.cst.SyntaxKind;
import com.pywire.parser.loader.cst.SyntaxNode;

/**
 * Copies the unparsed body of a script or style element: the text between the end of the opening
 * tag's {@code >} and the start of the closing tag. Only direct children are scanned.
 */
final class RawRegionExtractor {

    private RawRegionExtractor() {}

    /** Returns the raw body node, or {@code null} when either boundary is missing or the body is empty. */
    static TemplateNode extract(SyntaxNode element, String source, SourcePosition position) {
        int start = -1;
        int end = -1;
        for (SyntaxNode child : element.getChildren()) {
            if (child.isKind(SyntaxKind.TAG_CLOSE)) {
                start = child.getEndOffset();
            } else if (child.isKind(SyntaxKind.SCRIPT_END) || child.isKind(SyntaxKind.STYLE_END)) {
                end = child.getStartOffset();
            }
        }
        if (start < 0 || end <= start) {
            return null;
        }
        return TemplateNode.rawText(source.substring(start, end), position);
    }
}
