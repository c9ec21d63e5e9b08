package com.pywire.parser.loader;

import com.pywire.parser.loader.ast.SourcePosition;
import com.pywire.parser.loader.ast.TemplateNode;
import com.pywire.parser.loader.cst.SyntaxKind;
import com.pywire.parser.loader.cst.SyntaxNode;
import java.util.Set;

/** Recursively maps template CST nodes to {@link TemplateNode}s. */
final class TemplateNodeBuilder {
    static final Set<String> ELEMENT_KINDS =
            Set.of(
                    SyntaxKind.TAG,
                    SyntaxKind.SELF_CLOSING_TAG,
                    SyntaxKind.VOID_TAG,
                    SyntaxKind.SCRIPT_TAG,
                    SyntaxKind.STYLE_TAG);

    /** Kinds mapped at the top of the template section; everything else there is dropped. */
    static final Set<String> TOP_LEVEL_KINDS =
            Set.of(
                    SyntaxKind.TAG,
                    SyntaxKind.SELF_CLOSING_TAG,
                    SyntaxKind.VOID_TAG,
                    SyntaxKind.SCRIPT_TAG,
                    SyntaxKind.STYLE_TAG,
                    SyntaxKind.TEXT,
                    SyntaxKind.INTERPOLATION,
                    SyntaxKind.BRACE_BLOCK,
                    SyntaxKind.END_BRACE_BLOCK,
                    SyntaxKind.DOCTYPE,
                    SyntaxKind.HYPHEN,
                    SyntaxKind.BANG);

    /** Kinds mapped inside a non-raw element; everything else there is dropped. */
    static final Set<String> CHILD_KINDS =
            Set.of(
                    SyntaxKind.TAG,
                    SyntaxKind.SELF_CLOSING_TAG,
                    SyntaxKind.VOID_TAG,
                    SyntaxKind.SCRIPT_TAG,
                    SyntaxKind.STYLE_TAG,
                    SyntaxKind.TEXT,
                    SyntaxKind.INTERPOLATION,
                    SyntaxKind.BRACE_BLOCK,
                    SyntaxKind.END_BRACE_BLOCK,
                    SyntaxKind.ERROR,
                    SyntaxKind.HYPHEN,
                    SyntaxKind.BANG,
                    SyntaxKind.COMMENT);

    private static final Set<String> TEXT_KINDS =
            Set.of(SyntaxKind.TEXT, SyntaxKind.PYTHON_LINE, SyntaxKind.HYPHEN, SyntaxKind.BANG, SyntaxKind.ERROR);

    private final String sourceName;
    private final String source;
    private final int maxNestingDepth;

    TemplateNodeBuilder(String sourceName, String source, int maxNestingDepth) {
        this.sourceName = sourceName;
        this.source = source;
        this.maxNestingDepth = maxNestingDepth;
    }

    static SourcePosition positionOf(SyntaxNode node) {
        return new SourcePosition(node.getStartRow() + 1, node.getStartColumn());
    }

    TemplateNode build(SyntaxNode node) throws TemplateNestingException {
        return build(node, 0);
    }

    private TemplateNode build(SyntaxNode node, int enclosingDepth) throws TemplateNestingException {
        SourcePosition position = positionOf(node);
        TemplateNode.Builder builder = TemplateNode.builder(position);
        String kind = node.getKind();

        if (ELEMENT_KINDS.contains(kind)) {
            int depth = enclosingDepth + 1;
            if (depth > maxNestingDepth) {
                throw new TemplateNestingException(sourceName, maxNestingDepth, position.getLine());
            }
            buildElement(node, kind, depth, builder);
        } else if (SyntaxKind.BRACE_BLOCK.equals(kind)) {
            BlockMarkerClassifier.BlockMarker marker = BlockMarkerClassifier.classifyOpener(node.text(source));
            builder.block(marker.keyword(), marker.expression());
        } else if (SyntaxKind.END_BRACE_BLOCK.equals(kind)) {
            BlockMarkerClassifier.BlockMarker marker = BlockMarkerClassifier.classifyCloser(node.text(source));
            builder.block(marker.keyword(), marker.expression());
        } else if (SyntaxKind.INTERPOLATION.equals(kind)) {
            SyntaxNode expr = node.getField(SyntaxKind.FIELD_EXPR);
            builder.block(TemplateNode.INTERPOLATION_KEYWORD, expr == null ? null : expr.text(source));
        } else if (TEXT_KINDS.contains(kind)) {
            builder.textContent(node.text(source));
        }
        // Any other kind (comment, doctype) stays an empty placeholder.
        return builder.build();
    }

    private void buildElement(SyntaxNode node, String kind, int depth, TemplateNode.Builder builder)
            throws TemplateNestingException {
        builder.tag(tagName(node, kind));
        boolean raw = SyntaxKind.SCRIPT_TAG.equals(kind) || SyntaxKind.STYLE_TAG.equals(kind);
        if (raw) {
            TemplateNode body = RawRegionExtractor.extract(node, source, positionOf(node));
            if (body != null) {
                builder.child(body);
            }
        }
        for (SyntaxNode child : node.getChildren()) {
            if (child.isKind(SyntaxKind.ATTRIBUTE)) {
                builder.attribute(AttributeParser.parse(child, source));
            } else if (!raw && CHILD_KINDS.contains(child.getKind())) {
                builder.child(build(child, depth));
            }
        }
    }

    private String tagName(SyntaxNode node, String kind) {
        SyntaxNode name = node.getField(SyntaxKind.FIELD_NAME);
        if (name != null) {
            return name.text(source);
        }
        SyntaxNode startTag = node.getField(SyntaxKind.FIELD_START_TAG);
        if (startTag != null) {
            String text = startTag.text(source);
            return text.startsWith("<") ? text.substring(1) : null;
        }
        if (SyntaxKind.SCRIPT_TAG.equals(kind)) {
            return "script";
        }
        if (SyntaxKind.STYLE_TAG.equals(kind)) {
            return "style";
        }
        return null;
    }
}
