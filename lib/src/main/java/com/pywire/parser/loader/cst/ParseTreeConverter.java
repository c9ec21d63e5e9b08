package com.pywire.parser.loader.cst;

import com.pywire.parser.loader.grammar.PyWireLexer;
import com.pywire.parser.loader.grammar.PyWireParser;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Converts an ANTLR parse tree into {@link CstNode}s. Wrapper rules without a kind are spliced into
 * their parent, EOF and tokens conjured during error recovery are dropped, and tokens skipped by
 * recovery become {@link SyntaxKind#ERROR} nodes.
 */
final class ParseTreeConverter {
    private static final String[] RULE_KINDS = ruleKinds();
    private static final Map<Integer, String> TOKEN_KINDS = tokenKinds();

    private final String source;
    private final LineIndex lineIndex;
    private final int[] charOffsets;
    private final Map<ParseTree, SyntaxNode> converted = new IdentityHashMap<>();

    ParseTreeConverter(String source) {
        this.source = source;
        this.lineIndex = new LineIndex(source);
        this.charOffsets = codePointToCharOffsets(source);
    }

    SyntaxNode convert(PyWireParser.DocumentContext document) {
        List<SyntaxNode> nodes = convertTree(document);
        if (nodes.size() != 1) {
            throw new IllegalStateException("document rule must convert to a single node");
        }
        return nodes.get(0);
    }

    private List<SyntaxNode> convertTree(ParseTree tree) {
        if (tree instanceof TerminalNode) {
            SyntaxNode node = convertTerminal((TerminalNode) tree);
            return node == null ? List.of() : List.of(node);
        }
        ParserRuleContext context = (ParserRuleContext) tree;
        List<SyntaxNode> children = new ArrayList<>();
        for (int i = 0; i < context.getChildCount(); i++) {
            children.addAll(convertTree(context.getChild(i)));
        }
        String kind = RULE_KINDS[context.getRuleIndex()];
        if (kind == null) {
            return children;
        }

        int start;
        int end;
        if (children.isEmpty()) {
            start = context.getStart() != null && context.getStart().getStartIndex() >= 0
                    ? toCharOffset(context.getStart().getStartIndex())
                    : 0;
            end = start;
        } else {
            start = children.get(0).getStartOffset();
            end = children.get(children.size() - 1).getEndOffset();
        }
        CstNode.Builder builder = CstNode.builder(kind).span(lineIndex, start, end).children(children);
        registerFields(context, builder);
        CstNode node = builder.build();
        converted.put(context, node);
        return List.of(node);
    }

    private SyntaxNode convertTerminal(TerminalNode terminal) {
        Token token = terminal.getSymbol();
        if (token.getType() == Token.EOF || token.getTokenIndex() < 0 || token.getStartIndex() < 0) {
            return null;
        }
        String kind = terminal instanceof ErrorNode ? SyntaxKind.ERROR : tokenKind(token.getType());
        int start = toCharOffset(token.getStartIndex());
        int end = toCharOffset(token.getStopIndex() + 1);
        CstNode node = CstNode.builder(kind).span(lineIndex, start, end).build();
        converted.put(terminal, node);
        return node;
    }

    private void registerFields(ParserRuleContext context, CstNode.Builder builder) {
        if (context instanceof PyWireParser.TagContext) {
            registerToken(builder, SyntaxKind.FIELD_START_TAG, context, ((PyWireParser.TagContext) context).start_tag);
        } else if (context instanceof PyWireParser.SelfClosingTagContext) {
            registerToken(
                    builder,
                    SyntaxKind.FIELD_START_TAG,
                    context,
                    ((PyWireParser.SelfClosingTagContext) context).start_tag);
        } else if (context instanceof PyWireParser.VoidTagContext) {
            registerToken(
                    builder, SyntaxKind.FIELD_START_TAG, context, ((PyWireParser.VoidTagContext) context).start_tag);
        } else if (context instanceof PyWireParser.ScriptTagContext) {
            registerToken(
                    builder, SyntaxKind.FIELD_START_TAG, context, ((PyWireParser.ScriptTagContext) context).start_tag);
        } else if (context instanceof PyWireParser.StyleTagContext) {
            registerToken(
                    builder, SyntaxKind.FIELD_START_TAG, context, ((PyWireParser.StyleTagContext) context).start_tag);
        } else if (context instanceof PyWireParser.AttributeContext) {
            PyWireParser.AttributeContext attribute = (PyWireParser.AttributeContext) context;
            registerToken(builder, SyntaxKind.FIELD_NAME, context, attribute.name);
            registerTree(builder, SyntaxKind.FIELD_VALUE, attribute.value);
        } else if (context instanceof PyWireParser.InterpolationContext) {
            registerToken(
                    builder, SyntaxKind.FIELD_EXPR, context, ((PyWireParser.InterpolationContext) context).expr);
        } else if (context instanceof PyWireParser.FrontmatterContext) {
            registerTree(
                    builder,
                    SyntaxKind.FIELD_PYTHON_CONTENT,
                    ((PyWireParser.FrontmatterContext) context).python_content);
        }
    }

    private void registerToken(CstNode.Builder builder, String field, ParserRuleContext owner, Token token) {
        if (token == null) {
            return;
        }
        for (int i = 0; i < owner.getChildCount(); i++) {
            ParseTree child = owner.getChild(i);
            if (child instanceof TerminalNode && ((TerminalNode) child).getSymbol() == token) {
                registerTree(builder, field, child);
                return;
            }
        }
    }

    private void registerTree(CstNode.Builder builder, String field, ParseTree tree) {
        if (tree == null) {
            return;
        }
        SyntaxNode node = converted.get(tree);
        if (node != null) {
            builder.fieldRef(field, node);
        }
    }

    private int toCharOffset(int codePointIndex) {
        if (charOffsets == null) {
            return Math.min(codePointIndex, source.length());
        }
        return charOffsets[Math.min(codePointIndex, charOffsets.length - 1)];
    }

    private static int[] codePointToCharOffsets(String source) {
        int codePoints = source.codePointCount(0, source.length());
        if (codePoints == source.length()) {
            return null;
        }
        int[] offsets = new int[codePoints + 1];
        int charIndex = 0;
        for (int i = 0; i < codePoints; i++) {
            offsets[i] = charIndex;
            charIndex += Character.charCount(source.codePointAt(charIndex));
        }
        offsets[codePoints] = source.length();
        return offsets;
    }

    private static String tokenKind(int type) {
        String kind = TOKEN_KINDS.get(type);
        if (kind != null) {
            return kind;
        }
        String symbolic = PyWireLexer.VOCABULARY.getSymbolicName(type);
        return symbolic == null ? "#" + type : symbolic.toLowerCase(Locale.ROOT);
    }

    private static String[] ruleKinds() {
        String[] kinds = new String[PyWireParser.ruleNames.length];
        kinds[PyWireParser.RULE_document] = SyntaxKind.DOCUMENT;
        kinds[PyWireParser.RULE_directivesSection] = SyntaxKind.DIRECTIVES_SECTION;
        kinds[PyWireParser.RULE_frontmatter] = SyntaxKind.FRONTMATTER;
        kinds[PyWireParser.RULE_pythonContent] = SyntaxKind.PYTHON_CONTENT;
        kinds[PyWireParser.RULE_templateSection] = SyntaxKind.TEMPLATE_SECTION;
        kinds[PyWireParser.RULE_tag] = SyntaxKind.TAG;
        kinds[PyWireParser.RULE_selfClosingTag] = SyntaxKind.SELF_CLOSING_TAG;
        kinds[PyWireParser.RULE_voidTag] = SyntaxKind.VOID_TAG;
        kinds[PyWireParser.RULE_scriptTag] = SyntaxKind.SCRIPT_TAG;
        kinds[PyWireParser.RULE_styleTag] = SyntaxKind.STYLE_TAG;
        kinds[PyWireParser.RULE_rawText] = SyntaxKind.RAW_TEXT;
        kinds[PyWireParser.RULE_attribute] = SyntaxKind.ATTRIBUTE;
        kinds[PyWireParser.RULE_attributeShorthand] = SyntaxKind.ATTRIBUTE_SHORTHAND;
        kinds[PyWireParser.RULE_spreadShorthand] = SyntaxKind.SPREAD_SHORTHAND;
        kinds[PyWireParser.RULE_attributeValue] = SyntaxKind.ATTRIBUTE_VALUE;
        kinds[PyWireParser.RULE_interpolation] = SyntaxKind.INTERPOLATION;
        // templateNode and element are wrappers and stay transparent.
        return kinds;
    }

    private static Map<Integer, String> tokenKinds() {
        return Map.ofEntries(
                Map.entry(PyWireLexer.DIRECTIVE, SyntaxKind.DIRECTIVE),
                Map.entry(PyWireLexer.PY_LINE, SyntaxKind.PYTHON_LINE),
                Map.entry(PyWireLexer.TEMPLATE_OPEN, "---html---"),
                Map.entry(PyWireLexer.FENCE_OPEN, "---"),
                Map.entry(PyWireLexer.FENCE_CLOSE, "---"),
                Map.entry(PyWireLexer.TEXT, SyntaxKind.TEXT),
                Map.entry(PyWireLexer.HYPHEN, SyntaxKind.HYPHEN),
                Map.entry(PyWireLexer.BANG, SyntaxKind.BANG),
                Map.entry(PyWireLexer.COMMENT, SyntaxKind.COMMENT),
                Map.entry(PyWireLexer.DOCTYPE, SyntaxKind.DOCTYPE),
                Map.entry(PyWireLexer.BRACE_BLOCK, SyntaxKind.BRACE_BLOCK),
                Map.entry(PyWireLexer.END_BRACE_BLOCK, SyntaxKind.END_BRACE_BLOCK),
                Map.entry(PyWireLexer.TAG_START, SyntaxKind.START_TAG),
                Map.entry(PyWireLexer.VOID_TAG_START, SyntaxKind.START_TAG),
                Map.entry(PyWireLexer.SCRIPT_START, SyntaxKind.START_TAG),
                Map.entry(PyWireLexer.STYLE_START, SyntaxKind.START_TAG),
                Map.entry(PyWireLexer.END_TAG, SyntaxKind.END_TAG),
                Map.entry(PyWireLexer.TAG_CLOSE, SyntaxKind.TAG_CLOSE),
                Map.entry(PyWireLexer.TAG_SELF_CLOSE, SyntaxKind.TAG_SELF_CLOSE),
                Map.entry(PyWireLexer.SCRIPT_END, SyntaxKind.SCRIPT_END),
                Map.entry(PyWireLexer.STYLE_END, SyntaxKind.STYLE_END),
                Map.entry(PyWireLexer.ATTR_NAME, SyntaxKind.ATTRIBUTE_NAME),
                Map.entry(PyWireLexer.ATTR_EQUALS, "="),
                Map.entry(PyWireLexer.INTERPOLATION_OPEN, "{"),
                Map.entry(PyWireLexer.INTERPOLATION_CLOSE, "}"),
                Map.entry(PyWireLexer.EXPR_TEXT, SyntaxKind.EXPRESSION));
    }
}
