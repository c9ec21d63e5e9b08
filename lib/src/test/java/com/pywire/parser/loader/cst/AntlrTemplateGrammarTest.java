package com.pywire.parser.loader.cst;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.pywire.parser.loader.ParserSettings;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AntlrTemplateGrammarTest {

    private static SyntaxTree parse(String source) throws Exception {
        return new AntlrTemplateGrammar().newParser(ParserSettings.defaults()).parse("test.wire", source);
    }

    private static List<String> kinds(SyntaxNode node) {
        List<String> kinds = new ArrayList<>();
        for (SyntaxNode child : node.getChildren()) {
            kinds.add(child.getKind());
        }
        return kinds;
    }

    @Test
    void exposesTreeSitterStyleKinds() throws Exception {
        SyntaxTree tree = parse("!path /\n---\nx = 1\n---\n<p class=\"a\">{x}</p>");
        SyntaxNode root = tree.getRoot();

        assertEquals(SyntaxKind.DOCUMENT, root.getKind());
        assertFalse(tree.hasErrors());
        assertEquals(
                List.of(SyntaxKind.DIRECTIVES_SECTION, SyntaxKind.FRONTMATTER, SyntaxKind.TEMPLATE_SECTION),
                kinds(root));

        SyntaxNode frontmatter = root.getChildren().get(1);
        assertEquals(List.of("---", SyntaxKind.PYTHON_CONTENT, "---"), kinds(frontmatter));
        assertEquals("x = 1", frontmatter.getField(SyntaxKind.FIELD_PYTHON_CONTENT).text(tree.getSource()));

        SyntaxNode paragraph = root.getChildren().get(2).getChildren().get(0);
        assertEquals(SyntaxKind.TAG, paragraph.getKind());
        assertEquals(
                List.of(
                        SyntaxKind.START_TAG,
                        SyntaxKind.ATTRIBUTE,
                        SyntaxKind.TAG_CLOSE,
                        SyntaxKind.INTERPOLATION,
                        SyntaxKind.END_TAG),
                kinds(paragraph));
        assertEquals("<p", paragraph.getField(SyntaxKind.FIELD_START_TAG).text(tree.getSource()));

        SyntaxNode attribute = paragraph.getChildren().get(1);
        assertEquals("class", attribute.getField(SyntaxKind.FIELD_NAME).text(tree.getSource()));
        assertEquals("\"a\"", attribute.getField(SyntaxKind.FIELD_VALUE).text(tree.getSource()));

        SyntaxNode interpolation = paragraph.getChildren().get(3);
        assertEquals(List.of("{", SyntaxKind.EXPRESSION, "}"), kinds(interpolation));
        assertEquals("x", interpolation.getField(SyntaxKind.FIELD_EXPR).text(tree.getSource()));
    }

    @Test
    void rangesAndPositionsUseCharOffsets() throws Exception {
        String source = "---html---\n<p>😀 hi</p>";
        SyntaxTree tree = parse(source);

        SyntaxNode paragraph = tree.getRoot().getChildren().get(0).getChildren().get(1);
        SyntaxNode text = paragraph.getChildren().get(2);
        assertEquals(SyntaxKind.TEXT, text.getKind());
        assertEquals("😀 hi", text.text(source));
        assertEquals(1, text.getStartRow());
        assertEquals(3, text.getStartColumn());
        assertEquals("</p>", paragraph.getChildren().get(3).text(source));
        assertEquals(source.length(), tree.getRoot().getEndOffset());
    }

    @Test
    void skippedTokensBecomeErrorNodes() throws Exception {
        SyntaxTree tree = parse("---html---\n<p>a < b</p>");
        SyntaxNode paragraph = tree.getRoot().getChildren().get(0).getChildren().get(1);

        assertTrue(tree.hasErrors());
        ParseDiagnostic diagnostic = tree.getDiagnostics().get(0);
        assertEquals(ParseDiagnostic.Level.WARNING, diagnostic.getLevel());
        assertEquals("test.wire", diagnostic.getSourceName());
        assertEquals(2, diagnostic.getLine());
        assertEquals(5, diagnostic.getColumn());
        assertTrue(kinds(paragraph).contains(SyntaxKind.ERROR));
    }

    @Test
    void interpolationWithoutExpressionHasNoExprField() throws Exception {
        SyntaxTree tree = parse("---html---\n{}");
        SyntaxNode interpolation = tree.getRoot().getChildren().get(0).getChildren().get(1);

        assertEquals(SyntaxKind.INTERPOLATION, interpolation.getKind());
        assertNull(interpolation.getField(SyntaxKind.FIELD_EXPR));
    }

    @Test
    void emptySourceYieldsEmptyDocument() throws Exception {
        SyntaxTree tree = parse("");

        assertEquals(SyntaxKind.DOCUMENT, tree.getRoot().getKind());
        assertTrue(tree.getRoot().getChildren().isEmpty());
        assertFalse(tree.hasErrors());
    }

    @Test
    void debugFlagsCaptureTokensAndTree() throws Exception {
        System.setProperty("pywire.parser.debugTokens", "true");
        System.setProperty("pywire.parser.debugTree", "true");
        try {
            DebugFlags.drainCapturedTokens();
            DebugFlags.drainCapturedTree();
            parse("---html---\n<b>x</b>");

            List<String> tokens = DebugFlags.drainCapturedTokens();
            List<String> tree = DebugFlags.drainCapturedTree();
            assertNotNull(tokens);
            assertTrue(tokens.get(0).startsWith("TEMPLATE_OPEN"), tokens.get(0));
            assertTrue(tree.get(0).startsWith("document @ 1:0"), tree.get(0));
            assertTrue(tree.contains("    tag @ 2:0 - '<b>x</b>'"), String.join("\n", tree));
        } finally {
            System.clearProperty("pywire.parser.debugTokens");
            System.clearProperty("pywire.parser.debugTree");
        }
    }
}
