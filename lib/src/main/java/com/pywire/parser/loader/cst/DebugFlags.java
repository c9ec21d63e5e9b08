package com.pywire.parser.loader.cst;

import com.pywire.parser.loader.grammar.PyWireLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

public final class DebugFlags {
    private static final String TOKENS_PROPERTY = "pywire.parser.debugTokens";
    private static final String TREE_PROPERTY = "pywire.parser.debugTree";
    /** Environment fallback kept for convenience; prefer using system properties. */
    private static final String TOKENS_ENV = "PYWIRE_PARSER_DEBUG_TOKENS";
    private static final String TREE_ENV = "PYWIRE_PARSER_DEBUG_TREE";
    private static final ThreadLocal<List<String>> CAPTURED_TOKENS =
            ThreadLocal.withInitial(ArrayList::new);
    private static final ThreadLocal<List<String>> CAPTURED_TREE =
            ThreadLocal.withInitial(ArrayList::new);

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        return flag(TOKENS_PROPERTY, TOKENS_ENV);
    }

    public static boolean isTreeDebugEnabled() {
        return flag(TREE_PROPERTY, TREE_ENV);
    }

    private static boolean flag(String property, String env) {
        String value = System.getProperty(property);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(env));
    }

    public static void logTokens(CommonTokenStream tokens, PyWireLexer lexer) {
        System.err.println("[PyWire parser] Token dump for debugging:");
        for (Token token : tokens.getTokens()) {
            String symbolic = lexer.getVocabulary().getSymbolicName(token.getType());
            if (symbolic == null) {
                symbolic = String.format(Locale.ROOT, "#%d", token.getType());
            }
            String line =
                    String.format(
                            Locale.ROOT,
                            "%-20s @ %4d:%-3d -> %s",
                            symbolic,
                            token.getLine(),
                            token.getCharPositionInLine(),
                            escape(token.getText()));
            System.err.printf(Locale.ROOT, "  %s%n", line);
            CAPTURED_TOKENS.get().add(line);
        }
    }

    /** Prints the CST one node per line, indented by depth, the way tree-sitter's debug output reads. */
    public static void logTree(SyntaxNode root, String source) {
        System.err.println("[PyWire parser] CST dump for debugging:");
        List<String> lines = new ArrayList<>();
        appendTree(root, source, 0, lines);
        for (String line : lines) {
            System.err.printf(Locale.ROOT, "  %s%n", line);
        }
        CAPTURED_TREE.get().addAll(lines);
    }

    private static void appendTree(SyntaxNode node, String source, int depth, List<String> out) {
        out.add(
                String.format(
                        Locale.ROOT,
                        "%s%s @ %d:%d - '%s'",
                        "  ".repeat(depth),
                        node.getKind(),
                        node.getStartRow() + 1,
                        node.getStartColumn(),
                        escape(node.text(source))));
        for (SyntaxNode child : node.getChildren()) {
            appendTree(child, source, depth + 1, out);
        }
    }

    private static String escape(String text) {
        return text.replace("\r", "\\r").replace("\n", "\\n").replace("\t", "\\t");
    }

    public static List<String> drainCapturedTokens() {
        List<String> captured = new ArrayList<>(CAPTURED_TOKENS.get());
        CAPTURED_TOKENS.get().clear();
        return captured;
    }

    public static List<String> drainCapturedTree() {
        List<String> captured = new ArrayList<>(CAPTURED_TREE.get());
        CAPTURED_TREE.get().clear();
        return captured;
    }
}
