package com.pywire.parser.loader;

import com.pywire.parser.Version;
import com.pywire.parser.loader.ast.DirectiveNode;
import com.pywire.parser.loader.ast.TemplateDocument;
import com.pywire.parser.loader.ast.TemplateNode;
import com.pywire.parser.loader.cst.AntlrTemplateGrammar;
import com.pywire.parser.loader.cst.SyntaxKind;
import com.pywire.parser.loader.cst.SyntaxNode;
import com.pywire.parser.loader.cst.SyntaxTree;
import com.pywire.parser.loader.cst.SyntaxTreeParser;
import com.pywire.parser.loader.cst.TemplateGrammar;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns PyWire template source into a {@link TemplateDocument}: directives, the frontmatter source
 * and the template tree.
 *
 * <p>The CST comes from a {@link TemplateGrammar}; only the root's {@code directives_section},
 * {@code frontmatter} and {@code template_section} children are read. Syntax errors never fail a
 * parse. They arrive as {@code ERROR} nodes and end up as inert text leaves.</p>
 *
 * <p>Instances are immutable and can be shared between threads; each call activates its own
 * parser.</p>
 */
public final class PyWireAstBuilder {
    private static final Logger LOGGER = Logger.getLogger(PyWireAstBuilder.class.getName());

    public static final String DEFAULT_SOURCE_NAME = "<string>";

    private final TemplateGrammar grammar;
    private final ParserSettings settings;

    public PyWireAstBuilder() {
        this(new AntlrTemplateGrammar(), ParserSettings.fromSystem());
    }

    public PyWireAstBuilder(TemplateGrammar grammar, ParserSettings settings) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /** Library version, e.g. {@code 0.2.0-unified-v2}. */
    public static String version() {
        return Version.FULL;
    }

    public TemplateDocument parse(String source) throws GrammarSetupException, TemplateParseException {
        return parse(DEFAULT_SOURCE_NAME, source);
    }

    public TemplateDocument parse(String sourceName, String source)
            throws GrammarSetupException, TemplateParseException {
        return build(parseTree(sourceName, source));
    }

    /** Runs only the grammar, keeping the CST and its recovered syntax errors. */
    public SyntaxTree parseTree(String sourceName, String source)
            throws GrammarSetupException, TemplateParseException {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(source, "source");
        SyntaxTreeParser parser = grammar.newParser(settings);
        SyntaxTree tree = parser.parse(sourceName, source);
        if (tree == null) {
            throw new TemplateParseException(sourceName, "Failed to parse source");
        }
        return tree;
    }

    /** Maps an already parsed tree. */
    public TemplateDocument build(SyntaxTree tree) throws TemplateNestingException {
        String source = tree.getSource();
        List<DirectiveNode> directives = new ArrayList<>();
        StringBuilder frontmatter = new StringBuilder();
        List<TemplateNode> template = new ArrayList<>();
        TemplateNodeBuilder nodeBuilder =
                new TemplateNodeBuilder(tree.getSourceName(), source, settings.getMaxNestingDepth());

        for (SyntaxNode child : tree.getRoot().getChildren()) {
            switch (child.getKind()) {
                case SyntaxKind.DIRECTIVES_SECTION:
                    for (SyntaxNode directive : child.getChildren()) {
                        directives.add(DirectiveExtractor.extract(directive, source));
                    }
                    break;
                case SyntaxKind.FRONTMATTER:
                    appendFrontmatter(child, source, frontmatter);
                    break;
                case SyntaxKind.TEMPLATE_SECTION:
                    for (SyntaxNode node : child.getChildren()) {
                        if (TemplateNodeBuilder.TOP_LEVEL_KINDS.contains(node.getKind())) {
                            template.add(nodeBuilder.build(node));
                        }
                    }
                    break;
                default:
                    break;
            }
        }

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(
                    String.format(
                            "Parsed %s: %d directives, %d frontmatter chars, %d top-level nodes, %d syntax errors",
                            tree.getSourceName(),
                            directives.size(),
                            frontmatter.length(),
                            template.size(),
                            tree.getDiagnostics().size()));
        }
        return new TemplateDocument(tree.getSourceName(), directives, frontmatter.toString(), template);
    }

    private static void appendFrontmatter(SyntaxNode frontmatter, String source, StringBuilder out) {
        SyntaxNode content = frontmatter.getField(SyntaxKind.FIELD_PYTHON_CONTENT);
        if (content != null) {
            out.append(content.text(source));
            return;
        }
        for (SyntaxNode child : frontmatter.getChildren()) {
            if (child.isKind(SyntaxKind.PYTHON_CONTENT)) {
                out.append(child.text(source));
            }
        }
    }
}
