package com.pywire.parser.loader.cst;

import com.pywire.parser.loader.TemplateParseException;

/** Turns template source text into a concrete syntax tree. */
public interface SyntaxTreeParser {

    /**
     * Parses {@code source}. Syntax errors do not fail the call; they surface as {@link
     * SyntaxKind#ERROR} nodes and as diagnostics on the returned tree.
     *
     * @throws TemplateParseException if no tree could be produced
     */
    SyntaxTree parse(String sourceName, String source) throws TemplateParseException;
}
