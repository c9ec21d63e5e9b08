package com.pywire.parser.loader.cst;

import com.pywire.parser.loader.GrammarSetupException;
import com.pywire.parser.loader.ParserSettings;

/** Source of CST parsers for the template language. */
public interface TemplateGrammar {

    /**
     * Activates the grammar and returns a parser ready for use. A parser is not required to be
     * thread-safe; callers must not share one between threads.
     *
     * @throws GrammarSetupException if the grammar cannot be loaded
     */
    SyntaxTreeParser newParser(ParserSettings settings) throws GrammarSetupException;
}
