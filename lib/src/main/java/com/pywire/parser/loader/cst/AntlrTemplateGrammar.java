package com.pywire.parser.loader.cst;

import com.pywire.parser.Version;
import com.pywire.parser.loader.GrammarSetupException;
import com.pywire.parser.loader.ParserSettings;
import com.pywire.parser.loader.grammar.PyWireLexer;
import com.pywire.parser.loader.grammar.PyWireParser;
import java.util.Objects;
import org.antlr.v4.runtime.RuntimeMetaData;

/**
 * The reference template grammar, generated by ANTLR from {@code PyWireLexer.g4} and {@code
 * PyWireParser.g4}.
 */
public final class AntlrTemplateGrammar implements TemplateGrammar {

    @Override
    public SyntaxTreeParser newParser(ParserSettings settings) throws GrammarSetupException {
        Objects.requireNonNull(settings, "settings");
        try {
            // Forces the generated recognizers' static ATN deserialization.
            if (PyWireLexer.VOCABULARY == null || PyWireParser.ruleNames.length == 0) {
                throw new GrammarSetupException("PyWire grammar tables are empty");
            }
            RuntimeMetaData.checkVersion(Version.ANTLR_VERSION, RuntimeMetaData.VERSION);
        } catch (ExceptionInInitializerError | IllegalStateException | UnsupportedOperationException ex) {
            throw new GrammarSetupException("Unable to load the PyWire grammar: " + ex.getMessage(), ex);
        }
        return new AntlrSyntaxTreeParser(settings);
    }
}
