package com.pywire.parser.loader.cst;

import com.pywire.parser.loader.ParserSettings;
import com.pywire.parser.loader.TemplateNestingException;
import com.pywire.parser.loader.TemplateParseException;
import com.pywire.parser.loader.grammar.PyWireLexer;
import com.pywire.parser.loader.grammar.PyWireParser;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/** {@link SyntaxTreeParser} backed by the generated ANTLR lexer and parser. */
final class AntlrSyntaxTreeParser implements SyntaxTreeParser {
    private static final Logger LOGGER = Logger.getLogger(AntlrSyntaxTreeParser.class.getName());

    private final ParserSettings settings;

    AntlrSyntaxTreeParser(ParserSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public SyntaxTree parse(String sourceName, String source) throws TemplateParseException {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(source, "source");

        CharStream stream = CharStreams.fromString(source, sourceName);
        PyWireLexer lexer = new PyWireLexer(stream);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        PyWireParser parser = new PyWireParser(tokens);
        parser.removeErrorListeners();
        CollectingErrorListener errors = new CollectingErrorListener(sourceName);
        parser.addErrorListener(errors);
        parser.setMaxNestingDepth(settings.getMaxNestingDepth());

        SyntaxNode root;
        try {
            if (DebugFlags.isTokenDebugEnabled()) {
                tokens.fill();
                DebugFlags.logTokens(tokens, lexer);
                tokens.seek(0);
            }
            PyWireParser.DocumentContext context = parser.document();
            root = new ParseTreeConverter(source).convert(context);
        } catch (NestingDepthExceededException ex) {
            throw new TemplateNestingException(sourceName, ex.getMaxDepth(), ex.getLine(), ex);
        } catch (ParseCancellationException ex) {
            throw new TemplateParseException(sourceName, ex.getMessage(), ex);
        }

        if (DebugFlags.isTreeDebugEnabled()) {
            DebugFlags.logTree(root, source);
        }
        for (ParseDiagnostic diagnostic : errors.getDiagnostics()) {
            LOGGER.log(Level.WARNING, "Recovered syntax error: {0}", diagnostic);
        }
        return new SyntaxTree(sourceName, source, root, errors.getDiagnostics());
    }
}
