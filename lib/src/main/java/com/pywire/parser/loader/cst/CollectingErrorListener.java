package com.pywire.parser.loader.cst;

import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/** Records parser syntax errors instead of aborting, so recovery can keep building the tree. */
final class CollectingErrorListener extends BaseErrorListener {
    private final String sourceName;
    private final List<ParseDiagnostic> diagnostics = new ArrayList<>();

    CollectingErrorListener(String sourceName) {
        this.sourceName = sourceName;
    }

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        diagnostics.add(
                new ParseDiagnostic(
                        ParseDiagnostic.Level.WARNING, msg, sourceName, line, charPositionInLine));
    }

    List<ParseDiagnostic> getDiagnostics() {
        return diagnostics;
    }
}
