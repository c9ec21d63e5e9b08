package com.pywire.parser.loader;

import com.pywire.parser.loader.ast.TemplateDocument;
import com.pywire.parser.loader.cst.ParseDiagnostic;
import java.util.List;

/** Container for the results of loading a template file. */
public final class LoaderResult {
    private final TemplateDocument document;
    private final List<ParseDiagnostic> messages;

    public LoaderResult(TemplateDocument document, List<ParseDiagnostic> messages) {
        this.document = document;
        this.messages = List.copyOf(messages);
    }

    public TemplateDocument getDocument() {
        return document;
    }

    /** Syntax errors the grammar recovered from, in source order. */
    public List<ParseDiagnostic> getMessages() {
        return messages;
    }

    public boolean hasErrors() {
        return !messages.isEmpty();
    }
}
