package com.pywire.parser.loader.cst;

import java.util.List;
import java.util.Objects;

/** A parsed source: its text, the CST root and any recovered syntax errors. */
public final class SyntaxTree {
    private final String sourceName;
    private final String source;
    private final SyntaxNode root;
    private final List<ParseDiagnostic> diagnostics;

    public SyntaxTree(String sourceName, String source, SyntaxNode root, List<ParseDiagnostic> diagnostics) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.source = Objects.requireNonNull(source, "source");
        this.root = Objects.requireNonNull(root, "root");
        this.diagnostics = List.copyOf(diagnostics);
    }

    public SyntaxTree(String sourceName, String source, SyntaxNode root) {
        this(sourceName, source, root, List.of());
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getSource() {
        return source;
    }

    public SyntaxNode getRoot() {
        return root;
    }

    public List<ParseDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }
}
