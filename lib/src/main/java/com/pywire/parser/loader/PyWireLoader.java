package com.pywire.parser.loader;

import com.pywire.parser.loader.ast.TemplateDocument;
import com.pywire.parser.loader.cst.SyntaxTree;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** Entry point for loading {@code .wire} template files from disk. */
public final class PyWireLoader {
    private final PyWireAstBuilder builder;

    public PyWireLoader() {
        this(new PyWireAstBuilder());
    }

    public PyWireLoader(PyWireAstBuilder builder) {
        this.builder = Objects.requireNonNull(builder, "builder");
    }

    public LoaderResult load(Path templatePath) throws LoaderException {
        Objects.requireNonNull(templatePath, "templatePath");
        String source;
        try {
            source = Files.readString(templatePath, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new LoaderException("Unable to read template " + templatePath, ex);
        }
        String sourceName = templatePath.toString();
        try {
            SyntaxTree tree = builder.parseTree(sourceName, source);
            TemplateDocument document = builder.build(tree);
            return new LoaderResult(document, tree.getDiagnostics());
        } catch (GrammarSetupException ex) {
            throw new LoaderException("Template grammar unavailable: " + ex.getMessage(), ex);
        } catch (TemplateParseException ex) {
            throw new LoaderException("Unable to parse template " + templatePath, ex);
        }
    }
}
