package com.pywire.parser.loader.ast;

import java.util.List;
import java.util.Objects;

/** The normalized form of one template file. */
public final class TemplateDocument {
    private final String sourceName;
    private final List<DirectiveNode> directives;
    private final String frontmatterSource;
    private final List<TemplateNode> template;

    public TemplateDocument(
            String sourceName,
            List<DirectiveNode> directives,
            String frontmatterSource,
            List<TemplateNode> template) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.directives = List.copyOf(directives);
        this.frontmatterSource = Objects.requireNonNull(frontmatterSource, "frontmatterSource");
        this.template = List.copyOf(template);
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<DirectiveNode> getDirectives() {
        return directives;
    }

    /** The embedded scripting source copied verbatim; empty when the file has no frontmatter. */
    public String getFrontmatterSource() {
        return frontmatterSource;
    }

    public List<TemplateNode> getTemplate() {
        return template;
    }
}
