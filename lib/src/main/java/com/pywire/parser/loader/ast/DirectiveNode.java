package com.pywire.parser.loader.ast;

import java.util.Objects;

/** A {@code !name content} line from the directive section. */
public final class DirectiveNode {
    private final String name;
    private final String content;
    private final SourcePosition position;

    public DirectiveNode(String name, String content, SourcePosition position) {
        this.name = Objects.requireNonNull(name, "name");
        this.content = content;
        this.position = Objects.requireNonNull(position, "position");
    }

    /** Directive name; may be empty when the line carries no word characters after the {@code !}. */
    public String getName() {
        return name;
    }

    /** Trimmed text after the name, or {@code null} when nothing follows it. */
    public String getContent() {
        return content;
    }

    public SourcePosition getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return content == null ? "!" + name : "!" + name + " " + content;
    }
}
