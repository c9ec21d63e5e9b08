package com.pywire.parser.loader.ast;

import java.util.Objects;

/** {@code {name}}: an attribute whose value is the variable of the same name. */
public final class ShorthandAttributeNode extends AttributeNode {
    private final String name;
    private final String sourceText;

    public ShorthandAttributeNode(String name, String sourceText) {
        this.name = Objects.requireNonNull(name, "name");
        this.sourceText = Objects.requireNonNull(sourceText, "sourceText");
    }

    public String getName() {
        return name;
    }

    /** The bracketed text exactly as written, braces included. */
    public String getSourceText() {
        return sourceText;
    }

    @Override
    public String getKey() {
        return SHORTHAND_KEY_PREFIX + name;
    }

    @Override
    public String getValue() {
        return sourceText;
    }

    @Override
    public String toString() {
        return sourceText;
    }
}
