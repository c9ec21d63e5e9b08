package com.pywire.parser.loader.ast;

import java.util.Objects;

/** {@code {**expr}}: the mapping produced by {@code expr} supplies several attributes at once. */
public final class SpreadAttributeNode extends AttributeNode {
    private final String sourceText;

    public SpreadAttributeNode(String sourceText) {
        this.sourceText = Objects.requireNonNull(sourceText, "sourceText");
    }

    /** The bracketed text exactly as written, braces and {@code **} included. */
    public String getSourceText() {
        return sourceText;
    }

    /** The spread expression without braces and the leading {@code **}. */
    public String getExpression() {
        String inner = sourceText;
        if (inner.startsWith("{")) {
            inner = inner.substring(1);
        }
        if (inner.endsWith("}")) {
            inner = inner.substring(0, inner.length() - 1);
        }
        inner = inner.strip();
        if (inner.startsWith("**")) {
            inner = inner.substring(2);
        }
        return inner.strip();
    }

    @Override
    public String getKey() {
        return SPREAD_KEY;
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
