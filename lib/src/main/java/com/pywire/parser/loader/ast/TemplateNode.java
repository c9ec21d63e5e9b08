package com.pywire.parser.loader.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node of the template tree: an element, a text leaf, an interpolation, a block marker or the raw
 * body of a script/style element. Each node owns its children exclusively.
 */
public final class TemplateNode {
    public static final String INTERPOLATION_KEYWORD = "interpolation";

    private final String tag;
    private final boolean block;
    private final String blockKeyword;
    private final String textContent;
    private final String expression;
    private final List<AttributeNode> attributes;
    private final List<TemplateNode> children;
    private final SourcePosition position;
    private final boolean raw;

    private TemplateNode(Builder builder) {
        this.tag = builder.tag;
        this.block = builder.block;
        this.blockKeyword = builder.blockKeyword;
        this.textContent = builder.textContent;
        this.expression = builder.expression;
        this.attributes = List.copyOf(builder.attributes);
        this.children = List.copyOf(builder.children);
        this.position = builder.position;
        this.raw = builder.raw;
    }

    public static Builder builder(SourcePosition position) {
        return new Builder(position);
    }

    /** Verbatim text of a script or style body. */
    public static TemplateNode rawText(String text, SourcePosition position) {
        Builder builder = new Builder(position);
        builder.textContent = Objects.requireNonNull(text, "text");
        builder.raw = true;
        return builder.build();
    }

    public String getTag() {
        return tag;
    }

    public boolean isElement() {
        return tag != null;
    }

    /** True for block markers ({@code {$if x}}, {@code {/if}}) and interpolations. */
    public boolean isBlock() {
        return block;
    }

    /**
     * The control-flow keyword, {@code /keyword} for closers, {@link #INTERPOLATION_KEYWORD} for
     * interpolations, or {@code null} when an opener did not match any known keyword.
     */
    public String getBlockKeyword() {
        return blockKeyword;
    }

    public boolean isInterpolation() {
        return block && INTERPOLATION_KEYWORD.equals(blockKeyword);
    }

    public boolean isBlockCloser() {
        return block && blockKeyword != null && blockKeyword.startsWith("/");
    }

    public String getTextContent() {
        return textContent;
    }

    public String getExpression() {
        return expression;
    }

    public List<AttributeNode> getAttributes() {
        return attributes;
    }

    /**
     * Flat attribute view keyed by attribute name, with shorthand entries under {@code
     * __pw_sh_<name>} and the spread entry under {@code __pywire_spread__}. Iteration follows
     * source order of first occurrence; a later entry with the same key replaces the value of an
     * earlier one. Boolean attributes map to {@code null}.
     */
    public Map<String, String> attributeMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (AttributeNode attribute : attributes) {
            map.put(attribute.getKey(), attribute.getValue());
        }
        return Collections.unmodifiableMap(map);
    }

    public List<TemplateNode> getChildren() {
        return children;
    }

    public SourcePosition getPosition() {
        return position;
    }

    public boolean isRaw() {
        return raw;
    }

    @Override
    public String toString() {
        if (tag != null) {
            return "<" + tag + "> @" + position;
        }
        if (block) {
            return "{" + blockKeyword + (expression == null ? "" : " " + expression) + "} @" + position;
        }
        return "text(" + textContent + ") @" + position;
    }

    public static final class Builder {
        private final SourcePosition position;
        private String tag;
        private boolean block;
        private String blockKeyword;
        private String textContent;
        private String expression;
        private boolean raw;
        private final List<AttributeNode> attributes = new ArrayList<>();
        private final List<TemplateNode> children = new ArrayList<>();

        private Builder(SourcePosition position) {
            this.position = Objects.requireNonNull(position, "position");
        }

        public Builder tag(String tag) {
            this.tag = tag;
            return this;
        }

        public Builder block(String blockKeyword, String expression) {
            this.block = true;
            this.blockKeyword = blockKeyword;
            this.expression = expression;
            return this;
        }

        public Builder textContent(String textContent) {
            this.textContent = textContent;
            return this;
        }

        public Builder attribute(AttributeNode attribute) {
            attributes.add(Objects.requireNonNull(attribute, "attribute"));
            return this;
        }

        public Builder child(TemplateNode child) {
            children.add(Objects.requireNonNull(child, "child"));
            return this;
        }

        public TemplateNode build() {
            return new TemplateNode(this);
        }
    }
}
