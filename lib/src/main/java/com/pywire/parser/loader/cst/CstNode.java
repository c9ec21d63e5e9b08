package com.pywire.parser.loader.cst;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Immutable {@link SyntaxNode}. */
public final class CstNode implements SyntaxNode {
    private final String kind;
    private final int startOffset;
    private final int endOffset;
    private final int startRow;
    private final int startColumn;
    private final List<SyntaxNode> children;
    private final Map<String, SyntaxNode> fields;

    private CstNode(Builder builder) {
        this.kind = builder.kind;
        this.startOffset = builder.startOffset;
        this.endOffset = builder.endOffset;
        this.startRow = builder.startRow;
        this.startColumn = builder.startColumn;
        this.children = List.copyOf(builder.children);
        this.fields = Map.copyOf(builder.fields);
    }

    public static Builder builder(String kind) {
        return new Builder(kind);
    }

    @Override
    public String getKind() {
        return kind;
    }

    @Override
    public int getStartOffset() {
        return startOffset;
    }

    @Override
    public int getEndOffset() {
        return endOffset;
    }

    @Override
    public int getStartRow() {
        return startRow;
    }

    @Override
    public int getStartColumn() {
        return startColumn;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children;
    }

    @Override
    public SyntaxNode getField(String name) {
        return fields.get(name);
    }

    @Override
    public String toString() {
        return kind + "[" + startOffset + ".." + endOffset + ")";
    }

    public static final class Builder {
        private final String kind;
        private int startOffset;
        private int endOffset;
        private int startRow;
        private int startColumn;
        private final List<SyntaxNode> children = new ArrayList<>();
        private final Map<String, SyntaxNode> fields = new LinkedHashMap<>();

        private Builder(String kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public Builder range(int startOffset, int endOffset) {
            if (startOffset < 0 || endOffset < startOffset) {
                throw new IllegalArgumentException(
                        "invalid range [" + startOffset + ", " + endOffset + ")");
            }
            this.startOffset = startOffset;
            this.endOffset = endOffset;
            return this;
        }

        public Builder start(int row, int column) {
            this.startRow = row;
            this.startColumn = column;
            return this;
        }

        /** Sets the range and derives the start row and column from {@code lineIndex}. */
        public Builder span(LineIndex lineIndex, int startOffset, int endOffset) {
            range(startOffset, endOffset);
            return start(lineIndex.rowOf(startOffset), lineIndex.columnOf(startOffset));
        }

        public Builder child(SyntaxNode child) {
            children.add(Objects.requireNonNull(child, "child"));
            return this;
        }

        public Builder children(List<? extends SyntaxNode> nodes) {
            for (SyntaxNode node : nodes) {
                child(node);
            }
            return this;
        }

        /** Adds {@code child} and registers it under {@code name}. */
        public Builder field(String name, SyntaxNode child) {
            child(child);
            return fieldRef(name, child);
        }

        /** Registers an already added child under {@code name}. */
        public Builder fieldRef(String name, SyntaxNode child) {
            fields.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(child, "child"));
            return this;
        }

        public CstNode build() {
            return new CstNode(this);
        }
    }
}
