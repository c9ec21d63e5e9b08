package com.pywire.parser.loader.cst;

import java.util.List;

/**
 * A node of the concrete syntax tree produced by a {@link TemplateGrammar}. Offsets are {@code
 * char} indexes into the parsed source; the end offset is exclusive.
 */
public interface SyntaxNode {

    /** Node kind from the {@link SyntaxKind} vocabulary, or the literal text of an anonymous token. */
    String getKind();

    int getStartOffset();

    int getEndOffset();

    /** 0-based row of the first character. */
    int getStartRow();

    /** 0-based column of the first character within its row. */
    int getStartColumn();

    /** Direct children in source order. */
    List<SyntaxNode> getChildren();

    /**
     * Child registered under the given field name.
     *
     * @return the child, or {@code null} when the field is absent on this node
     */
    SyntaxNode getField(String name);

    default boolean isKind(String kind) {
        return getKind().equals(kind);
    }

    default String text(String source) {
        return source.substring(getStartOffset(), getEndOffset());
    }
}
