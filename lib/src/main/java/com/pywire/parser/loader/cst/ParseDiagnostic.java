package com.pywire.parser.loader.cst;

/**
 * A syntax problem the grammar recovered from. The offending input is still present in the tree as
 * an {@link SyntaxKind#ERROR} node or was skipped.
 */
public final class ParseDiagnostic {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    private final Level level;
    private final String message;
    private final String sourceName;
    private final int line;
    private final int column;

    public ParseDiagnostic(Level level, String message, String sourceName, int line, int column) {
        this.level = level;
        this.message = message;
        this.sourceName = sourceName;
        this.line = line;
        this.column = column;
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getSourceName() {
        return sourceName;
    }

    /** 1-based line. */
    public int getLine() {
        return line;
    }

    /** 0-based column. */
    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        return sourceName + ":" + line + ":" + column + ": " + level + " " + message;
    }
}
