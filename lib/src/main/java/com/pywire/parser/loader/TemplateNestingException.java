package com.pywire.parser.loader;

/** Element nesting went deeper than {@link ParserSettings#getMaxNestingDepth()}. */
public final class TemplateNestingException extends TemplateParseException {
    private final int maxDepth;
    private final int line;

    public TemplateNestingException(String sourceName, int maxDepth, int line) {
        super(sourceName, "template nesting exceeds " + maxDepth + " levels at line " + line);
        this.maxDepth = maxDepth;
        this.line = line;
    }

    public TemplateNestingException(String sourceName, int maxDepth, int line, Throwable cause) {
        super(sourceName, "template nesting exceeds " + maxDepth + " levels at line " + line, cause);
        this.maxDepth = maxDepth;
        this.line = line;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /** 1-based line of the element that crossed the limit. */
    public int getLine() {
        return line;
    }
}
