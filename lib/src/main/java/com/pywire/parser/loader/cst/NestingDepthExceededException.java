package com.pywire.parser.loader.cst;

import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/** Thrown by the generated parser when element nesting crosses the configured limit. */
public final class NestingDepthExceededException extends ParseCancellationException {
    private final int maxDepth;
    private final int line;

    public NestingDepthExceededException(int maxDepth, Token token) {
        super("nesting depth exceeds " + maxDepth);
        this.maxDepth = maxDepth;
        this.line = token != null ? token.getLine() : 0;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getLine() {
        return line;
    }
}
