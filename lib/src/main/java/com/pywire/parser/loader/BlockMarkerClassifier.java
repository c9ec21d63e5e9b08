package com.pywire.parser.loader;

import java.util.List;

/** Reads the keyword and expression out of {@code {$keyword expr}} and {@code {/keyword}} markers. */
final class BlockMarkerClassifier {
    /**
     * Recognized opener keywords. Order matters: the first entry that prefixes the marker wins and
     * no word boundary is required after it.
     */
    static final List<String> KEYWORDS =
            List.of("if", "for", "try", "await", "elif", "else", "finally", "except", "then", "catch", "html");

    private static final String OPEN_PREFIX = "{$";
    private static final String CLOSE_PREFIX = "{/";

    record BlockMarker(String keyword, String expression) {}

    private BlockMarkerClassifier() {}

    /** Keyword and expression of an opener; both are {@code null} when no keyword matches. */
    static BlockMarker classifyOpener(String text) {
        String inner = unwrap(text, OPEN_PREFIX);
        for (String keyword : KEYWORDS) {
            if (inner.startsWith(keyword)) {
                String rest = UnicodeWhitespace.strip(inner.substring(keyword.length()));
                return new BlockMarker(keyword, rest.isEmpty() ? null : rest);
            }
        }
        return new BlockMarker(null, null);
    }

    /** Closers carry their keyword with a leading {@code /} and never an expression. */
    static BlockMarker classifyCloser(String text) {
        return new BlockMarker("/" + unwrap(text, CLOSE_PREFIX), null);
    }

    private static String unwrap(String text, String prefix) {
        String inner = text.startsWith(prefix) ? text.substring(prefix.length()) : text;
        return inner.endsWith("}") ? inner.substring(0, inner.length() - 1) : inner;
    }
}
