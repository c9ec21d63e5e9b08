package com.pywire.parser.loader;

/**
 * Trimming over the Unicode {@code White_Space} set. Unlike {@link String#strip()} this also removes
 * no-break spaces (U+00A0, U+2007, U+202F) and U+0085.
 */
final class UnicodeWhitespace {

    private UnicodeWhitespace() {}

    static boolean isWhitespace(int codePoint) {
        return Character.isSpaceChar(codePoint)
                || (codePoint >= '\t' && codePoint <= '\r')
                || codePoint == '\u0085';
    }

    static String strip(String text) {
        int start = 0;
        int end = text.length();
        while (start < end) {
            int codePoint = text.codePointAt(start);
            if (!isWhitespace(codePoint)) {
                break;
            }
            start += Character.charCount(codePoint);
        }
        while (end > start) {
            int codePoint = text.codePointBefore(end);
            if (!isWhitespace(codePoint)) {
                break;
            }
            end -= Character.charCount(codePoint);
        }
        return text.substring(start, end);
    }
}
