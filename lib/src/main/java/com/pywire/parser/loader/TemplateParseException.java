package com.pywire.parser.loader;

/**
 * Signals that no syntax tree could be produced for a template source. Ordinary syntax errors are not
 * reported this way; they are recovered into error nodes.
 */
public class TemplateParseException extends Exception {
    private final String sourceName;

    public TemplateParseException(String sourceName, String message) {
        super(sourceName + ": " + message);
        this.sourceName = sourceName;
    }

    public TemplateParseException(String sourceName, String message, Throwable cause) {
        super(sourceName + ": " + message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
