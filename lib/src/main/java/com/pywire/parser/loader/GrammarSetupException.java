package com.pywire.parser.loader;

/** Signals that the template grammar could not be activated. */
public final class GrammarSetupException extends Exception {
    public GrammarSetupException(String message) {
        super(message);
    }

    public GrammarSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
