package com.pywire.parser.loader;

/**
 * Checked exception signalling that a template file could not be loaded, either because it could
 * not be read or because it could not be parsed.
 */
public final class LoaderException extends Exception {
    public LoaderException(String message) {
        super(message);
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
