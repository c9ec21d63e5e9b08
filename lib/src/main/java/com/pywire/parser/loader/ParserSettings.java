package com.pywire.parser.loader;

import java.util.logging.Level;
import java.util.logging.Logger;

/** Limits applied while parsing and mapping a template. */
public final class ParserSettings {
    private static final Logger LOGGER = Logger.getLogger(ParserSettings.class.getName());

    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    private static final String MAX_NESTING_DEPTH_PROPERTY = "pywire.parser.maxNestingDepth";
    /** Environment fallback kept for convenience; prefer using system properties. */
    private static final String MAX_NESTING_DEPTH_ENV = "PYWIRE_PARSER_MAX_NESTING_DEPTH";

    private static final ParserSettings DEFAULTS = new ParserSettings(DEFAULT_MAX_NESTING_DEPTH);

    private final int maxNestingDepth;

    private ParserSettings(int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be >= 1: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    public static ParserSettings defaults() {
        return DEFAULTS;
    }

    /** Reads overrides from system properties, then the environment, then falls back to defaults. */
    public static ParserSettings fromSystem() {
        String value = System.getProperty(MAX_NESTING_DEPTH_PROPERTY);
        String origin = MAX_NESTING_DEPTH_PROPERTY;
        if (value == null) {
            value = System.getenv(MAX_NESTING_DEPTH_ENV);
            origin = MAX_NESTING_DEPTH_ENV;
        }
        if (value == null || value.isBlank()) {
            return DEFAULTS;
        }
        try {
            return new ParserSettings(Integer.parseInt(value.trim()));
        } catch (IllegalArgumentException ex) {
            LOGGER.log(
                    Level.WARNING,
                    "Ignoring invalid " + origin + "=" + value + ", using " + DEFAULT_MAX_NESTING_DEPTH,
                    ex);
            return DEFAULTS;
        }
    }

    public ParserSettings withMaxNestingDepth(int maxNestingDepth) {
        return new ParserSettings(maxNestingDepth);
    }

    /** Deepest allowed element nesting; a top-level element is at depth 1. */
    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }
}
