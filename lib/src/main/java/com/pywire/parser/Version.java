package com.pywire.parser;

public final class Version {
    static final int MAJOR = 0;
    static final int MINOR = 2;
    static final int PATCH = 0;
    private static final String QUALIFIER = "unified-v2";

    public static final String FULL = MAJOR + "." + MINOR + "." + PATCH + "-" + QUALIFIER;
    public static final String ANTLR_VERSION = "4.13.1";

    private Version() {}
}
