package com.pywire.parser.loader.ast;

import java.util.Objects;

/** {@code name}, {@code name="value"}, {@code name='value'} or {@code name={expr}}. */
public final class PlainAttributeNode extends AttributeNode {
    private final String name;
    private final String value;

    public PlainAttributeNode(String name, String value) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = value;
    }

    public String getName() {
        return name;
    }

    /** Value with one pair of matching quotes removed, or {@code null} for a boolean attribute. */
    @Override
    public String getValue() {
        return value;
    }

    public boolean isBoolean() {
        return value == null;
    }

    @Override
    public String getKey() {
        return name;
    }

    @Override
    public String toString() {
        return value == null ? name : name + "=" + value;
    }
}
