package com.pywire.parser.loader.ast;

/**
 * One entry of an element's attribute list.
 *
 * <p>{@link #getKey()} and {@link #getValue()} give the flat form used by {@link
 * TemplateNode#attributeMap()}, where shorthand and spread entries live under reserved keys.</p>
 */
public abstract class AttributeNode {

    public static final String SHORTHAND_KEY_PREFIX = "__pw_sh_";
    public static final String SPREAD_KEY = "__pywire_spread__";

    AttributeNode() {}

    public abstract String getKey();

    public abstract String getValue();
}
