package com.pywire.parser.loader.cst;

/** Node kinds and field names shared by every {@link TemplateGrammar}. */
public final class SyntaxKind {
    public static final String DOCUMENT = "document";
    public static final String DIRECTIVES_SECTION = "directives_section";
    public static final String DIRECTIVE = "directive";
    public static final String FRONTMATTER = "frontmatter";
    public static final String PYTHON_CONTENT = "python_content";
    public static final String PYTHON_LINE = "python_line";
    public static final String TEMPLATE_SECTION = "template_section";

    public static final String TAG = "tag";
    public static final String SELF_CLOSING_TAG = "self_closing_tag";
    public static final String VOID_TAG = "void_tag";
    public static final String SCRIPT_TAG = "script_tag";
    public static final String STYLE_TAG = "style_tag";
    public static final String RAW_TEXT = "raw_text";
    public static final String START_TAG = "start_tag";
    public static final String END_TAG = "end_tag";

    public static final String ATTRIBUTE = "attribute";
    public static final String ATTRIBUTE_NAME = "attribute_name";
    public static final String ATTRIBUTE_VALUE = "attribute_value";
    public static final String ATTRIBUTE_SHORTHAND = "attribute_shorthand";
    public static final String SPREAD_SHORTHAND = "spread_shorthand";

    public static final String TEXT = "text";
    public static final String INTERPOLATION = "interpolation";
    public static final String EXPRESSION = "expression";
    public static final String BRACE_BLOCK = "brace_block";
    public static final String END_BRACE_BLOCK = "end_brace_block";
    public static final String DOCTYPE = "doctype";
    public static final String COMMENT = "comment";
    public static final String HYPHEN = "hyphen";
    public static final String BANG = "bang";
    public static final String ERROR = "ERROR";

    // Anonymous tokens.
    public static final String TAG_CLOSE = ">";
    public static final String TAG_SELF_CLOSE = "/>";
    public static final String SCRIPT_END = "</script>";
    public static final String STYLE_END = "</style>";

    public static final String FIELD_NAME = "name";
    public static final String FIELD_VALUE = "value";
    public static final String FIELD_START_TAG = "start_tag";
    public static final String FIELD_EXPR = "expr";
    public static final String FIELD_PYTHON_CONTENT = "python_content";

    private SyntaxKind() {}
}
